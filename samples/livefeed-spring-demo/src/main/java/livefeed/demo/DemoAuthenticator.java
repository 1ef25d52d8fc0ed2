package livefeed.demo;

import livefeed.AccountId;
import livefeed.netty.Authenticator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Accepts tokens of the form {@code demo-<accountId>}. Stands in for real token verification.
 */
@Component
public class DemoAuthenticator implements Authenticator {

    static final String PREFIX = "demo-";

    @Override
    public Optional<AccountId> authenticate(String accessToken) {
        if (!accessToken.startsWith(PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(AccountId.of(Long.parseLong(accessToken.substring(PREFIX.length()))));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
