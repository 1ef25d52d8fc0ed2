package livefeed.netty;

import livefeed.AccountId;

import java.util.Optional;

/**
 * Resolves the {@code access_token} query parameter of a WebSocket upgrade request to the
 * account the connection acts as.
 *
 * <p>Called on the connection's I/O thread, so implementations must not block. Returning empty
 * or throwing rejects the upgrade with {@code 401 Unauthorized}.
 */
@FunctionalInterface
public interface Authenticator {
  Optional<AccountId> authenticate(String accessToken) throws Exception;
}
