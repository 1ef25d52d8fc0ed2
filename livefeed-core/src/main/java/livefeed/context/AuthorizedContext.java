package livefeed.context;

import livefeed.AccountId;

/**
 * Transaction context scoped to an account. The account is bound into the store session
 * for this transaction only, so row-level policies apply to every query.
 */
public interface AuthorizedContext extends UnauthorizedContext {
  AccountId accountId();
}
