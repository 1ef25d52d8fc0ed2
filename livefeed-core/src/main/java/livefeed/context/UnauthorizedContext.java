package livefeed.context;

/**
 * Transaction context with no account bound. Store-side row policies see no account.
 */
public interface UnauthorizedContext extends QueryContext {
}
