package livefeed;

/**
 * Identifier of an authenticated account. Always positive.
 *
 * <p>The value is pushed into the store session of authorized transactions, so it is
 * validated as a number here and never carried around as raw text.
 */
public record AccountId(long value) {

  public AccountId {
    if (value <= 0) {
      throw new IllegalArgumentException("accountId must be > 0, got " + value);
    }
  }

  public static AccountId of(long value) {
    return new AccountId(value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
