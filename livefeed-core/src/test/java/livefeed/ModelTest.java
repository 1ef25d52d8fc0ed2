package livefeed;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

  @Test
  void accountIdMustBePositive() {
    assertEquals(7L, AccountId.of(7).value());
    assertEquals("7", AccountId.of(7).toString());
    assertThrows(IllegalArgumentException.class, () -> AccountId.of(0));
    assertThrows(IllegalArgumentException.class, () -> AccountId.of(-3));
  }

  @Test
  void channelNamesAreSafeIdentifiers() {
    assertEquals("comment_insert", Channel.of("comment_insert", String.class).name());
    assertTrue(Channel.isValidName("a1_b"));

    for (String bad : new String[]{"", "1abc", "Upper", "with-dash", "quote\"", "a b", "x".repeat(49)}) {
      assertThrows(IllegalArgumentException.class, () -> Channel.of(bad, String.class), bad);
    }
    assertTrue(Channel.isValidName("x".repeat(48)));
  }

  @Test
  void sqlQueryCopiesParamsAndAllowsNulls() {
    Object[] params = {1, null, "x"};
    SqlQuery query = SqlQuery.of("SELECT ?, ?, ?", params);
    params[0] = 99;

    assertEquals(Arrays.asList(1, null, "x"), query.params());
    assertThrows(UnsupportedOperationException.class, () -> query.params().add(2));
    assertEquals(0, SqlQuery.of("SELECT 1").params().size());
  }

  @Test
  void apiExceptionCarriesCode() {
    ApiException e = new ApiException(ApiErrorCode.UNAUTHORIZED);

    assertEquals(ApiErrorCode.UNAUTHORIZED, e.code());
    assertEquals("UNAUTHORIZED", e.getMessage());
  }
}
