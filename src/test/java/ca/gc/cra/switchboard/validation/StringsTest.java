package ca.gc.cra.switchboard.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void requireNonBlankTrims() {
    assertEquals("Dispenser", Strings.requireNonBlank("className", "  Dispenser "));
  }

  @Test
  void requireNonBlankRejectsBadInput() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("id", null));
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("id", "   "));
    assertEquals("id must not be blank", blank.getMessage());
    IllegalArgumentException control =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank(null, "a\nb"));
    assertEquals("value must not contain control characters", control.getMessage());
  }

  @Test
  void orDefaultFallsBackOnBlank() {
    assertEquals("server", Strings.orDefault(" ", "server"));
    assertEquals("client", Strings.orDefault(" client ", "server"));
  }
}
