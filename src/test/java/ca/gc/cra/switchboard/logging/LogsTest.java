package ca.gc.cra.switchboard.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void truncateReportsOriginalLength() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncateDropsPartialCodepoints() {
    String value = "éé";
    assertTrue(Logs.truncate(value, 3).startsWith("é..."));
  }

  @Test
  void payloadRedactsSensitiveKeys() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("wave", 3);
    payload.put("Password", "hunter2");
    payload.put("note", null);

    assertEquals("{wave=3, Password=[REDACTED], note=null}", Logs.payload(payload, 256));
    assertEquals("<null>", Logs.payload(null, 256));
  }
}
