package ca.gc.cra.trace.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValueIsReturnedUnchanged() {
    String title = "Secure sign-in";
    assertSame(title, Logs.truncate(title, 64));
  }

  @Test
  void longValueIsCutAndAnnotated() {
    assertEquals("Secur... (truncated, 5 of 14 bytes)", Logs.truncate("Secure sign-in", 5));
  }

  @Test
  void multiByteCharacterIsNotSplit() {
    String truncated = Logs.truncate("Défense", 2);
    assertTrue(truncated.startsWith("D..."), truncated);
  }

  @Test
  void nullAndNonPositiveBudget() {
    assertEquals("<null>", Logs.truncate(null, 4));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
