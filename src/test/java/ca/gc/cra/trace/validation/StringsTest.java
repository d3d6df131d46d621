package ca.gc.cra.trace.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireUpperLettersAcceptsPrefix() {
    assertEquals("REQ", Strings.requireUpperLetters("idPrefix", " REQ ", 16));
  }

  @Test
  void requireUpperLettersRejectsDigitsAndLowerCase() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireUpperLetters("idPrefix", "REQ1", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireUpperLetters("idPrefix", "Req", 16));
  }

  @Test
  void requireUpperLettersRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireUpperLetters("idPrefix", "ABC", 2));
  }
}
