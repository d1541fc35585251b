package ca.gc.cra.noodles.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("viewer", Logs.truncate("viewer", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void truncateCutsLongValuesAndReportsLength() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertTrue(truncated.startsWith("abcd... (truncated, 4 of 10 bytes)"), truncated);
  }

  @Test
  void truncateDoesNotSplitMultibyteCharacters() {
    String truncated = Logs.truncate("éé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void hexPreviewRendersLeadingBytes() {
    assertEquals("82f5", Logs.hexPreview(new byte[] {(byte) 0x82, (byte) 0xF5}, 8));
    assertEquals("0102... (3 bytes)", Logs.hexPreview(new byte[] {1, 2, 3}, 2));
    assertThrows(IllegalArgumentException.class, () -> Logs.hexPreview(new byte[1], 0));
  }

  @Test
  void setLevelChangesLogbackLogger() {
    String name = "ca.gc.cra.noodles.logging.LogsTest.scratch";

    assertTrue(LoggingConfigurator.setLevel(name, Level.DEBUG));
    assertEquals(Level.DEBUG, ((Logger) LoggerFactory.getLogger(name)).getLevel());
  }
}
