package ca.gc.cra.noodles.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep client-controlled data bounded in log lines.
 * <p><strong>Why:</strong> Client names and malformed payloads come straight off the network; unbounded they
 * flood operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, noting the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return the original value when short enough, otherwise its prefix with a length suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Renders the leading bytes of a binary payload as hex.
   *
   * @param payload bytes to render; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to render; must be positive
   * @return lowercase hex, suffixed with the total length when cut short
   */
  public static String hexPreview(byte[] payload, int maxBytes) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int shown = Math.min(payload.length, maxBytes);
    StringBuilder out = new StringBuilder(shown * 2 + 24);
    for (int i = 0; i < shown; i++) {
      out.append(HEX[(payload[i] >> 4) & 0x0F]).append(HEX[payload[i] & 0x0F]);
    }
    if (shown < payload.length) {
      out.append("... (").append(payload.length).append(" bytes)");
    }
    return out.toString();
  }
}
