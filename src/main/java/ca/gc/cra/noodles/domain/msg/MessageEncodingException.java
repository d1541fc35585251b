package ca.gc.cra.noodles.domain.msg;

/**
 * Raised when an outbound envelope cannot be serialized.
 *
 * @since 0.1.0
 */
public class MessageEncodingException extends RuntimeException {
  public MessageEncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
