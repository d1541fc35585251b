package ca.gc.cra.noodles.domain.msg;

/**
 * Raised when inbound bytes are not a single well-formed top-level array.
 *
 * @since 0.1.0
 */
public class MalformedMessageException extends RuntimeException {
  public MalformedMessageException(String message) {
    super(message);
  }

  public MalformedMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
