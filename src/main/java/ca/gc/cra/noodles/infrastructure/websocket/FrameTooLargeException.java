package ca.gc.cra.noodles.infrastructure.websocket;

/**
 * A frame, or a message assembled from frames, declared more payload than the configured ceiling.
 *
 * @since 0.1.0
 */
public final class FrameTooLargeException extends WebSocketException {
  private final long declaredLength;

  public FrameTooLargeException(long declaredLength, long limit) {
    super("payload of " + Long.toUnsignedString(declaredLength) + " bytes exceeds limit of " + limit);
    this.declaredLength = declaredLength;
  }

  public long declaredLength() {
    return declaredLength;
  }
}
