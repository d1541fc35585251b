package ca.gc.cra.noodles.application.session;

/**
 * Lifecycle state of a client as seen by the registry.
 *
 * @since 0.1.0
 */
public enum ClientState {
  /** Handshake done; not yet sent the snapshot, so excluded from broadcasts. */
  PENDING,
  /** Received the snapshot; included in broadcasts. */
  ACTIVE,
  /** Never registered or already removed. */
  ABSENT
}
