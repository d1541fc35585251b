package ca.gc.cra.noodles.domain.client;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identity of one connected client, unique for the lifetime of the process.
 *
 * @param value random UUID issued at handshake
 * @since 0.1.0
 */
public record ClientId(UUID value) {
  public ClientId {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Issues a new random identity.
   *
   * @return fresh client id
   */
  public static ClientId random() {
    return new ClientId(UUID.randomUUID());
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
