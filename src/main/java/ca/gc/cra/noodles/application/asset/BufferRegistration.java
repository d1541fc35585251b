package ca.gc.cra.noodles.application.asset;

import ca.gc.cra.noodles.application.port.AssetHost;
import ca.gc.cra.noodles.domain.component.Component;
import ca.gc.cra.noodles.domain.id.ObjectId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scope-bound handle to a published buffer.
 *
 * <p>{@link #close()} deletes the buffer component and withdraws any hosted copy, exactly once.</p>
 *
 * @since 0.1.0
 */
public final class BufferRegistration implements AutoCloseable {
  private final Component buffer;
  private final AssetHost host;
  private final String assetIdentity;
  private final AtomicBoolean closed = new AtomicBoolean();

  BufferRegistration(Component buffer, AssetHost host, String assetIdentity) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    this.host = Objects.requireNonNull(host, "host");
    this.assetIdentity = assetIdentity;
  }

  /**
   * Returns the identity clients use to reference this buffer from buffer views.
   *
   * @return buffer component id
   */
  public ObjectId id() {
    return buffer.id();
  }

  public Component component() {
    return buffer;
  }

  /**
   * Indicates whether the payload was hosted out-of-band instead of inlined.
   *
   * @return {@code true} when an asset was installed
   */
  public boolean hosted() {
    return assetIdentity != null;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    buffer.close();
    if (assetIdentity != null) {
      host.remove(assetIdentity);
    }
  }
}
