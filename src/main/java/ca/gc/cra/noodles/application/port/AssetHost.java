package ca.gc.cra.noodles.application.port;

import java.util.Objects;

/**
 * <strong>What:</strong> Out-of-band host for payloads too large to inline in protocol messages.
 * <p><strong>Role:</strong> Port implemented by {@code HttpAssetServer}; consumed by {@code BufferPublisher}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow installs and removals while serving requests.</p>
 *
 * @since 0.1.0
 */
public interface AssetHost {
  /**
   * Makes {@code bytes} retrievable under {@code identity}.
   *
   * @param identity unique path segment
   * @param bytes asset content; the implementation keeps its own copy
   * @return where clients can fetch the asset
   */
  AssetReference install(String identity, byte[] bytes);

  /**
   * Stops serving {@code identity}; unknown identities are ignored.
   *
   * @param identity path segment passed to {@link #install(String, byte[])}
   */
  void remove(String identity);

  /**
   * Location of a hosted asset relative to the host clients already connected to.
   *
   * @param path request path without the leading slash
   * @param port listening port of the asset host
   */
  record AssetReference(String path, int port) {
    public AssetReference {
      Objects.requireNonNull(path, "path");
    }
  }
}
