package ca.gc.cra.noodles.application.asset;

import ca.gc.cra.noodles.application.port.AssetHost;
import ca.gc.cra.noodles.domain.component.ComponentList;
import ca.gc.cra.noodles.domain.value.Value;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Publishes raw byte payloads as buffer components.
 * <p><strong>Why:</strong> Small payloads travel inside the create message; large ones would stall every client
 * queue, so they are hosted over HTTP and referenced by URI instead.</p>
 * <p><strong>Role:</strong> Application service handed to scene authorities through the replication context.</p>
 * <p><strong>Thread-safety:</strong> Tick-thread confined, like the buffer list it writes to.</p>
 *
 * @since 0.1.0
 */
public final class BufferPublisher {
  private static final Logger log = LoggerFactory.getLogger(BufferPublisher.class);

  private final ComponentList buffers;
  private final AssetHost host;
  private final int inlineLimit;

  /**
   * Creates a publisher.
   *
   * @param buffers buffer component list
   * @param host out-of-band asset host
   * @param inlineLimit largest payload, in bytes, carried inline
   */
  public BufferPublisher(ComponentList buffers, AssetHost host, int inlineLimit) {
    this.buffers = Objects.requireNonNull(buffers, "buffers");
    this.host = Objects.requireNonNull(host, "host");
    if (inlineLimit < 0) {
      throw new IllegalArgumentException("inlineLimit must be >= 0");
    }
    this.inlineLimit = inlineLimit;
  }

  /**
   * Registers {@code bytes} as a buffer component.
   *
   * @param bytes payload; copied, never retained
   * @return handle that deletes the buffer when closed
   */
  public BufferRegistration publish(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    Map<String, Value> content = new LinkedHashMap<>();
    content.put("size", Value.of(bytes.length));
    if (bytes.length <= inlineLimit) {
      content.put("inline_bytes", Value.bytes(bytes));
      return new BufferRegistration(buffers.register(content), host, null);
    }

    String identity = UUID.randomUUID().toString();
    AssetHost.AssetReference reference = host.install(identity, bytes);
    Map<String, Value> uri = new LinkedHashMap<>();
    uri.put("scheme", Value.of("http"));
    uri.put("path", Value.of(reference.path()));
    uri.put("port", Value.of(Integer.toString(reference.port())));
    content.put("uri_bytes", new Value.Mapping(uri));
    try {
      BufferRegistration registration = new BufferRegistration(buffers.register(content), host, identity);
      log.debug("Hosted {} byte buffer as {}", bytes.length, identity);
      return registration;
    } catch (RuntimeException ex) {
      host.remove(identity);
      throw ex;
    }
  }
}
