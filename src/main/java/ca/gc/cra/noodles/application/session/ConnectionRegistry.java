package ca.gc.cra.noodles.application.session;

import ca.gc.cra.noodles.application.port.ClientConnection;
import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.domain.client.ClientId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tracks every connected client and its Pending to Active lifecycle.
 * <p><strong>Why:</strong> A client must receive the full snapshot before any incremental update, so clients
 * stay out of broadcasts until the snapshot envelope promotes them.</p>
 * <p><strong>Role:</strong> Application service shared by the accept loop, client sessions and the outbound
 * dispatcher.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Register newly handshaken clients as pending.</li>
 *   <li>Promote a pending client exactly once.</li>
 *   <li>Remove and close clients on transport failure, overflow or shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Transitions are serialized on one lock; lookups read the concurrent maps
 * without locking.</p>
 * <p><strong>Observability:</strong> Emits {@code ws.client.connected} and {@code ws.client.disconnected}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionRegistry {
  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final int queueCapacity;
  private final MetricsPort metrics;
  private final ConcurrentMap<ClientId, ClientHandle> pending = new ConcurrentHashMap<>();
  private final ConcurrentMap<ClientId, ClientHandle> active = new ConcurrentHashMap<>();
  private final Object transitionLock = new Object();

  /**
   * Creates an empty registry.
   *
   * @param queueCapacity per-client outbound queue bound
   * @param metrics metrics sink
   */
  public ConnectionRegistry(int queueCapacity, MetricsPort metrics) {
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    this.queueCapacity = queueCapacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Registers a freshly handshaken connection as pending.
   *
   * @param connection established connection
   * @return handle carrying the new client id
   */
  public ClientHandle register(ClientConnection connection) {
    ClientHandle handle = new ClientHandle(ClientId.random(), connection, queueCapacity);
    synchronized (transitionLock) {
      pending.put(handle.id(), handle);
    }
    metrics.increment("ws.client.connected");
    log.info("Client {} connected from {}", handle.id(), connection.remoteAddress());
    return handle;
  }

  /**
   * Moves a pending client into the active set.
   *
   * @param id client id
   * @return {@code true} if the client is active after the call
   */
  public boolean promote(ClientId id) {
    synchronized (transitionLock) {
      ClientHandle handle = pending.remove(id);
      if (handle != null) {
        active.put(id, handle);
        log.debug("Client {} promoted to active", id);
        return true;
      }
      return active.containsKey(id);
    }
  }

  /**
   * Removes a client from every state and closes its connection.
   *
   * @param id client id
   * @return {@code true} if the client was present
   */
  public boolean disconnect(ClientId id) {
    ClientHandle handle = remove(id);
    if (handle == null) {
      return false;
    }
    handle.close();
    metrics.increment("ws.client.disconnected");
    log.info("Client {} disconnected", id);
    return true;
  }

  /**
   * Removes a client and aborts its transport without the closing handshake. Used where the
   * caller serves other clients and must not wait on this one.
   *
   * @param id client id
   * @return {@code true} if the client was present
   */
  public boolean evict(ClientId id) {
    ClientHandle handle = remove(id);
    if (handle == null) {
      return false;
    }
    handle.abort();
    metrics.increment("ws.client.disconnected");
    log.info("Client {} evicted", id);
    return true;
  }

  private ClientHandle remove(ClientId id) {
    synchronized (transitionLock) {
      ClientHandle handle = pending.remove(id);
      return handle != null ? handle : active.remove(id);
    }
  }

  /** Disconnects every client. */
  public void disconnectAll() {
    List<ClientId> ids = new ArrayList<>(pending.keySet());
    ids.addAll(active.keySet());
    for (ClientId id : ids) {
      disconnect(id);
    }
  }

  public ClientState state(ClientId id) {
    if (active.containsKey(id)) {
      return ClientState.ACTIVE;
    }
    return pending.containsKey(id) ? ClientState.PENDING : ClientState.ABSENT;
  }

  public Optional<ClientHandle> findActive(ClientId id) {
    return Optional.ofNullable(active.get(id));
  }

  /**
   * Returns a live view of the active clients for broadcast.
   *
   * @return active client handles
   */
  public Collection<ClientHandle> activeClients() {
    return active.values();
  }

  public int pendingCount() {
    return pending.size();
  }

  public int activeCount() {
    return active.size();
  }
}
