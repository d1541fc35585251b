package ca.gc.cra.noodles.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.noodles.domain.client.ClientId;
import ca.gc.cra.noodles.testutil.FakeConnection;
import ca.gc.cra.noodles.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ConnectionRegistry registry = new ConnectionRegistry(2, metrics);

  @Test
  void newClientsStartPendingAndAreNotActive() {
    ClientHandle handle = registry.register(new FakeConnection());

    assertEquals(ClientState.PENDING, registry.state(handle.id()));
    assertTrue(registry.findActive(handle.id()).isEmpty());
    assertTrue(registry.activeClients().isEmpty());
    assertEquals(1, metrics.count("ws.client.connected"));
  }

  @Test
  void promoteMovesClientToActive() {
    ClientHandle handle = registry.register(new FakeConnection());

    assertTrue(registry.promote(handle.id()));
    assertTrue(registry.promote(handle.id()));

    assertEquals(ClientState.ACTIVE, registry.state(handle.id()));
    assertEquals(1, registry.activeCount());
    assertEquals(0, registry.pendingCount());
  }

  @Test
  void promotingUnknownClientReportsFalse() {
    assertFalse(registry.promote(ClientId.random()));
  }

  @Test
  void disconnectClosesTransportOnceAndForgetsClient() {
    FakeConnection connection = new FakeConnection();
    ClientHandle handle = registry.register(connection);
    registry.promote(handle.id());

    assertTrue(registry.disconnect(handle.id()));
    assertFalse(registry.disconnect(handle.id()));

    assertEquals(ClientState.ABSENT, registry.state(handle.id()));
    assertEquals(1, connection.closeCalls());
    assertTrue(handle.isClosed());
    assertFalse(handle.offer(new byte[] {1}));
    assertEquals(1, metrics.count("ws.client.disconnected"));
  }

  @Test
  void evictAbortsWithoutClosingHandshake() {
    FakeConnection connection = new FakeConnection();
    ClientHandle handle = registry.register(connection);

    assertTrue(registry.evict(handle.id()));
    assertFalse(registry.evict(handle.id()));
    assertFalse(registry.disconnect(handle.id()));

    assertEquals(ClientState.ABSENT, registry.state(handle.id()));
    assertEquals(1, connection.abortCalls());
    assertEquals(0, connection.closeCalls());
    assertTrue(handle.isClosed());
  }

  @Test
  void promoteAfterDisconnectDoesNotResurrect() {
    ClientHandle handle = registry.register(new FakeConnection());
    registry.disconnect(handle.id());

    assertFalse(registry.promote(handle.id()));
    assertEquals(ClientState.ABSENT, registry.state(handle.id()));
  }

  @Test
  void handleQueueIsBoundedByCapacity() {
    ClientHandle handle = registry.register(new FakeConnection());

    assertTrue(handle.offer(new byte[] {1}));
    assertTrue(handle.offer(new byte[] {2}));
    assertFalse(handle.offer(new byte[] {3}));
    assertEquals(2, handle.queued());
  }

  @Test
  void disconnectAllEmptiesBothMaps() {
    ClientHandle pending = registry.register(new FakeConnection());
    ClientHandle active = registry.register(new FakeConnection());
    registry.promote(active.id());

    registry.disconnectAll();

    assertEquals(0, registry.pendingCount());
    assertEquals(0, registry.activeCount());
    assertTrue(pending.isClosed());
    assertTrue(active.isClosed());
  }
}
