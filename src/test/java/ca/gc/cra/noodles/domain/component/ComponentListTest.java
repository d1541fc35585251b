package ca.gc.cra.noodles.domain.component;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.noodles.domain.id.ObjectId;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import ca.gc.cra.noodles.domain.value.Value;
import ca.gc.cra.noodles.testutil.RecordingSink;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ComponentListTest {
  private final RecordingSink sink = new RecordingSink();
  private final ComponentList entities = new ComponentList(ComponentKind.ENTITY, sink);

  @Test
  void registerBroadcastsCreateWithIdFirst() {
    Component car = entities.register(Map.of("name", Value.of("car")));

    ProtocolMessage.ComponentCreated created = assertInstanceOf(ProtocolMessage.ComponentCreated.class, sink.last());
    assertEquals(4, created.messageType());
    assertEquals(List.of("id", "name"), List.copyOf(created.content().entries().keySet()));
    assertEquals(ObjectId.of(0, 0).toValue(), created.content().get("id"));
    assertEquals(Value.of("car"), car.content().get("name"));
    assertEquals(1, entities.size());
  }

  @Test
  void callerSuppliedIdIsIgnored() {
    Component car = entities.register(Map.of("id", Value.of(99), "name", Value.of("car")));

    assertEquals(car.id().toValue(), car.content().get("id"));
  }

  @Test
  void patchMergesStateAndBroadcastsOnlyTheDelta() {
    Component car = entities.register(Map.of("name", Value.of("car"), "visible", Value.TRUE));
    sink.clear();

    car.patch(Map.of("visible", Value.FALSE));

    ProtocolMessage.ComponentUpdated updated = assertInstanceOf(ProtocolMessage.ComponentUpdated.class, sink.last());
    assertEquals(5, updated.messageType());
    assertEquals(Map.of("id", car.id().toValue(), "visible", Value.FALSE), updated.delta().entries());
    assertEquals(Value.of("car"), car.content().get("name"));
    assertEquals(Value.FALSE, car.content().get("visible"));
  }

  @Test
  void patchAddsNewKeysAndKeepsUntouchedOnes() {
    Component car = entities.register(Map.of("a", Value.of(1), "b", Value.of(2)));
    sink.clear();

    car.patch(Map.of("b", Value.of(3), "c", Value.of(4)));

    assertEquals(
        Map.of("id", car.id().toValue(), "a", Value.of(1), "b", Value.of(3), "c", Value.of(4)),
        car.content().entries());
    ProtocolMessage.ComponentUpdated updated = assertInstanceOf(ProtocolMessage.ComponentUpdated.class, sink.last());
    assertEquals(Map.of("id", car.id().toValue(), "b", Value.of(3), "c", Value.of(4)), updated.delta().entries());
  }

  @Test
  void callerMapsAreCopiedOnRegisterAndPatch() {
    Map<String, Value> initial = new LinkedHashMap<>();
    initial.put("name", Value.of("car"));
    Component car = entities.register(initial);
    ProtocolMessage.ComponentCreated created = assertInstanceOf(ProtocolMessage.ComponentCreated.class, sink.last());

    initial.put("name", Value.of("truck"));
    initial.put("extra", Value.TRUE);

    assertEquals(Value.of("car"), car.content().get("name"));
    assertFalse(car.content().entries().containsKey("extra"));
    assertEquals(Value.of("car"), created.content().get("name"));

    Map<String, Value> delta = new LinkedHashMap<>();
    delta.put("visible", Value.FALSE);
    car.patch(delta);
    ProtocolMessage.ComponentUpdated updated = assertInstanceOf(ProtocolMessage.ComponentUpdated.class, sink.last());

    delta.put("visible", Value.TRUE);
    delta.put("name", Value.of("bus"));

    assertEquals(Value.FALSE, car.content().get("visible"));
    assertEquals(Value.of("car"), car.content().get("name"));
    assertEquals(Map.of("id", car.id().toValue(), "visible", Value.FALSE), updated.delta().entries());
    assertEquals(Value.of("car"), ((Value.Mapping) entities.snapshot().get(0).payload()).get("name"));
  }

  @Test
  void patchOnKindWithoutUpdateMessageFails() {
    ComponentList buffers = new ComponentList(ComponentKind.BUFFER, sink);
    Component buffer = buffers.register(Map.of("size", Value.of(4)));

    assertThrows(IllegalStateException.class, () -> buffer.patch(Map.of("size", Value.of(8))));
  }

  @Test
  void patchAfterCloseFails() {
    Component car = entities.register(Map.of());
    car.close();

    assertThrows(IllegalStateException.class, () -> car.patch(Map.of("name", Value.of("x"))));
  }

  @Test
  void patchThroughForeignListIsRejected() {
    ComponentList other = new ComponentList(ComponentKind.ENTITY, sink);
    Component foreign = other.register(Map.of());

    assertThrows(IllegalArgumentException.class, () -> entities.patch(foreign, Map.of()));
  }

  @Test
  void closeDeletesOnceAndRecyclesTheSlot() {
    Component car = entities.register(Map.of());
    sink.clear();

    car.close();
    car.close();

    assertEquals(1, sink.messages().size());
    ProtocolMessage.ComponentDeleted deleted = assertInstanceOf(ProtocolMessage.ComponentDeleted.class, sink.last());
    assertEquals(6, deleted.messageType());
    assertEquals(car.id(), deleted.id());
    assertTrue(car.isClosed());
    assertEquals(0, entities.size());
    assertEquals(ObjectId.of(0, 1), entities.register(Map.of()).id());
  }

  @Test
  void snapshotReplaysLiveComponentsInCreationOrder() {
    Component a = entities.register(Map.of("name", Value.of("a")));
    Component b = entities.register(Map.of("name", Value.of("b")));
    Component c = entities.register(Map.of("name", Value.of("c")));
    b.close();
    a.patch(Map.of("name", Value.of("a2")));

    List<ProtocolMessage> snapshot = entities.snapshot();

    assertEquals(2, snapshot.size());
    assertEquals(a.content(), snapshot.get(0).payload());
    assertEquals(c.content(), snapshot.get(1).payload());
    assertEquals(Value.of("a2"), ((Value.Mapping) snapshot.get(0).payload()).get("name"));
  }

  @Test
  void findReturnsOnlyLiveComponents() {
    Component car = entities.register(Map.of());

    assertTrue(entities.find(car.id()).isPresent());
    car.close();
    assertFalse(entities.find(car.id()).isPresent());
  }
}
