package ca.gc.cra.noodles.infrastructure.scene;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.noodles.application.asset.BufferPublisher;
import ca.gc.cra.noodles.application.scene.ReplicationContext;
import ca.gc.cra.noodles.domain.component.World;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import ca.gc.cra.noodles.testutil.InMemoryAssetHost;
import ca.gc.cra.noodles.testutil.RecordingSink;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class OrbitDemoSceneTest {
  private static final double EPSILON = 1e-9;

  private final RecordingSink sink = new RecordingSink();
  private final World world = new World(sink);
  private final ReplicationContext context =
      new ReplicationContext(world, new BufferPublisher(world.buffers(), new InMemoryAssetHost(1), 1024));
  private final OrbitDemoScene scene = new OrbitDemoScene();

  @Test
  void transformStartsOnThePositiveXAxis() {
    double[] m = OrbitDemoScene.transformAt(Duration.ZERO);

    assertEquals(16, m.length);
    assertEquals(2.0, m[12], EPSILON);
    assertEquals(0.0, m[14], EPSILON);
    assertEquals(1.0, m[15], EPSILON);
  }

  @Test
  void quarterPeriodMovesOntoTheZAxis() {
    double[] m = OrbitDemoScene.transformAt(OrbitDemoScene.PERIOD.dividedBy(4));

    assertEquals(0.0, m[12], EPSILON);
    assertEquals(2.0, m[14], EPSILON);
  }

  @Test
  void cubePositionsAreEightFloatTriples() {
    assertEquals(96, OrbitDemoScene.cubePositions().length);
  }

  @Test
  void startPublishesMeshAndEntity() {
    scene.onStart(context);

    assertEquals(1, world.entities().size());
    assertEquals(1, world.buffers().size());
    assertEquals(2, sink.messages().size());
  }

  @Test
  void tickPatchesOnlyWhenPositionChanges() {
    scene.onStart(context);
    sink.clear();

    scene.onTick(context, Duration.ZERO);
    assertTrue(sink.messages().isEmpty());

    scene.onTick(context, Duration.ofSeconds(1));
    assertEquals(1, sink.messages().size());
    assertTrue(sink.last() instanceof ProtocolMessage.ComponentUpdated);
  }

  @Test
  void stopDeletesEverythingTheSceneCreated() {
    scene.onStart(context);

    scene.onStop(context);

    assertEquals(0, world.size());
    scene.onTick(context, Duration.ofSeconds(2));
    assertTrue(sink.last() instanceof ProtocolMessage.ComponentDeleted);
  }
}
