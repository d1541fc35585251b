package ca.gc.cra.noodles.infrastructure.scene;

import ca.gc.cra.noodles.application.asset.BufferRegistration;
import ca.gc.cra.noodles.application.asset.ResourceCache;
import ca.gc.cra.noodles.application.port.SceneAuthority;
import ca.gc.cra.noodles.application.scene.ReplicationContext;
import ca.gc.cra.noodles.domain.client.ClientId;
import ca.gc.cra.noodles.domain.component.Component;
import ca.gc.cra.noodles.domain.value.Value;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demonstration scene: one entity circling the origin in the XZ plane.
 *
 * <p>The entity's mesh positions are published once as a buffer; its transform is patched
 * whenever the computed position changes.</p>
 *
 * @since 0.1.0
 */
public final class OrbitDemoScene implements SceneAuthority {
  private static final Logger log = LoggerFactory.getLogger(OrbitDemoScene.class);

  static final double RADIUS = 2.0;
  static final Duration PERIOD = Duration.ofSeconds(60);
  static final String ENTITY_NAME = "car";
  private static final String MESH_KEY = "car-positions";

  private final ResourceCache<String, BufferRegistration> buffers = new ResourceCache<>();
  private Component entity;
  private double[] lastTransform;

  @Override
  public void onStart(ReplicationContext context) {
    buffers.obtain(MESH_KEY, key -> context.buffers().publish(cubePositions()));
    lastTransform = transformAt(Duration.ZERO);
    Map<String, Value> content = new LinkedHashMap<>();
    content.put("name", Value.of(ENTITY_NAME));
    content.put("transform", Value.floats(lastTransform));
    entity = context.world().entities().register(content);
  }

  @Override
  public void onTick(ReplicationContext context, Duration elapsed) {
    if (entity == null || entity.isClosed()) {
      return;
    }
    double[] next = transformAt(elapsed);
    if (Arrays.equals(next, lastTransform)) {
      return;
    }
    lastTransform = next;
    entity.patch(Map.of("transform", Value.floats(next)));
  }

  @Override
  public void onInvoke(ReplicationContext context, ClientId client, Value payload) {
    log.debug("Orbit scene ignores invoke from client {}", client);
  }

  @Override
  public void onStop(ReplicationContext context) {
    if (entity != null) {
      entity.close();
      entity = null;
    }
    buffers.clear();
  }

  /**
   * Column-major 4x4 translation to the orbit position after {@code elapsed}.
   *
   * @param elapsed time since the scene started
   * @return 16 matrix elements
   */
  static double[] transformAt(Duration elapsed) {
    double angle = 2 * Math.PI * elapsed.toNanos() / (double) PERIOD.toNanos();
    double x = Math.cos(angle) * RADIUS;
    double z = Math.sin(angle) * RADIUS;
    return new double[] {
      1, 0, 0, 0,
      0, 1, 0, 0,
      0, 0, 1, 0,
      x, 0, z, 1
    };
  }

  // Eight corners of a unit cube as little-endian float32 triples.
  static byte[] cubePositions() {
    ByteBuffer buffer = ByteBuffer.allocate(8 * 3 * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (int corner = 0; corner < 8; corner++) {
      buffer.putFloat((corner & 1) == 0 ? -0.5f : 0.5f);
      buffer.putFloat((corner & 2) == 0 ? -0.5f : 0.5f);
      buffer.putFloat((corner & 4) == 0 ? -0.5f : 0.5f);
    }
    return buffer.array();
  }
}
