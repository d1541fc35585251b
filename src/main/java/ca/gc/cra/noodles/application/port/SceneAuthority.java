package ca.gc.cra.noodles.application.port;

import ca.gc.cra.noodles.application.scene.ReplicationContext;
import ca.gc.cra.noodles.domain.client.ClientId;
import ca.gc.cra.noodles.domain.value.Value;
import java.time.Duration;

/**
 * <strong>What:</strong> Collaborator that owns scene content and mutates the replicated world.
 * <p><strong>Why:</strong> Keeps scene logic outside the replication engine; the engine only promises to call
 * these hooks on the tick thread, the sole writer of component content.</p>
 * <p><strong>Role:</strong> Port implemented by scene adapters such as {@code OrbitDemoScene}.</p>
 * <p><strong>Thread-safety:</strong> Every callback runs on the tick thread; implementations need no locking for
 * state touched only from these hooks.</p>
 *
 * @since 0.1.0
 */
public interface SceneAuthority {
  /**
   * Called once before the first tick.
   *
   * @param context world and publishing collaborators
   */
  void onStart(ReplicationContext context);

  /**
   * Called once per tick after inbound messages have been drained.
   *
   * @param context world and publishing collaborators
   * @param elapsed time since {@link #onStart(ReplicationContext)}
   */
  void onTick(ReplicationContext context, Duration elapsed);

  /**
   * Called for every invoke message a client sends.
   *
   * @param context world and publishing collaborators
   * @param client sender
   * @param payload opaque invocation payload
   */
  default void onInvoke(ReplicationContext context, ClientId client, Value payload) {}

  /**
   * Called once during shutdown, before the world is closed.
   *
   * @param context world and publishing collaborators
   */
  default void onStop(ReplicationContext context) {}
}
