package ca.gc.cra.noodles.application.pipeline;

import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.application.port.SceneAuthority;
import ca.gc.cra.noodles.application.scene.ReplicationContext;
import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Body of the tick thread: drains inbound messages, then lets the scene authority mutate the
 * world. A failing tick is logged and counted; the next tick still runs.
 *
 * @since 0.1.0
 */
public final class TickDriver implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(TickDriver.class);

  private final InboundRouter router;
  private final SceneAuthority scene;
  private final ReplicationContext context;
  private final MetricsPort metrics;
  private final LongSupplier nanoClock;
  private long startNanos;
  private boolean started;

  /**
   * Creates a driver.
   *
   * @param router inbound router drained at the start of each tick
   * @param scene scene authority
   * @param context world and publishing collaborators
   * @param metrics metrics sink
   * @param nanoClock monotonic clock, normally {@link System#nanoTime()}
   */
  public TickDriver(
      InboundRouter router,
      SceneAuthority scene,
      ReplicationContext context,
      MetricsPort metrics,
      LongSupplier nanoClock) {
    this.router = Objects.requireNonNull(router, "router");
    this.scene = Objects.requireNonNull(scene, "scene");
    this.context = Objects.requireNonNull(context, "context");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  /** Starts the scene; must run on the tick thread before the first {@link #run()}. */
  public void start() {
    startNanos = nanoClock.getAsLong();
    started = true;
    MDC.put("pipeline", "tick");
    try {
      scene.onStart(context);
      log.info("Scene {} started with {} components", scene.getClass().getSimpleName(), context.world().size());
    } finally {
      MDC.remove("pipeline");
    }
  }

  @Override
  public void run() {
    if (!started) {
      return;
    }
    MDC.put("pipeline", "tick");
    long tickStart = nanoClock.getAsLong();
    try {
      router.drain();
      scene.onTick(context, Duration.ofNanos(tickStart - startNanos));
    } catch (RuntimeException ex) {
      metrics.increment("tick.failed");
      log.error("Tick failed", ex);
    } catch (Error err) {
      // The scheduler cancels a periodic task that throws, so this is the last tick.
      metrics.increment("tick.fatal");
      log.error("Tick thread hit a fatal error; no further ticks will run", err);
      throw err;
    } finally {
      metrics.observe("tick.latencyNanos", nanoClock.getAsLong() - tickStart);
      MDC.remove("pipeline");
    }
  }

  /**
   * Stops the scene and deletes every remaining component so clients see the deletions. Runs on
   * the tick thread after the last tick.
   */
  public void stop() {
    MDC.put("pipeline", "tick");
    try {
      if (started) {
        scene.onStop(context);
      }
    } catch (RuntimeException ex) {
      log.error("Scene failed to stop cleanly", ex);
    } catch (Error err) {
      log.error("Scene stop hit a fatal error; deleting remaining components", err);
      throw err;
    } finally {
      context.world().close();
      started = false;
      MDC.remove("pipeline");
    }
  }
}
