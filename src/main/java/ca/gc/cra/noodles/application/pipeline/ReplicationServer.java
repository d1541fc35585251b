package ca.gc.cra.noodles.application.pipeline;

import ca.gc.cra.noodles.application.asset.BufferPublisher;
import ca.gc.cra.noodles.application.port.AssetHost;
import ca.gc.cra.noodles.application.port.ClientConnection;
import ca.gc.cra.noodles.application.port.ConnectionAcceptor;
import ca.gc.cra.noodles.application.port.MessageCodec;
import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.application.port.SceneAuthority;
import ca.gc.cra.noodles.application.scene.ReplicationContext;
import ca.gc.cra.noodles.application.session.ClientHandle;
import ca.gc.cra.noodles.application.session.ConnectionRegistry;
import ca.gc.cra.noodles.domain.component.World;
import ca.gc.cra.noodles.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the replication service: accepts clients, drives the tick thread and the outbound
 * dispatcher, and tears everything down in order on {@link #stop()}.
 *
 * <p>{@link #run()} blocks the calling thread, which becomes the accept loop. Instances are not
 * reusable; invoke {@link #run()} at most once.</p>
 *
 * <p>Shutdown order: stop accepting, run the final tick-thread task (scene stop plus world close,
 * which queues one delete per live component), wait a bounded time for the dispatcher and client
 * queues to drain, then disconnect every client and stop the pools.</p>
 *
 * @since 0.1.0
 */
public final class ReplicationServer {
  private static final Logger log = LoggerFactory.getLogger(ReplicationServer.class);
  private static final long DRAIN_POLL_MILLIS = 10L;

  private final ConnectionAcceptor acceptor;
  private final MessageCodec codec;
  private final MetricsPort metrics;
  private final Settings settings;
  private final ConnectionRegistry registry;
  private final OutboundDispatcher dispatcher;
  private final World world;
  private final ReplicationContext context;
  private final InboundRouter router;
  private final TickDriver tickDriver;

  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicBoolean consumed = new AtomicBoolean();
  private final CountDownLatch started = new CountDownLatch(1);
  private final UncaughtExceptionHandler uncaughtHandler =
      (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);

  private volatile ScheduledExecutorService tickExecutor;

  /**
   * Wires the pipeline around the supplied adapters.
   *
   * @param acceptor source of handshaken connections
   * @param codec wire codec
   * @param assetHost out-of-band host for large buffers
   * @param scene scene authority driven from the tick thread
   * @param metrics metrics sink
   * @param settings tuning parameters
   */
  public ReplicationServer(
      ConnectionAcceptor acceptor,
      MessageCodec codec,
      AssetHost assetHost,
      SceneAuthority scene,
      MetricsPort metrics,
      Settings settings) {
    this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(assetHost, "assetHost");
    Objects.requireNonNull(scene, "scene");
    this.registry = new ConnectionRegistry(settings.clientQueueCapacity(), metrics);
    this.dispatcher = new OutboundDispatcher(registry, codec, metrics);
    this.world = new World(dispatcher);
    this.context =
        new ReplicationContext(world, new BufferPublisher(world.buffers(), assetHost, settings.inlineBufferLimit()));
    this.router = new InboundRouter(dispatcher, scene, context, metrics);
    this.tickDriver = new TickDriver(router, scene, context, metrics, System::nanoTime);
  }

  /**
   * Serves clients until {@link #stop()} is called or the calling thread is interrupted.
   *
   * @throws Exception if the acceptor fails or shutdown cannot complete
   */
  public void run() throws Exception {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException("Replication server already ran");
    }
    MDC.put("pipeline", "accept");
    ExecutorService clientPool = ExecutorFactories.newClientPool("noodles-client", uncaughtHandler);
    ExecutorService dispatchExecutor = ExecutorFactories.newSingleWorker("noodles-dispatch", uncaughtHandler);
    ScheduledExecutorService ticks = ExecutorFactories.newTickScheduler("noodles-tick", uncaughtHandler);
    tickExecutor = ticks;
    Exception primaryFailure = null;
    long accepted = 0;
    try {
      dispatchExecutor.execute(dispatcher);
      ticks.execute(tickDriver::start);
      long tickNanos = settings.tickInterval().toNanos();
      ticks.scheduleAtFixedRate(tickDriver, tickNanos, tickNanos, TimeUnit.NANOSECONDS);
      log.info("Replication server accepting clients on port {} (tick {} ms)",
          acceptor.localPort(), settings.tickInterval().toMillis());
      started.countDown();

      while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
        ClientConnection connection;
        try {
          connection = acceptor.accept();
        } catch (IOException ex) {
          if (stopRequested.get()) {
            break;
          }
          throw ex;
        }
        ClientHandle handle = registry.register(connection);
        new ClientSession(handle, registry, codec, router, metrics).start(clientPool);
        accepted++;
      }
    } catch (Exception runFailure) {
      primaryFailure = runFailure;
    } finally {
      started.countDown();
      acceptor.close();
      try {
        shutdown(ticks, dispatchExecutor, clientPool);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted during shutdown; forcing pools down");
        ticks.shutdownNow();
        dispatchExecutor.shutdownNow();
        clientPool.shutdownNow();
        registry.disconnectAll();
      } catch (RuntimeException shutdownFailure) {
        log.error("Replication server shutdown failed", shutdownFailure);
        if (primaryFailure == null) {
          primaryFailure = shutdownFailure;
        }
      }
      MDC.remove("pipeline");
    }

    if (primaryFailure != null) {
      log.debug("Replication server terminating after {} connections due to failure", accepted);
      throw primaryFailure;
    }
    log.info("Replication server stopped after {} connections", accepted);
  }

  /** Requests shutdown; safe from any thread and idempotent. */
  public void stop() {
    if (stopRequested.compareAndSet(false, true)) {
      log.info("Replication server stop requested");
      acceptor.close();
    }
  }

  /**
   * Waits until the server accepts connections.
   *
   * @param timeout maximum wait
   * @return {@code true} if started in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitStarted(Duration timeout) throws InterruptedException {
    return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS) && !stopRequested.get();
  }

  /**
   * Runs {@code task} on the tick thread, where mutating the world is allowed.
   *
   * @param task work to perform with the replication context
   * @return future completing after the task ran
   * @throws IllegalStateException if the server is not running
   */
  public Future<?> submit(Consumer<ReplicationContext> task) {
    Objects.requireNonNull(task, "task");
    ScheduledExecutorService ticks = tickExecutor;
    if (ticks == null || ticks.isShutdown()) {
      throw new IllegalStateException("Replication server is not running");
    }
    return ticks.submit(() -> task.accept(context));
  }

  public int localPort() {
    return acceptor.localPort();
  }

  private void shutdown(
      ScheduledExecutorService ticks, ExecutorService dispatchExecutor, ExecutorService clientPool)
      throws InterruptedException {
    long deadline = System.nanoTime() + settings.shutdownDrainTimeout().toNanos();

    ticks.execute(tickDriver::stop);
    ticks.shutdown();
    if (!ticks.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)) {
      log.warn("Tick thread still busy after {} ms; forcing shutdown", settings.shutdownDrainTimeout().toMillis());
      ticks.shutdownNow();
    }

    if (!dispatcher.awaitIdle(Duration.ofNanos(remaining(deadline)))) {
      log.warn("Outbound queue not drained at shutdown; {} envelopes dropped", dispatcher.queued());
    }
    while (hasQueuedOutput() && remaining(deadline) > 0) {
      TimeUnit.MILLISECONDS.sleep(DRAIN_POLL_MILLIS);
    }

    registry.disconnectAll();
    dispatchExecutor.shutdownNow();
    clientPool.shutdownNow();
    if (!clientPool.awaitTermination(settings.shutdownDrainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
      log.warn("Client tasks still running after shutdown");
    }
  }

  private boolean hasQueuedOutput() {
    for (ClientHandle handle : registry.activeClients()) {
      if (handle.hasUnsent()) {
        return true;
      }
    }
    return false;
  }

  private static long remaining(long deadline) {
    return Math.max(0L, deadline - System.nanoTime());
  }

  /**
   * Tuning parameters.
   *
   * @param clientQueueCapacity per-client outbound queue bound
   * @param inlineBufferLimit largest buffer carried inline, in bytes
   * @param tickInterval period of the tick thread
   * @param shutdownDrainTimeout bound on waiting for queued output at shutdown
   */
  public record Settings(
      int clientQueueCapacity, int inlineBufferLimit, Duration tickInterval, Duration shutdownDrainTimeout) {
    public Settings {
      if (clientQueueCapacity <= 0) {
        throw new IllegalArgumentException("clientQueueCapacity must be positive");
      }
      if (inlineBufferLimit < 0) {
        throw new IllegalArgumentException("inlineBufferLimit must be >= 0");
      }
      Objects.requireNonNull(tickInterval, "tickInterval");
      Objects.requireNonNull(shutdownDrainTimeout, "shutdownDrainTimeout");
      if (tickInterval.isZero() || tickInterval.isNegative()) {
        throw new IllegalArgumentException("tickInterval must be positive");
      }
    }
  }
}
