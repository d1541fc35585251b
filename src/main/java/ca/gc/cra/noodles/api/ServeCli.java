package ca.gc.cra.noodles.api;

import ca.gc.cra.noodles.application.pipeline.ReplicationServer;
import ca.gc.cra.noodles.config.CompositionRoot;
import ca.gc.cra.noodles.config.ConfigMerger;
import ca.gc.cra.noodles.config.ServerConfig;
import ca.gc.cra.noodles.config.ServerOption;
import ca.gc.cra.noodles.config.YamlConfigLoader;
import ca.gc.cra.noodles.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the scene replication server from CLI key-value arguments and an optional YAML file.
 *
 * <p>User-facing text (help, usage, dry-run plans) goes to the supplied writer; diagnostics go
 * through SLF4J.</p>
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final long SHUTDOWN_HOOK_GRACE_MILLIS = 2_000L;
  private static final int HELP_COLUMN = 34;
  private static final String SUMMARY_USAGE = summaryUsage();
  private static final String HELP_TEXT = helpText();

  private ServeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
    System.exit(run(args, out).code());
  }

  /**
   * Executes the serve command and returns the resulting exit code.
   *
   * @param args raw CLI arguments
   * @param out destination for help, usage and dry-run output
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args, PrintWriter out) {
    ServeArguments arguments;
    try {
      arguments = ServeArguments.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (arguments.help()) {
      out.println(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (arguments.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve CLI");
    }

    Map<String, String> yaml;
    try {
      yaml = loadYaml(arguments.configFile(), out);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    ServerConfig config;
    try {
      config = ServerConfig.fromMap(ConfigMerger.merge(yaml, arguments.overrides(), log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      out.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }
    if (config.verbose() && !arguments.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    if (arguments.dryRun()) {
      printDryRunPlan(config, arguments.configFile(), out);
      return ExitCode.SUCCESS;
    }
    return serve(config);
  }

  private static ExitCode serve(ServerConfig config) {
    CountDownLatch finished = new CountDownLatch(1);
    try (CompositionRoot root = new CompositionRoot(config)) {
      ReplicationServer server = root.replicationServer();
      Thread hook = new Thread(() -> {
        server.stop();
        awaitQuietly(finished, config.shutdownDrainTimeout().toMillis() + SHUTDOWN_HOOK_GRACE_MILLIS);
      }, "noodles-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      log.info("Serving scene '{}' on {}:{} (assets on port {})",
          config.scene(), config.host(), server.localPort(), root.assetPort());
      try {
        server.run();
      } finally {
        finished.countDown();
        removeHook(hook);
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Replication server I/O failure on {}:{}", config.host(), config.port(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Replication server configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Replication server interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in replication server", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in replication server", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Map<String, String> loadYaml(Optional<Path> configFile, PrintWriter out) throws CliAbort {
    if (configFile.isEmpty()) {
      return Map.of();
    }
    Path path = configFile.get();
    if (!Files.isRegularFile(path)) {
      log.error("Configuration file does not exist: {}", path);
      out.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(path, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      out.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", path, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  private static void printDryRunPlan(ServerConfig config, Optional<Path> configFile, PrintWriter out) {
    out.println("Serve dry-run: no sockets will be bound.");
    out.println(" Host               : " + config.host());
    out.println(" WebSocket port     : " + config.port());
    out.println(" Asset port         : " + config.assetPort());
    out.println(" Scene              : " + config.scene());
    out.println(" Tick interval (ms) : " + config.tickInterval().toMillis());
    out.println(" Client queue       : " + config.clientQueueCapacity());
    out.println(" Inline limit       : " + config.inlineBufferLimit());
    out.println(" Max frame payload  : " + config.maxFramePayload());
    out.println(" Metrics exporter   : " + config.telemetry().exporter());
    out.println(" Config file        : " + configFile.map(Path::toString).orElse("<none>"));
    out.println(" Re-run without --dry-run to start serving.");
    out.flush();
  }

  private static String summaryUsage() {
    StringBuilder usage = new StringBuilder("usage: serve");
    for (ServerOption option : ServerOption.values()) {
      usage.append(" [").append(option.key()).append("=...]");
    }
    return usage.append(" [--config=PATH] [--dry-run] [--verbose]").toString();
  }

  private static String helpText() {
    StringBuilder help = new StringBuilder()
        .append("NOODLES scene replication server\n\n")
        .append("Usage:\n  serve [options]\n\nOptions:\n");
    for (ServerOption option : ServerOption.values()) {
      help.append("  ").append(option.helpLine(HELP_COLUMN)).append('\n');
    }
    return help
        .append("\nFlags:\n")
        .append(String.format("  %-" + HELP_COLUMN + "s%s%n", "--config=PATH",
            "YAML file with server/scene/telemetry/logging sections; CLI values win"))
        .append(String.format("  %-" + HELP_COLUMN + "s%s%n", "--dry-run",
            "Validate inputs and print the plan without binding sockets"))
        .append(String.format("  %-" + HELP_COLUMN + "s%s%n", "--verbose", "Enable DEBUG logging"))
        .append(String.format("  %-" + HELP_COLUMN + "s%s", "--help", "Show this message"))
        .toString();
  }

  private static void awaitQuietly(CountDownLatch latch, long millis) {
    try {
      if (!latch.await(millis, TimeUnit.MILLISECONDS)) {
        log.warn("Replication server did not finish within {} ms of shutdown signal", millis);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException alreadyShuttingDown) {
      log.debug("JVM shutdown in progress; hook stays registered");
    }
  }

  private static final class CliAbort extends Exception {
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
