package ca.gc.cra.noodles.api;

import ca.gc.cra.noodles.logging.LoggingConfigurator;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the {@code noodles} executable.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: noodles [--help] [--verbose] <serve> [options]";
  private static final String HELP_TEXT = """
      NOODLES command dispatcher

      Usage:
        noodles <command> [options]

      Commands:
        serve       Run the scene replication server (serve --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand""";

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments; the first non-flag argument names the command
   */
  public static void main(String[] args) {
    PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
    System.exit(run(args, out).code());
  }

  static ExitCode run(String[] args, PrintWriter out) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(raw);
    String[] globals = Arrays.copyOfRange(raw, 0, commandIndex < 0 ? raw.length : commandIndex);
    boolean help = false;
    boolean verbose = false;
    for (String flag : globals) {
      String normalized = flag == null ? "" : flag.trim().toLowerCase(Locale.ROOT);
      switch (normalized) {
        case "" -> { }
        case "--help", "-h", "help" -> help = true;
        case "--verbose", "-v" -> verbose = true;
        default -> {
          log.error("Unknown global flag: {}", flag);
          out.println(SUMMARY_USAGE);
          return ExitCode.INVALID_ARGS;
        }
      }
    }
    if (help) {
      out.println(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (verbose) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex < 0) {
      log.error("Missing command");
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);
    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs, out);
      default -> {
        log.error("Unknown command: {}", command);
        out.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags before the command belong to the dispatcher; everything after goes to the subcommand.
  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
