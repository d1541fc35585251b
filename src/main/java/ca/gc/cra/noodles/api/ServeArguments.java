package ca.gc.cra.noodles.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed {@code serve} arguments: a handful of flags plus {@code key=value} overrides.
 *
 * <p>Flags are case-insensitive. Later overrides of the same key win. Keys are not checked against
 * the option set here; unknown ones are reported when the configuration is merged.</p>
 *
 * @param help {@code --help}, {@code -h} or {@code help}
 * @param verbose {@code --verbose} or {@code -v}
 * @param dryRun {@code --dry-run}
 * @param configFile {@code --config=PATH}, {@code --config PATH} or {@code config=PATH}
 * @param overrides remaining {@code key=value} pairs in argument order
 * @since 0.1.0
 */
record ServeArguments(
    boolean help, boolean verbose, boolean dryRun, Optional<Path> configFile, Map<String, String> overrides) {
  private static final Pattern KEY = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");
  private static final String CONFIG_FLAG = "--config";

  ServeArguments {
    Objects.requireNonNull(configFile, "configFile");
    overrides = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(overrides, "overrides")));
  }

  /**
   * Parses raw arguments. Blank entries are skipped.
   *
   * @param args raw CLI arguments; may be {@code null}
   * @return parsed arguments
   * @throws IllegalArgumentException if an argument is not a known flag or a well-formed pair
   */
  static ServeArguments parse(String[] args) {
    boolean help = false;
    boolean verbose = false;
    boolean dryRun = false;
    Path configFile = null;
    Map<String, String> overrides = new LinkedHashMap<>();
    String[] raw = args == null ? new String[0] : args;
    for (int i = 0; i < raw.length; i++) {
      String arg = raw[i] == null ? "" : raw[i].trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      switch (lower) {
        case "--help", "-h", "help" -> help = true;
        case "--verbose", "-v" -> verbose = true;
        case "--dry-run" -> dryRun = true;
        case CONFIG_FLAG -> {
          if (i + 1 >= raw.length) {
            throw new IllegalArgumentException("--config needs a path");
          }
          configFile = configPath(raw[++i]);
        }
        default -> {
          if (lower.startsWith(CONFIG_FLAG + "=")) {
            configFile = configPath(arg.substring(CONFIG_FLAG.length() + 1));
          } else if (arg.startsWith("-")) {
            throw new IllegalArgumentException("Unknown flag: " + arg);
          } else {
            int eq = arg.indexOf('=');
            if (eq <= 0) {
              throw new IllegalArgumentException("Expected key=value but got: " + arg);
            }
            String key = arg.substring(0, eq).trim();
            String value = arg.substring(eq + 1).trim();
            if (!KEY.matcher(key).matches()) {
              throw new IllegalArgumentException("Malformed key: " + key);
            }
            if (value.chars().anyMatch(Character::isISOControl)) {
              throw new IllegalArgumentException("Value for " + key + " contains control characters");
            }
            if (key.equals("config")) {
              configFile = configPath(value);
            } else {
              overrides.put(key, value);
            }
          }
        }
      }
    }
    return new ServeArguments(help, verbose, dryRun, Optional.ofNullable(configFile), overrides);
  }

  private static Path configPath(String raw) {
    String trimmed = raw == null ? "" : raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("--config needs a path");
    }
    return Path.of(trimmed);
  }
}
