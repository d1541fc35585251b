package ca.gc.cra.noodles.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Layers option defaults, YAML values and CLI overrides, in that order of increasing precedence.
 *
 * <p>CLI keys that name no {@link ServerOption} are reported and dropped, so a typo never reaches
 * {@link ServerConfig#fromMap(Map)} silently.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param yaml values from {@link YamlConfigLoader}, already restricted to known options
   * @param cli CLI {@code key=value} overrides
   * @param warn receives one message per unknown CLI key
   * @return immutable values for every option
   */
  public static Map<String, String> merge(Map<String, String> yaml, Map<String, String> cli, Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Objects.requireNonNull(cli, "cli");
    Objects.requireNonNull(warn, "warn");
    Map<String, String> merged = new LinkedHashMap<>(ServerOption.defaults());
    merged.putAll(yaml);
    cli.forEach((key, value) -> {
      if (ServerOption.forKey(key).isEmpty()) {
        warn.accept("Ignoring unknown CLI key: " + key);
      } else {
        merged.put(key, value);
      }
    });
    return Map.copyOf(merged);
  }
}
