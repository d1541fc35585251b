package ca.gc.cra.noodles.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads the server's YAML file into values keyed like the CLI.
 * <p><strong>Role:</strong> Configuration adapter feeding {@link ConfigMerger}.</p>
 * <p>The file groups options by concern, for example:</p>
 * <pre>
 * server:
 *   port: 50000
 * scene:
 *   name: orbit
 *   tickMillis: 16
 * telemetry:
 *   exporter: none
 * </pre>
 * <p>Each leaf is matched against {@link ServerOption#yamlPath()}; paths that name no option are
 * reported and skipped.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a new SnakeYAML parser is created per call.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads {@code path}.
   *
   * @param path YAML file
   * @param warn receives one message per unknown key
   * @return values keyed by {@link ServerOption#key()}; empty for an empty document
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed or not a tree of mappings
   */
  public static Map<String, String> load(Path path, Consumer<String> warn) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(warn, "warn");
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    Map<String, String> values = new LinkedHashMap<>();
    if (document != null) {
      collect(document, "", values, warn);
    }
    return Map.copyOf(values);
  }

  private static void collect(Object node, String path, Map<String, String> values, Consumer<String> warn) {
    if (!(node instanceof Map<?, ?> mapping)) {
      throw new IllegalArgumentException(
          (path.isEmpty() ? "YAML document" : "YAML key " + path) + " must be a mapping");
    }
    for (Map.Entry<?, ?> entry : mapping.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("YAML keys must be non-blank strings" + under(path));
      }
      String child = path.isEmpty() ? name.trim() : path + '.' + name.trim();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        collect(value, child, values, warn);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + child);
      } else {
        Optional<ServerOption> option = ServerOption.forYamlPath(child);
        if (option.isPresent()) {
          values.put(option.get().key(), value == null ? "" : value.toString());
        } else {
          warn.accept("Ignoring unknown YAML key: " + child);
        }
      }
    }
  }

  private static String under(String path) {
    return path.isEmpty() ? "" : " (under " + path + ")";
  }
}
