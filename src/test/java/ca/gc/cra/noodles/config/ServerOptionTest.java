package ca.gc.cra.noodles.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ServerOptionTest {

  @Test
  void keysAndYamlPathsResolveBothWays() {
    for (ServerOption option : ServerOption.values()) {
      assertEquals(Optional.of(option), ServerOption.forKey(option.key()));
      assertEquals(Optional.of(option), ServerOption.forYamlPath(option.yamlPath()));
    }
    assertTrue(ServerOption.forKey("colour").isEmpty());
    assertTrue(ServerOption.forYamlPath("port").isEmpty());
  }

  @Test
  void yamlPathsUseTheFourSections() {
    Set<String> sections = new HashSet<>();
    for (ServerOption option : ServerOption.values()) {
      sections.add(option.yamlPath().substring(0, option.yamlPath().indexOf('.')));
    }
    assertEquals(Set.of("server", "scene", "telemetry", "logging"), sections);
  }

  @Test
  void defaultsFollowDeclarationOrder() {
    Map<String, String> defaults = ServerOption.defaults();

    assertEquals(List.of("host", "port"), defaults.keySet().stream().limit(2).toList());
    assertEquals("50000", defaults.get("port"));
    assertEquals("", defaults.get("assetPort"));
  }

  @Test
  void defaultsBuildAValidConfig() {
    ServerConfig config = ServerConfig.fromMap(ServerOption.defaults());

    assertEquals(ServerConfig.defaults(), config);
    assertEquals(50001, config.assetPort());
  }

  @Test
  void helpLinePadsAndNamesTheDefault() {
    assertEquals("port=0-65535    WebSocket port; 0 picks a free port (default 50000)",
        ServerOption.PORT.helpLine(16));
    assertEquals("assetPort=0-65535 HTTP asset port; blank means port+1", ServerOption.ASSET_PORT.helpLine(10));
  }
}
