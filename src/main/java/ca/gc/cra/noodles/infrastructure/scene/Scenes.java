package ca.gc.cra.noodles.infrastructure.scene;

import ca.gc.cra.noodles.application.port.SceneAuthority;
import java.util.List;
import java.util.Locale;

/**
 * Resolves the {@code scene} configuration key to a scene authority.
 *
 * @since 0.1.0
 */
public final class Scenes {
  public static final String ORBIT = "orbit";
  public static final String NONE = "none";

  private Scenes() {}

  /**
   * Lists the accepted scene names.
   *
   * @return scene names
   */
  public static List<String> names() {
    return List.of(ORBIT, NONE);
  }

  /**
   * Builds the scene for {@code name}.
   *
   * @param name scene name, case-insensitive
   * @return new scene authority
   * @throws IllegalArgumentException for unknown names
   */
  public static SceneAuthority create(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case ORBIT:
        return new OrbitDemoScene();
      case NONE:
        return new IdleScene();
      default:
        throw new IllegalArgumentException("scene must be one of " + names() + " (was '" + name + "')");
    }
  }
}
