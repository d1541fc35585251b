package ca.gc.cra.noodles.testutil;

import ca.gc.cra.noodles.application.port.AssetHost;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Asset host that keeps installed bytes in a map and reports a fixed port. */
public final class InMemoryAssetHost implements AssetHost {
  private final Map<String, byte[]> assets = new ConcurrentHashMap<>();
  private final int port;

  public InMemoryAssetHost(int port) {
    this.port = port;
  }

  @Override
  public AssetReference install(String identity, byte[] bytes) {
    assets.put(identity, bytes.clone());
    return new AssetReference(identity, port);
  }

  @Override
  public void remove(String identity) {
    assets.remove(identity);
  }

  public Map<String, byte[]> assets() {
    return Map.copyOf(assets);
  }
}
