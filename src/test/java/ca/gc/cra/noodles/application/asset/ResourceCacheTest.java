package ca.gc.cra.noodles.application.asset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ResourceCacheTest {
  private final List<String> closed = new ArrayList<>();
  private final ResourceCache<String, Handle> cache = new ResourceCache<>();

  private final class Handle implements AutoCloseable {
    private final String name;

    Handle(String name) {
      this.name = name;
    }

    @Override
    public void close() throws Exception {
      closed.add(name);
      if (name.startsWith("bad")) {
        throw new Exception("cannot close " + name);
      }
    }
  }

  @Test
  void obtainBuildsOncePerKey() {
    AtomicInteger builds = new AtomicInteger();
    Handle first = cache.obtain("cube", k -> {
      builds.incrementAndGet();
      return new Handle(k);
    });
    Handle second = cache.obtain("cube", k -> {
      builds.incrementAndGet();
      return new Handle(k);
    });

    assertSame(first, second);
    assertEquals(1, builds.get());
    assertTrue(cache.contains("cube"));
  }

  @Test
  void invalidateClosesTheEvictedHandle() {
    cache.obtain("cube", Handle::new);

    assertTrue(cache.invalidate("cube"));
    assertFalse(cache.invalidate("cube"));
    assertEquals(List.of("cube"), closed);
    assertEquals(0, cache.size());
  }

  @Test
  void clearClosesEveryHandleEvenWhenOneFails() {
    cache.obtain("bad", Handle::new);
    cache.obtain("good", Handle::new);

    cache.clear();

    assertEquals(List.of("bad", "good"), closed);
    assertEquals(0, cache.size());
  }
}
