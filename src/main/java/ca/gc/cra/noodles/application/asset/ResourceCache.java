package ca.gc.cra.noodles.application.asset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strong-reference cache of published resources keyed by their source object.
 *
 * <p>Entries live until {@link #invalidate(Object)} or {@link #clear()}; both close the evicted
 * handle. Tick-thread confined.</p>
 *
 * @param <K> source key, compared with {@code equals}
 * @param <V> published handle
 * @since 0.1.0
 */
public final class ResourceCache<K, V extends AutoCloseable> {
  private static final Logger log = LoggerFactory.getLogger(ResourceCache.class);

  private final Map<K, V> entries = new LinkedHashMap<>();

  /**
   * Returns the cached handle for {@code key}, building it on first use.
   *
   * @param key source key
   * @param factory builds a handle for a missing key
   * @return cached or newly built handle
   */
  public V obtain(K key, Function<? super K, ? extends V> factory) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(factory, "factory");
    V existing = entries.get(key);
    if (existing != null) {
      return existing;
    }
    V created = Objects.requireNonNull(factory.apply(key), "factory returned null");
    entries.put(key, created);
    return created;
  }

  /**
   * Removes and closes the handle for {@code key}.
   *
   * @param key source key
   * @return {@code true} if an entry was evicted
   */
  public boolean invalidate(K key) {
    V removed = entries.remove(key);
    if (removed == null) {
      return false;
    }
    closeQuietly(key, removed);
    return true;
  }

  /** Removes and closes every entry. */
  public void clear() {
    List<Map.Entry<K, V>> snapshot = new ArrayList<>(entries.entrySet());
    entries.clear();
    for (Map.Entry<K, V> entry : snapshot) {
      closeQuietly(entry.getKey(), entry.getValue());
    }
  }

  public int size() {
    return entries.size();
  }

  public boolean contains(K key) {
    return entries.containsKey(key);
  }

  private void closeQuietly(K key, V value) {
    try {
      value.close();
    } catch (Exception ex) {
      log.warn("Failed to release cached resource for {}", key, ex);
    }
  }
}
