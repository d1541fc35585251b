package ca.gc.cra.noodles.domain.id;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Issues and recycles {@link ObjectId}s for one component category.
 *
 * <p>Released slots are reused most-recent-first with their generation bumped. A slot whose next
 * generation would collide with the sentinel is retired for good and a fresh slot is handed out
 * instead.</p>
 *
 * <p>Not thread-safe; confined to the thread that owns the component list.</p>
 *
 * @since 0.1.0
 */
public final class IdAllocator {
  private final Deque<ObjectId> free = new ArrayDeque<>();
  private long highWater;

  /**
   * Returns an identifier that no live object currently holds.
   *
   * @return new or recycled identifier
   * @throws IllegalStateException when every slot below the sentinel has been handed out
   */
  public ObjectId allocate() {
    ObjectId last = free.pollFirst();
    if (last == null) {
      return fresh();
    }
    long nextGeneration = last.generation() + 1;
    if (nextGeneration >= ObjectId.MAX_UINT32) {
      return fresh();
    }
    return new ObjectId(last.slot(), nextGeneration);
  }

  /**
   * Returns an identifier's slot to the free list. Callers release each identifier at most once.
   *
   * @param id identifier previously returned by {@link #allocate()}
   */
  public void release(ObjectId id) {
    free.addFirst(id);
  }

  /**
   * Returns the number of slots ever handed out.
   *
   * @return high-water slot count
   */
  public long highWater() {
    return highWater;
  }

  /**
   * Returns the number of released identifiers awaiting reuse.
   *
   * @return free-list depth
   */
  public int freeCount() {
    return free.size();
  }

  private ObjectId fresh() {
    if (highWater >= ObjectId.MAX_UINT32) {
      throw new IllegalStateException("object id slots exhausted");
    }
    ObjectId id = new ObjectId(highWater, 0);
    highWater++;
    return id;
  }
}
