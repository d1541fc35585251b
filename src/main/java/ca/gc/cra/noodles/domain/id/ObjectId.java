package ca.gc.cra.noodles.domain.id;

import ca.gc.cra.noodles.domain.value.Value;
import java.util.List;

/**
 * <strong>What:</strong> Two-part identity of a replicated object: a reusable slot plus the generation of its
 * current occupant.
 * <p><strong>Why:</strong> Lets slots be recycled after deletion while clients can still tell the new occupant
 * apart from the one they already deleted.</p>
 * <p><strong>Role:</strong> Domain value object embedded in every component payload under the {@code id} key.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across threads.</p>
 *
 * @param slot unsigned 32-bit slot index held in a {@code long}
 * @param generation unsigned 32-bit generation counter held in a {@code long}
 * @since 0.1.0
 */
public record ObjectId(long slot, long generation) {
  /** Largest unsigned 32-bit value; reserved for the "no object" sentinel. */
  public static final long MAX_UINT32 = 0xFFFF_FFFFL;

  /** Sentinel denoting "no object", for example an entity without a parent. */
  public static final ObjectId NULL = new ObjectId(MAX_UINT32, MAX_UINT32);

  /**
   * Validates that both parts fit in an unsigned 32-bit integer.
   *
   * @throws IllegalArgumentException if either part is negative or above {@link #MAX_UINT32}
   */
  public ObjectId {
    requireUint32("slot", slot);
    requireUint32("generation", generation);
  }

  /**
   * Creates an identifier from its parts.
   *
   * @param slot slot index
   * @param generation generation counter
   * @return identifier
   */
  public static ObjectId of(long slot, long generation) {
    return new ObjectId(slot, generation);
  }

  /**
   * Indicates whether this identifier refers to no object.
   *
   * @return {@code true} when either part carries the reserved maximum value
   */
  public boolean isNull() {
    return slot == MAX_UINT32 || generation == MAX_UINT32;
  }

  /**
   * Returns the wire representation {@code [slot, generation]}.
   *
   * @return array value
   */
  public Value toValue() {
    return Value.array(List.of(Value.of(slot), Value.of(generation)));
  }

  /**
   * Parses the wire representation {@code [slot, generation]}.
   *
   * @param value candidate value
   * @return parsed identifier
   * @throws IllegalArgumentException if the value is not a two-element integer array
   */
  public static ObjectId fromValue(Value value) {
    if (!(value instanceof Value.Array array) || array.elements().size() != 2) {
      throw new IllegalArgumentException("object id must be a two-element array (was " + value + ")");
    }
    if (!(array.elements().get(0) instanceof Value.Int slotValue)
        || !(array.elements().get(1) instanceof Value.Int genValue)) {
      throw new IllegalArgumentException("object id elements must be integers (was " + value + ")");
    }
    return new ObjectId(slotValue.value(), genValue.value());
  }

  @Override
  public String toString() {
    return isNull() ? "ObjectId[null]" : "ObjectId[" + slot + "/" + generation + "]";
  }

  private static void requireUint32(String name, long value) {
    if (value < 0 || value > MAX_UINT32) {
      throw new IllegalArgumentException(name + " must fit in an unsigned 32-bit integer (was " + value + ")");
    }
  }
}
