package ca.gc.cra.noodles.domain.value;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable tree of CBOR-representable values carried in protocol payloads.
 * <p><strong>Why:</strong> Component content is read by the dispatcher thread while the tick thread keeps
 * mutating the owning store; immutable values make those reads safe without locking live content.</p>
 * <p><strong>Role:</strong> Domain value model shared by the component store, protocol messages and the codec.</p>
 * <p><strong>Thread-safety:</strong> All variants are deeply immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface Value
    permits Value.Int, Value.Float, Value.Text, Value.Bytes, Value.Bool, Value.Null, Value.Array, Value.Mapping {

  /** Shared null value. */
  Value NULL = new Null();

  /** Shared {@code true} value. */
  Value TRUE = new Bool(true);

  /** Shared {@code false} value. */
  Value FALSE = new Bool(false);

  static Value of(long value) {
    return new Int(value);
  }

  static Value of(double value) {
    return new Float(value);
  }

  static Value of(String value) {
    return new Text(value);
  }

  static Value of(boolean value) {
    return value ? TRUE : FALSE;
  }

  static Value bytes(byte[] value) {
    return new Bytes(value);
  }

  static Value array(List<? extends Value> elements) {
    return new Array(List.copyOf(elements));
  }

  /**
   * Builds an array of floats, the common shape for transforms and vectors.
   *
   * @param values float elements
   * @return array value
   */
  static Value floats(double... values) {
    Value[] elements = new Value[values.length];
    for (int i = 0; i < values.length; i++) {
      elements[i] = new Float(values[i]);
    }
    return new Array(List.of(elements));
  }

  /** Signed integer; unsigned 32-bit protocol fields fit without loss. */
  record Int(long value) implements Value {}

  /** Double-precision float. */
  record Float(double value) implements Value {}

  /** UTF-8 text. */
  record Text(String value) implements Value {
    public Text {
      Objects.requireNonNull(value, "value");
    }
  }

  /** Byte string; the backing array is copied on the way in and on the way out. */
  record Bytes(byte[] value) implements Value {
    public Bytes {
      value = Objects.requireNonNull(value, "value").clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    /**
     * Returns the byte count without copying.
     *
     * @return length in bytes
     */
    public int length() {
      return value.length;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Bytes that && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "Bytes[length=" + value.length + "]";
    }
  }

  /** Boolean. */
  record Bool(boolean value) implements Value {}

  /** Explicit null. */
  record Null() implements Value {}

  /** Ordered list of values. */
  record Array(List<Value> elements) implements Value {
    public Array {
      elements = List.copyOf(elements);
    }
  }

  /** String-keyed map preserving insertion order. */
  record Mapping(Map<String, Value> entries) implements Value {
    public Mapping {
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(entries, "entries")));
    }

    /**
     * Returns the value bound to {@code key}, or {@code null} when absent.
     *
     * @param key entry key
     * @return bound value or {@code null}
     */
    public Value get(String key) {
      return entries.get(key);
    }
  }
}
