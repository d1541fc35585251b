package ca.gc.cra.noodles.application.port;

import ca.gc.cra.noodles.domain.msg.MalformedMessageException;
import ca.gc.cra.noodles.domain.msg.MessageEncodingException;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import ca.gc.cra.noodles.domain.value.Value;
import java.util.List;

/**
 * <strong>What:</strong> Port translating protocol messages to and from wire bytes.
 * <p><strong>Why:</strong> The dispatcher serializes each envelope once and fans the same bytes out; the codec
 * is the only place that knows the binary format.</p>
 * <p><strong>Role:</strong> Implemented by {@code CborMessageCodec}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe; the dispatcher and every
 * client reader call them concurrently.</p>
 *
 * @since 0.1.0
 */
public interface MessageCodec {
  /**
   * Flattens messages into one top-level array {@code [t1, p1, t2, p2, ...]}.
   *
   * @param messages messages in delivery order
   * @return encoded bytes
   * @throws MessageEncodingException if a payload cannot be represented
   */
  byte[] encode(List<ProtocolMessage> messages);

  /**
   * Parses one top-level array.
   *
   * @param bytes received message bytes
   * @return array elements in order
   * @throws MalformedMessageException if the bytes are not a single well-formed array
   */
  List<Value> decode(byte[] bytes);
}
