package ca.gc.cra.noodles.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.noodles.domain.component.ComponentKind;
import ca.gc.cra.noodles.domain.id.ObjectId;
import ca.gc.cra.noodles.domain.msg.MalformedMessageException;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import ca.gc.cra.noodles.domain.value.Value;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CborMessageCodecTest {
  private final CborMessageCodec codec = new CborMessageCodec();

  @Test
  void documentReadyEncodesAsTwoElementArray() {
    byte[] bytes = codec.encode(List.of(new ProtocolMessage.DocumentReady()));

    assertArrayEquals(new byte[] {(byte) 0x82, 0x18, 0x23, (byte) 0xF5}, bytes);
  }

  @Test
  void batchFlattensTypeAndPayloadPairs() {
    Map<String, Value> content = new LinkedHashMap<>();
    content.put("id", ObjectId.of(0, 0).toValue());
    content.put("name", Value.of("car"));
    content.put("transform", Value.floats(1.0, 0.5));
    content.put("inline_bytes", Value.bytes(new byte[] {1, 2, 3}));
    List<ProtocolMessage> batch = List.of(
        new ProtocolMessage.ComponentCreated(ComponentKind.ENTITY, new Value.Mapping(content)),
        new ProtocolMessage.ComponentDeleted(ComponentKind.BUFFER, ObjectId.of(4, 2)),
        new ProtocolMessage.DocumentReady());

    List<Value> decoded = codec.decode(codec.encode(batch));

    assertEquals(6, decoded.size());
    assertEquals(Value.of(4), decoded.get(0));
    assertEquals(new Value.Mapping(content), decoded.get(1));
    assertEquals(Value.of(11), decoded.get(2));
    assertEquals(new Value.Mapping(Map.of("id", ObjectId.of(4, 2).toValue())), decoded.get(3));
    assertEquals(Value.of(35), decoded.get(4));
    assertEquals(Value.TRUE, decoded.get(5));
  }

  @Test
  void decodesHandWrittenIntroduction() {
    byte[] name = "client_name".getBytes(StandardCharsets.US_ASCII);
    byte[] bytes = new byte[4 + name.length + 2];
    bytes[0] = (byte) 0x82;
    bytes[1] = 0x00;
    bytes[2] = (byte) 0xA1;
    bytes[3] = (byte) (0x60 | name.length);
    System.arraycopy(name, 0, bytes, 4, name.length);
    bytes[4 + name.length] = 0x61;
    bytes[5 + name.length] = 'x';

    List<Value> decoded = codec.decode(bytes);

    assertEquals(Value.of(0), decoded.get(0));
    Value.Mapping payload = assertInstanceOf(Value.Mapping.class, decoded.get(1));
    assertEquals(Value.of("x"), payload.get("client_name"));
  }

  @Test
  void acceptsIndefiniteLengthArrays() {
    byte[] bytes = {(byte) 0x9F, 0x01, (byte) 0xF6, (byte) 0xFF};

    assertEquals(List.of(Value.of(1), Value.NULL), codec.decode(bytes));
  }

  @Test
  void topLevelScalarIsMalformed() {
    assertThrows(MalformedMessageException.class, () -> codec.decode(new byte[] {0x01}));
  }

  @Test
  void truncatedArrayIsMalformed() {
    assertThrows(MalformedMessageException.class, () -> codec.decode(new byte[] {(byte) 0x82, 0x00}));
  }

  @Test
  void trailingBytesAreMalformed() {
    assertThrows(MalformedMessageException.class, () -> codec.decode(new byte[] {(byte) 0x80, 0x01}));
  }

  @Test
  void emptyBatchEncodesAsEmptyArray() {
    assertArrayEquals(new byte[] {(byte) 0x80}, codec.encode(List.of()));
  }
}
