package ca.gc.cra.noodles.infrastructure.codec;

import ca.gc.cra.noodles.application.port.MessageCodec;
import ca.gc.cra.noodles.domain.msg.MalformedMessageException;
import ca.gc.cra.noodles.domain.msg.MessageEncodingException;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import ca.gc.cra.noodles.domain.value.Value;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CBOR implementation of {@link MessageCodec} built on the Jackson streaming API.
 *
 * <p>Outbound messages become one flat array {@code [t1, p1, t2, p2, ...]}. Inbound bytes must
 * hold exactly one top-level array; byte strings decode to {@link Value.Bytes} and map keys to
 * text.</p>
 *
 * <p>Thread-safe: the factory is shared and every call uses its own generator or parser.</p>
 *
 * @since 0.1.0
 */
public final class CborMessageCodec implements MessageCodec {
  private final CBORFactory factory = new CBORFactory();

  @Override
  public byte[] encode(List<ProtocolMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartArray(messages, messages.size() * 2);
      for (ProtocolMessage message : messages) {
        generator.writeNumber(message.messageType());
        writeValue(generator, message.payload());
      }
      generator.writeEndArray();
    } catch (IOException | RuntimeException ex) {
      throw new MessageEncodingException("Failed to encode " + messages.size() + " messages", ex);
    }
    return out.toByteArray();
  }

  @Override
  public List<Value> decode(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    try (JsonParser parser = factory.createParser(bytes)) {
      JsonToken first = parser.nextToken();
      if (first != JsonToken.START_ARRAY) {
        throw new MalformedMessageException("top-level value must be an array (was " + first + ")");
      }
      List<Value> elements = readArray(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null) {
        throw new MalformedMessageException("trailing content after top-level array");
      }
      return elements;
    } catch (IOException ex) {
      throw new MalformedMessageException("invalid CBOR: " + ex.getMessage(), ex);
    }
  }

  private void writeValue(JsonGenerator generator, Value value) throws IOException {
    if (value instanceof Value.Int v) {
      generator.writeNumber(v.value());
    } else if (value instanceof Value.Float v) {
      generator.writeNumber(v.value());
    } else if (value instanceof Value.Text v) {
      generator.writeString(v.value());
    } else if (value instanceof Value.Bytes v) {
      generator.writeBinary(v.value());
    } else if (value instanceof Value.Bool v) {
      generator.writeBoolean(v.value());
    } else if (value instanceof Value.Null) {
      generator.writeNull();
    } else if (value instanceof Value.Array v) {
      generator.writeStartArray(v, v.elements().size());
      for (Value element : v.elements()) {
        writeValue(generator, element);
      }
      generator.writeEndArray();
    } else if (value instanceof Value.Mapping v) {
      generator.writeStartObject(v, v.entries().size());
      for (Map.Entry<String, Value> entry : v.entries().entrySet()) {
        generator.writeFieldName(entry.getKey());
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else {
      throw new MessageEncodingException("Unsupported value " + value, null);
    }
  }

  private Value readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new MalformedMessageException("message ended inside a value");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> new Value.Array(readArray(parser));
      case VALUE_STRING -> Value.of(parser.getText());
      case VALUE_NUMBER_INT -> Value.of(parser.getLongValue());
      case VALUE_NUMBER_FLOAT -> Value.of(parser.getDoubleValue());
      case VALUE_TRUE -> Value.TRUE;
      case VALUE_FALSE -> Value.FALSE;
      case VALUE_NULL -> Value.NULL;
      case VALUE_EMBEDDED_OBJECT -> Value.bytes(parser.getBinaryValue());
      default -> throw new MalformedMessageException("unsupported CBOR token " + token);
    };
  }

  private Value readObject(JsonParser parser) throws IOException {
    Map<String, Value> entries = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return new Value.Mapping(entries);
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new MalformedMessageException("expected map key but found " + token);
      }
      String key = parser.currentName();
      entries.put(key, readValue(parser, parser.nextToken()));
    }
  }

  private List<Value> readArray(JsonParser parser) throws IOException {
    List<Value> elements = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        return elements;
      }
      elements.add(readValue(parser, token));
    }
  }
}
