package dev.ito.infrastructure.audit;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper over the Jackson streaming API that maps documents to {@link Map}/{@link List}
 * graphs and back.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory;

  public JsonSupport() {
    this(new JsonFactory());
  }

  JsonSupport(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  JsonFactory factory() {
    return factory;
  }

  /**
   * Parses a JSON document into maps, lists and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; {@code null} for the literal {@code null}
   * @throws IllegalArgumentException when the text is empty, invalid, or has trailing content
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("empty JSON document");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON: " + ex.getMessage(), ex);
    }
  }

  /**
   * Writes a value produced by {@link #parse(String)} (or an equivalent graph).
   *
   * @param generator target generator
   * @param value map, list, string, number, boolean or {@code null}
   * @throws IOException when the generator fails
   */
  public void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof Number number) {
      double d = number.doubleValue();
      if (!Double.isFinite(d)) {
        throw new IllegalArgumentException("JSON numbers must be finite: " + number);
      }
      generator.writeNumber(d);
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof List<?> list) {
      generator.writeStartArray();
      for (Object element : list) {
        writeValue(generator, element);
      }
      generator.writeEndArray();
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      if (valueToken == null) {
        throw new IllegalArgumentException("Unexpected end of JSON inside object");
      }
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      if (token == null) {
        throw new IllegalArgumentException("Unexpected end of JSON inside array");
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
