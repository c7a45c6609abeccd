package ca.gc.cra.sweep.infrastructure.persistence.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Streaming JSON codec between documents and plain {@link Map}/{@link List} object graphs.
 *
 * <p>Parsing yields {@link LinkedHashMap}, {@link ArrayList}, {@link String}, {@link Number},
 * {@link Boolean} and {@code null}. Rendering accepts the same shapes plus enums and {@link Instant}
 * (written as their string form); non-finite doubles are written as {@code null}.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses the supplied JSON string into a mutable object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty document yields an empty map
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return new LinkedHashMap<String, Object>();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a document whose root must be an object.
   *
   * @param json JSON document
   * @return root object
   * @throws IllegalArgumentException when parsing fails or the root is not an object
   */
  public Map<String, Object> parseObject(String json) {
    if (!(parse(json) instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("JSON document root must be an object");
    }
    Map<String, Object> object = new LinkedHashMap<>();
    root.forEach((key, value) -> object.put(String.valueOf(key), value));
    return object;
  }

  /**
   * Renders an object graph as indented JSON terminated by a newline.
   *
   * @param document object graph
   * @param sortKeys whether object keys are written in natural order instead of insertion order
   * @return JSON text
   * @throws IllegalArgumentException if the graph contains an unsupported value type
   */
  public String render(Object document, boolean sortKeys) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.useDefaultPrettyPrinter();
      writeValue(generator, document, sortKeys);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return out.append('\n').toString();
  }

  private void writeValue(JsonGenerator generator, Object value, boolean sortKeys) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String s) {
      generator.writeString(s);
    } else if (value instanceof Boolean b) {
      generator.writeBoolean(b);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isFinite(d)) {
        generator.writeNumber(d);
      } else {
        generator.writeNull();
      }
    } else if (value instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof BigDecimal dec) {
      generator.writeNumber(dec);
    } else if (value instanceof Map<?, ?> map) {
      writeObject(generator, map, sortKeys);
    } else if (value instanceof Collection<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item, sortKeys);
      }
      generator.writeEndArray();
    } else if (value instanceof Enum<?> e) {
      generator.writeString(e.name());
    } else if (value instanceof Instant instant) {
      generator.writeString(instant.toString());
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private void writeObject(JsonGenerator generator, Map<?, ?> map, boolean sortKeys) throws IOException {
    Map<String, Object> entries = sortKeys ? new TreeMap<>() : new LinkedHashMap<>();
    map.forEach((key, item) -> entries.put(String.valueOf(key), item));
    generator.writeStartObject();
    for (Map.Entry<String, Object> entry : entries.entrySet()) {
      generator.writeFieldName(entry.getKey());
      writeValue(generator, entry.getValue(), sortKeys);
    }
    generator.writeEndObject();
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
      map.put(fieldName, readValue(parser, parser.nextToken()));
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
      list.add(readValue(parser, token));
    }
    return list;
  }
}
