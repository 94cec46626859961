package dev.ito.api;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Renders command results as single-line JSON documents with Jackson's streaming generator.
 */
final class JsonOutput {
  private static final JsonFactory FACTORY = JsonFactory.builder().build();

  private JsonOutput() {
    // Utility
  }

  @FunctionalInterface
  interface Body {
    void write(JsonGenerator generator) throws IOException;
  }

  static String render(Body body) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      body.write(generator);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON output", ex);
    }
    return out.toString();
  }

  static void writeNullableString(JsonGenerator generator, String field, String value) throws IOException {
    if (value == null) {
      generator.writeNullField(field);
    } else {
      generator.writeStringField(field, value);
    }
  }
}
