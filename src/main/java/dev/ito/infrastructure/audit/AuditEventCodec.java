package dev.ito.infrastructure.audit;

import com.fasterxml.jackson.core.JsonGenerator;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.AuditTimestamps;
import dev.ito.domain.audit.EventContext;
import dev.ito.domain.audit.MalformedRecordException;
import dev.ito.domain.audit.UnsupportedSchemaVersionException;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes audit events as single-line JSON records and decodes them back.
 *
 * <p><strong>Wire format:</strong> {@code {"v":1,"ts":"2026-01-01T00:00:00.000Z","entity":"task",
 * "entity_id":"1.1","scope":"c","op":"status_change","from":"pending","to":"complete","actor":"cli",
 * "by":"@jane","meta":{...},"ctx":{"session_id":"..."}}}. Absent optional fields are omitted. Unknown fields
 * are ignored on decode.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@code JsonFactory}, which is
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class AuditEventCodec {
  static final String F_VERSION = "v";
  static final String F_TIMESTAMP = "ts";
  static final String F_ENTITY = "entity";
  static final String F_ENTITY_ID = "entity_id";
  static final String F_SCOPE = "scope";
  static final String F_OP = "op";
  static final String F_FROM = "from";
  static final String F_TO = "to";
  static final String F_ACTOR = "actor";
  static final String F_BY = "by";
  static final String F_META = "meta";
  static final String F_CONTEXT = "ctx";
  static final String F_SESSION_ID = "session_id";
  static final String F_HARNESS_SESSION_ID = "harness_session_id";
  static final String F_BRANCH = "branch";
  static final String F_WORKTREE = "worktree";
  static final String F_COMMIT = "commit";

  private final JsonSupport json;

  public AuditEventCodec() {
    this(new JsonSupport());
  }

  public AuditEventCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Serializes an event without a trailing newline.
   *
   * @param event event to encode
   * @return single-line JSON record
   */
  public String encode(AuditEvent event) {
    Objects.requireNonNull(event, "event");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField(F_VERSION, event.schemaVersion());
      gen.writeStringField(F_TIMESTAMP, AuditTimestamps.format(event.timestamp()));
      gen.writeStringField(F_ENTITY, event.entity());
      gen.writeStringField(F_ENTITY_ID, event.entityId());
      writeOptional(gen, F_SCOPE, event.scope());
      gen.writeStringField(F_OP, event.op());
      writeOptional(gen, F_FROM, event.from());
      writeOptional(gen, F_TO, event.to());
      gen.writeStringField(F_ACTOR, event.actor());
      gen.writeStringField(F_BY, event.by());
      if (event.meta() != null) {
        gen.writeFieldName(F_META);
        json.writeValue(gen, event.meta());
      }
      EventContext ctx = event.context();
      gen.writeObjectFieldStart(F_CONTEXT);
      gen.writeStringField(F_SESSION_ID, ctx.sessionId());
      writeOptional(gen, F_HARNESS_SESSION_ID, ctx.harnessSessionId());
      writeOptional(gen, F_BRANCH, ctx.branch());
      writeOptional(gen, F_WORKTREE, ctx.worktree());
      writeOptional(gen, F_COMMIT, ctx.commit());
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode audit event", ex);
    }
    return out.toString();
  }

  /**
   * Decodes one record.
   *
   * @param line record text without its newline
   * @return decoded event
   * @throws MalformedRecordException when the line is not a complete, well-formed record
   * @throws UnsupportedSchemaVersionException when {@code v} is not {@link AuditEvent#SCHEMA_VERSION}
   */
  public AuditEvent decode(String line) throws MalformedRecordException, UnsupportedSchemaVersionException {
    Objects.requireNonNull(line, "line");
    Object parsed;
    try {
      parsed = json.parse(line);
    } catch (IllegalArgumentException ex) {
      throw new MalformedRecordException(ex.getMessage(), ex);
    }
    if (!(parsed instanceof Map<?, ?> root)) {
      throw new MalformedRecordException("record is not a JSON object");
    }

    long version = requireVersion(root.get(F_VERSION));
    if (version != AuditEvent.SCHEMA_VERSION) {
      throw new UnsupportedSchemaVersionException(version);
    }

    Instant timestamp;
    try {
      timestamp = AuditTimestamps.parse(requireString(root, F_TIMESTAMP));
    } catch (DateTimeException ex) {
      throw new MalformedRecordException("ts is not an ISO-8601 timestamp", ex);
    }

    Object ctxNode = root.get(F_CONTEXT);
    if (!(ctxNode instanceof Map<?, ?> ctxMap)) {
      throw new MalformedRecordException("missing or invalid field: " + F_CONTEXT);
    }
    try {
      EventContext context = new EventContext(
          requireString(ctxMap, F_SESSION_ID),
          optionalString(ctxMap, F_HARNESS_SESSION_ID),
          optionalString(ctxMap, F_BRANCH),
          optionalString(ctxMap, F_WORKTREE),
          optionalString(ctxMap, F_COMMIT));
      return new AuditEvent(
          (int) version,
          timestamp,
          requireString(root, F_ENTITY),
          requireString(root, F_ENTITY_ID),
          optionalString(root, F_SCOPE),
          requireString(root, F_OP),
          optionalString(root, F_FROM),
          optionalString(root, F_TO),
          requireString(root, F_ACTOR),
          requireString(root, F_BY),
          root.get(F_META),
          context);
    } catch (IllegalArgumentException ex) {
      throw new MalformedRecordException(ex.getMessage(), ex);
    }
  }

  private static void writeOptional(JsonGenerator gen, String field, String value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value);
    }
  }

  private static long requireVersion(Object value) throws MalformedRecordException {
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger) {
      throw new MalformedRecordException("v is out of range");
    }
    if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
      throw new MalformedRecordException("v must be an integer");
    }
    throw new MalformedRecordException("missing or invalid field: " + F_VERSION);
  }

  private static String requireString(Map<?, ?> node, String field) throws MalformedRecordException {
    Object value = node.get(field);
    if (!(value instanceof String text) || text.isBlank()) {
      throw new MalformedRecordException("missing or invalid field: " + field);
    }
    return text;
  }

  private static String optionalString(Map<?, ?> node, String field) throws MalformedRecordException {
    Object value = node.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new MalformedRecordException("field must be a string: " + field);
    }
    return text;
  }
}
