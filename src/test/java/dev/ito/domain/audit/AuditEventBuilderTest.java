package dev.ito.domain.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuditEventBuilderTest {

  private AuditEventBuilder minimal() {
    return AuditEvent.builder()
        .entity(EntityTypes.TASK)
        .entityId("1.1")
        .op(AuditOps.CREATE)
        .actor(AuditActors.CLI)
        .by("@jane-doe")
        .context(EventContext.ofSession("s-1"));
  }

  @Test
  void buildStampsSchemaVersionAndMillisecondTimestamp() {
    Instant before = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    AuditEvent event = minimal().build();

    assertEquals(AuditEvent.SCHEMA_VERSION, event.schemaVersion());
    assertEquals(0, event.timestamp().getNano() % 1_000_000);
    assertTrue(!event.timestamp().isBefore(before));
    assertNull(event.scope());
    assertNull(event.meta());
  }

  @Test
  void explicitTimestampIsKept() {
    Instant ts = Instant.parse("2026-01-02T03:04:05.678Z");

    assertEquals(ts, minimal().timestamp(ts).build().timestamp());
  }

  @Test
  void missingRequiredFieldFails() {
    AuditEventBuilder builder = AuditEvent.builder()
        .entity(EntityTypes.TASK)
        .entityId("1.1")
        .actor(AuditActors.CLI)
        .by("@x")
        .context(EventContext.ofSession("s"));

    IllegalStateException ex = assertThrows(IllegalStateException.class, builder::build);
    assertTrue(ex.getMessage().contains("op"));
  }

  @Test
  void blankRequiredFieldIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> minimal().entityId("  ").build());
  }

  @Test
  void metaIsFrozen() {
    Map<String, Object> meta = new LinkedHashMap<>();
    List<Object> tags = new ArrayList<>(List.of("a"));
    meta.put("tags", tags);

    AuditEvent event = minimal().meta(meta).build();
    tags.add("b");
    meta.put("late", true);

    @SuppressWarnings("unchecked")
    Map<String, Object> frozen = (Map<String, Object>) event.meta();
    assertEquals(List.of("a"), frozen.get("tags"));
    assertEquals(1, frozen.size());
    assertThrows(UnsupportedOperationException.class, () -> frozen.put("x", 1));
  }

  @Test
  void nonFiniteMetaNumbersAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> minimal().meta(Map.of("ratio", Double.NaN)).build());
    assertThrows(IllegalArgumentException.class,
        () -> minimal().meta(Map.of("nested", List.of(Double.POSITIVE_INFINITY))).build());
    assertThrows(IllegalArgumentException.class, () -> minimal().meta(Float.NEGATIVE_INFINITY).build());
    assertEquals(Map.of("ratio", 0.5), minimal().meta(Map.of("ratio", 0.5)).build().meta());
  }

  @Test
  void keyCombinesEntityIdAndScope() {
    AuditEvent event = minimal().scope("add-login").build();

    assertEquals(new EntityKey(EntityTypes.TASK, "1.1", "add-login"), event.key());
    assertEquals("task/1.1 (scope: add-login)", event.key().display());
  }
}
