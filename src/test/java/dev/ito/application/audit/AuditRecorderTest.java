package dev.ito.application.audit;

import static dev.ito.domain.audit.AuditEventFixtures.CONTEXT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.ito.application.port.AuditWriter;
import dev.ito.domain.audit.AuditActors;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.AuditOps;
import dev.ito.domain.audit.EntityTypes;
import dev.ito.infrastructure.audit.InMemoryAuditWriter;
import java.io.IOException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AuditRecorderTest {
  private static final long NOW = Instant.parse("2026-03-01T12:30:00.123456Z").toEpochMilli();

  private final InMemoryAuditWriter writer = new InMemoryAuditWriter();
  private final AuditContext context = new AuditContext(writer, CONTEXT, "@jane-doe", () -> NOW);

  @Test
  void stampsTimestampContextAndIdentity() throws Exception {
    AuditEvent event = new AuditRecorder(context).record(new AuditRecorder.Transition(
        EntityTypes.TASK, "1.1", "add-login", AuditOps.STATUS_CHANGE, "pending", "in-progress",
        AuditActors.CLI, null, null));

    assertEquals(Instant.parse("2026-03-01T12:30:00.123Z"), event.timestamp());
    assertEquals("@jane-doe", event.by());
    assertSame(CONTEXT, event.context());
    assertEquals(1, writer.snapshot().size());
    assertEquals(event, writer.snapshot().get(0));
  }

  @Test
  void explicitIdentityWins() throws Exception {
    AuditEvent event = new AuditRecorder(context).record(new AuditRecorder.Transition(
        EntityTypes.CHANGE, "add-login", null, AuditOps.ARCHIVE, null, null,
        AuditActors.RALPH, "@ralph", null));

    assertEquals("@ralph", event.by());
  }

  @Test
  void appendFailurePropagates() {
    AuditWriter failing = event -> {
      throw new IOException("disk full");
    };
    AuditRecorder recorder = new AuditRecorder(context.withWriter(failing));

    IOException ex = assertThrows(IOException.class, () -> recorder.record(new AuditRecorder.Transition(
        EntityTypes.TASK, "1.1", "c", AuditOps.CREATE, null, "pending", AuditActors.CLI, null, null)));
    assertEquals("disk full", ex.getMessage());
  }

  @Test
  void noOpWriterStillReturnsEvent() throws Exception {
    AuditEvent event = new AuditRecorder(context.withWriter(AuditWriter.NO_OP)).record(
        new AuditRecorder.Transition(EntityTypes.WAVE, "1", "c", AuditOps.UNLOCK, "locked", "unlocked",
            AuditActors.CLI, null, null));

    assertEquals("unlocked", event.to());
    assertEquals(0, writer.snapshot().size());
  }
}
