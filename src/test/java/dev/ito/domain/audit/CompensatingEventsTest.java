package dev.ito.domain.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompensatingEventsTest {
  private static final EntityKey KEY = new EntityKey(EntityTypes.TASK, "2.1", "add-login");

  @Test
  void divergedDriftCarriesLogAndFileValues() {
    AuditEvent event = CompensatingEvents.forDrift(
        Drift.diverged(KEY, "pending", "complete"), AuditEventFixtures.CONTEXT, AuditEventFixtures.T0);

    assertEquals(AuditOps.RECONCILED, event.op());
    assertEquals(AuditActors.RECONCILE, event.actor());
    assertEquals(AuditActors.RECONCILE_IDENTITY, event.by());
    assertEquals("pending", event.from());
    assertEquals("complete", event.to());
    assertEquals(KEY, event.key());
    assertEquals(AuditEventFixtures.T0, event.timestamp());
    assertEquals(Map.of("reason", "audit log value differed from file value"), event.meta());
  }

  @Test
  void orphanedDriftHasNoTarget() {
    AuditEvent event = CompensatingEvents.forDrift(
        Drift.orphaned(KEY, "pending"), AuditEventFixtures.CONTEXT, AuditEventFixtures.T0);

    assertEquals("pending", event.from());
    assertNull(event.to());
  }

  @Test
  void unloggedDriftHasNoSource() {
    AuditEvent event = CompensatingEvents.forDrift(
        Drift.unlogged(KEY, "pending"), AuditEventFixtures.CONTEXT, AuditEventFixtures.T0);

    assertNull(event.from());
    assertEquals("pending", event.to());
  }

  @Test
  void cleanReportYieldsNoEvents() {
    ReconcileReport clean = new ReconcileReport(List.of(), 3, 3);

    assertTrue(CompensatingEvents.forReport(clean, AuditEventFixtures.CONTEXT, AuditEventFixtures.T0)
        .isEmpty());
  }
}
