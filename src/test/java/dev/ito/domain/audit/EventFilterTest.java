package dev.ito.domain.audit;

import static dev.ito.domain.audit.AuditEventFixtures.T0;
import static dev.ito.domain.audit.AuditEventFixtures.event;
import static dev.ito.domain.audit.AuditEventFixtures.status;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EventFilterTest {

  @Test
  void emptyFilterMatchesEverything() {
    assertTrue(EventFilter.all().isEmpty());
    assertTrue(EventFilter.all().matches(status("1.1", "c", "pending", "complete", 0)));
    assertTrue(EventFilter.all().matches(event(EntityTypes.CONFIG, "k", null, AuditOps.SET, null, "v", 0)));
  }

  @Test
  void componentsAreCombinedWithAnd() {
    EventFilter filter = EventFilter.builder()
        .entity(EntityTypes.TASK)
        .scope("c")
        .op(AuditOps.STATUS_CHANGE)
        .build();

    assertTrue(filter.matches(status("1.1", "c", "pending", "complete", 0)));
    assertFalse(filter.matches(status("1.1", "other", "pending", "complete", 0)));
    assertFalse(filter.matches(AuditEventFixtures.created("1.1", "c", 0)));
  }

  @Test
  void scopeFilterExcludesUnscopedEvents() {
    EventFilter filter = EventFilter.builder().scope("c").build();

    assertFalse(filter.matches(event(EntityTypes.PLANNING, "p", null, AuditOps.NOTE, null, null, 0)));
  }

  @Test
  void timeRangeIsInclusive() {
    EventFilter filter =
        EventFilter.builder().since(T0.plusSeconds(60)).until(T0.plusSeconds(120)).build();

    assertFalse(filter.matches(status("1", "c", null, "a", 0)));
    assertTrue(filter.matches(status("1", "c", null, "a", 1)));
    assertTrue(filter.matches(status("1", "c", null, "a", 2)));
    assertFalse(filter.matches(status("1", "c", null, "a", 3)));
  }

  @Test
  void invertedRangeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> EventFilter.builder().since(T0.plusSeconds(1)).until(T0).build());
  }
}
