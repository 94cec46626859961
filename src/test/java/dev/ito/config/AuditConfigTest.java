package dev.ito.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuditConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    AuditConfig config = AuditConfig.fromMap(Map.of("root", "/work/project"));

    assertEquals(Path.of("/work/project/.ito/.state/audit/events.jsonl"), config.logFile());
    assertEquals(Duration.ofMillis(500), config.pollInterval());
    assertEquals(10, config.last());
    assertEquals(0, config.limit());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void fromMapParsesOverrides() {
    AuditConfig config = AuditConfig.fromMap(Map.of(
        "root", "/work/project",
        "enabled", "off",
        "pollIntervalMillis", "25",
        "last", "0",
        "metricsExporter", " OTLP "));

    assertFalse(config.enabled());
    assertEquals(Duration.ofMillis(25), config.pollInterval());
    assertEquals(0, config.last());
    assertEquals("otlp", config.metricsExporter());
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> AuditConfig.fromMap(Map.of("enabled", "maybe")));
    assertThrows(IllegalArgumentException.class, () -> AuditConfig.fromMap(Map.of("pollIntervalMillis", "1")));
    assertThrows(IllegalArgumentException.class, () -> AuditConfig.fromMap(Map.of("limit", "-1")));
    assertThrows(IllegalArgumentException.class, () -> AuditConfig.fromMap(Map.of("itoDir", " ")));
  }
}
