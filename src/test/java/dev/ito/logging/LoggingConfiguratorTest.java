package dev.ito.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Logger project;
  private Level rootLevel;
  private Level projectLevel;

  @BeforeEach
  void rememberLevels() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    project = context.getLogger(LoggingConfigurator.PROJECT_LOGGER);
    rootLevel = root.getLevel();
    projectLevel = project.getLevel();
  }

  @AfterEach
  void restoreLevels() {
    root.setLevel(rootLevel);
    project.setLevel(projectLevel);
  }

  @Test
  void verboseRaisesRootAndProjectLoggers() {
    root.setLevel(Level.WARN);
    project.setLevel(Level.INFO);

    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root.getLevel());
    assertEquals(Level.DEBUG, project.getLevel());
  }
}
