package ca.gc.cra.pulse.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger pulse;
  private Level previous;

  @BeforeEach
  void captureLevel() {
    pulse = (Logger) LoggerFactory.getLogger(LoggingConfigurator.PULSE_LOGGER);
    previous = pulse.getLevel();
  }

  @AfterEach
  void restoreLevel() {
    pulse.setLevel(previous);
  }

  @Test
  void verboseLoggingEnablesDebugForPulseLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, pulse.getLevel());
    assertTrue(LoggerFactory.getLogger("ca.gc.cra.pulse.application.summary.DashboardSummaryUseCase")
        .isDebugEnabled());
  }

  @Test
  void setLevelAppliesRequestedLevel() {
    assertTrue(LoggingConfigurator.setLevel(Level.WARN));

    assertEquals(Level.WARN, pulse.getLevel());
  }
}
