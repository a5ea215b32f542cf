package org.maap.client.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.maap.client.config.ConfigurationProvider;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @TempDir Path temp;

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

  @AfterEach
  void resetLevels() {
    context.getLogger("org.maap.test").setLevel(null);
    context.getLogger("org.maap.client.dps").setLevel(null);
  }

  @Test
  void appliesFlatLevelEntries() {
    BaseConfiguration c = new BaseConfiguration();
    c.setProperty("logging.level.org.maap.test", "DEBUG");

    assertEquals(1, LoggingService.applyConfiguration(c));
    assertEquals(Level.DEBUG, context.getLogger("org.maap.test").getLevel());
  }

  @Test
  void appliesLevelsFromYamlWithDottedLoggerNames() throws Exception {
    Path file = temp.resolve("levels.yaml");
    Files.writeString(file, "logging:\n  level:\n    org.maap.client.dps: TRACE\n");

    LoggingService.applyConfiguration(new ConfigurationProvider(file).configuration());

    assertEquals(Level.TRACE, context.getLogger("org.maap.client.dps").getLevel());
  }

  @Test
  void bundledDefaultsLeaveLevelsToHost() {
    ConfigurationProvider defaults = new ConfigurationProvider();

    assertEquals(0, LoggingService.applyConfiguration(defaults.configuration()));
  }

  @Test
  void unknownLevelIsIgnored() {
    BaseConfiguration c = new BaseConfiguration();
    c.setProperty("logging.level.org.maap.test", "LOUD");

    assertEquals(0, LoggingService.applyConfiguration(c));
    assertNull(context.getLogger("org.maap.test").getLevel());
  }
}
