package org.maap.client.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CombinedConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.tree.OverrideCombiner;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Loads the client configuration from YAML.
 *
 * <p>The bundled {@value #DEFAULTS_RESOURCE} resource supplies defaults; an optional override file
 * is layered on top so only the keys it declares replace the defaults.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULTS_RESOURCE = "maap-client.yaml";

  private final Configuration configuration;

  /** Defaults only. */
  public ConfigurationProvider() {
    this(null);
  }

  /**
   * @param overrideFile YAML file whose entries take precedence over the defaults; may be null
   */
  public ConfigurationProvider(Path overrideFile) {
    CombinedConfiguration combined = new CombinedConfiguration(new OverrideCombiner());
    if (overrideFile != null) {
      combined.addConfiguration(readFile(overrideFile), "override");
    }
    combined.addConfiguration(readDefaults(), "defaults");
    this.configuration = combined;
  }

  public Configuration configuration() {
    return configuration;
  }

  private static YAMLConfiguration readDefaults() {
    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new org.maap.client.exception.ConfigurationException(
            "Missing classpath resource " + DEFAULTS_RESOURCE);
      }
      return read(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
    } catch (IOException e) {
      throw new org.maap.client.exception.ConfigurationException(
          "Could not read " + DEFAULTS_RESOURCE, e);
    }
  }

  private static YAMLConfiguration readFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new org.maap.client.exception.ConfigurationException(
          "Configuration file not found: " + file);
    }
    log.debug("Loading configuration overrides from {}", file);
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, file.toString());
    } catch (IOException e) {
      throw new org.maap.client.exception.ConfigurationException("Could not read " + file, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new org.maap.client.exception.ConfigurationException("Invalid YAML in " + source, e);
    }
    return yaml;
  }
}
