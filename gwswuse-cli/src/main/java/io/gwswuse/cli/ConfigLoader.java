package io.gwswuse.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the simulation configuration JSON file.
 */
public final class ConfigLoader {

  private static final Logger log = LogManager.getLogger(ConfigLoader.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ConfigLoader() {}

  /** Returns unvalidated settings, so command line flags can still fill gaps. */
  public static RunSettings load(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path);
    }
    try {
      SimulationConfig config = MAPPER.readValue(path.toFile(), SimulationConfig.class);
      log.info("Configuration loaded from {}", path);
      return RunSettings.from(config);
    } catch (JsonProcessingException e) {
      throw new ConfigException("Error decoding configuration file " + path + ": " + e.getOriginalMessage(), e);
    }
  }
}
