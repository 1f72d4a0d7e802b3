package io.gwswuse.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gwswuse.core.model.ConventionFile;
import io.gwswuse.core.model.ConventionSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a convention JSON file into a validated, immutable {@link ConventionSchema}.
 */
public final class ConventionLoader {

  private static final Logger log = LogManager.getLogger(ConventionLoader.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);

  private ConventionLoader() {}

  /**
   * @throws SchemaNotFoundException if {@code path} is not a regular file
   * @throws SchemaMalformedException if the document cannot be parsed or misses a required key
   */
  public static ConventionSchema load(Path path) throws IOException {
    if (path == null || !Files.isRegularFile(path)) {
      log.error("Input data convention file not found: {}", path);
      throw new SchemaNotFoundException(path);
    }

    ConventionFile file;
    try {
      file = MAPPER.readValue(path.toFile(), ConventionFile.class);
    } catch (JsonProcessingException e) {
      throw new SchemaMalformedException("invalid convention document " + path + ": " + e.getOriginalMessage(), e);
    }
    if (file == null) throw new SchemaMalformedException("empty convention document " + path);

    ConventionValidator.validate(file);
    ConventionSchema schema = ConventionSchema.from(file);
    log.info("Input data convention loaded from {} ({} sectors)", path, schema.getSectorRequirements().size());
    return schema;
  }
}
