package com.codeheadsystems.guardian.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link GuardianConfiguration} from YAML.
 */
public class GuardianConfigurationLoader {

  private static final Logger log = LoggerFactory.getLogger(GuardianConfigurationLoader.class);

  private final ObjectMapper yamlMapper;

  public GuardianConfigurationLoader() {
    this.yamlMapper = new ObjectMapper(new YAMLFactory());
  }

  /**
   * Loads the file, or returns the defaults when it does not exist.
   *
   * @param path the path
   * @return the guardian configuration
   */
  public GuardianConfiguration load(final Path path) {
    if (!Files.exists(path)) {
      log.warn("No configuration at {}, using defaults", path);
      return GuardianConfiguration.defaults();
    }
    try (InputStream in = Files.newInputStream(path)) {
      log.info("Loading configuration from {}", path);
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read configuration " + path, e);
    }
  }

  /**
   * Loads from a stream. An empty document gives the defaults.
   *
   * @param in the stream
   * @return the guardian configuration
   * @throws IOException on malformed YAML
   */
  public GuardianConfiguration load(final InputStream in) throws IOException {
    String document = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    if (document.isBlank()) {
      return GuardianConfiguration.defaults();
    }
    GuardianConfiguration configuration = yamlMapper.readValue(document, GuardianConfiguration.class);
    return configuration == null ? GuardianConfiguration.defaults() : configuration;
  }
}
