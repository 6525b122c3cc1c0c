package com.codeheadsystems.guardian.client.manager;

import com.codeheadsystems.guardian.client.config.GuardianConfiguration;
import com.codeheadsystems.guardian.common.SecretBytes;
import com.codeheadsystems.guardian.core.collaborator.CredentialsProvider;
import com.codeheadsystems.guardian.core.model.Credentials;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads per-platform login credentials from environment variables named
 * {@code {prefix}_{PLATFORM}}, each holding {@code {"username": ..., "password": ...}}.
 * A missing variable, malformed JSON or a missing field means no credentials.
 */
@Singleton
public class EnvironmentCredentialsProvider implements CredentialsProvider {

  /** Default variable prefix. */
  public static final String DEFAULT_PREFIX = "USER_CREDENTIALS";

  private static final Logger log = LoggerFactory.getLogger(EnvironmentCredentialsProvider.class);

  private final ObjectMapper objectMapper;
  private final String prefix;
  private final Function<String, String> environment;

  /**
   * Provider over the process environment, with the configured prefix.
   *
   * @param objectMapper the object mapper
   * @param lookup       the credentials section of the configuration
   */
  @Inject
  public EnvironmentCredentialsProvider(final ObjectMapper objectMapper,
                                        final GuardianConfiguration.CredentialsLookup lookup) {
    this(objectMapper, lookup.prefix());
  }

  /**
   * Provider over the process environment.
   *
   * @param objectMapper the object mapper
   * @param prefix       the variable prefix
   */
  public EnvironmentCredentialsProvider(final ObjectMapper objectMapper, final String prefix) {
    this(objectMapper, prefix, System::getenv);
  }

  /**
   * Provider over an arbitrary variable lookup.
   *
   * @param objectMapper the object mapper
   * @param prefix       the variable prefix
   * @param environment  variable name to value, null when unset
   */
  public EnvironmentCredentialsProvider(final ObjectMapper objectMapper,
                                        final String prefix,
                                        final Function<String, String> environment) {
    log.info("EnvironmentCredentialsProvider({})", prefix);
    this.objectMapper = objectMapper;
    this.prefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix;
    this.environment = environment;
  }

  @Override
  public Optional<Credentials> credentialsFor(final String platform) {
    final String variable = variableFor(platform);
    final String raw = environment.apply(variable);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(raw);
      JsonNode username = node.get("username");
      JsonNode password = node.get("password");
      if (username == null || password == null || !username.isTextual() || !password.isTextual()) {
        log.warn("{} is missing username or password", variable);
        return Optional.empty();
      }
      return Optional.of(new Credentials(username.asText(), SecretBytes.fromString(password.asText())));
    } catch (JsonProcessingException e) {
      log.warn("{} does not hold valid JSON", variable);
      return Optional.empty();
    }
  }

  String variableFor(final String platform) {
    return prefix + "_" + platform.toUpperCase(Locale.ROOT);
  }
}
