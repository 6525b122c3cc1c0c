package com.codeheadsystems.guardian.client.manager;

import com.codeheadsystems.guardian.client.accessor.GlmAccessor;
import com.codeheadsystems.guardian.client.exceptions.DecisionAdvisorException;
import com.codeheadsystems.guardian.client.model.ChatCompletionRequest;
import com.codeheadsystems.guardian.client.model.ChatCompletionResponse;
import com.codeheadsystems.guardian.client.model.ChatMessage;
import com.codeheadsystems.guardian.client.model.DecisionPayload;
import com.codeheadsystems.guardian.core.collaborator.DecisionAdvisor;
import com.codeheadsystems.guardian.core.model.Decision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DecisionAdvisor} backed by a GLM chat-completions model.
 * <p>
 * Decisions are cached by the SHA-256 of the prompt for the lifetime of the advisor. Without an
 * API key every prompt gets the configured default action. A failed call or an unparseable answer
 * raises {@link DecisionAdvisorException} and is not cached.
 */
@Singleton
public class GlmDecisionAdvisor implements DecisionAdvisor {

  static final String SYSTEM_PROMPT = "You are a cookie guardian decision engine. "
      + "Respond with JSON containing 'action' and 'reason' fields.";
  static final double TEMPERATURE = 0.2;

  private static final Logger log = LoggerFactory.getLogger(GlmDecisionAdvisor.class);

  private final GlmAccessor accessor;
  private final ObjectMapper objectMapper;
  private final String apiKey;
  private final String model;
  private final String defaultAction;
  private final ConcurrentHashMap<String, Decision> cache = new ConcurrentHashMap<>();

  /**
   * Instantiates a new GLM decision advisor.
   *
   * @param accessor      the accessor
   * @param objectMapper  mapper for the model's JSON answer
   * @param apiKey        the API key, may be null or blank
   * @param model         the model name
   * @param defaultAction action used when no API key is configured
   */
  public GlmDecisionAdvisor(final GlmAccessor accessor,
                            final ObjectMapper objectMapper,
                            final String apiKey,
                            final String model,
                            final String defaultAction) {
    log.info("GlmDecisionAdvisor(model={}, keyConfigured={})", model, apiKey != null && !apiKey.isBlank());
    this.accessor = accessor;
    this.objectMapper = objectMapper;
    this.apiKey = apiKey;
    this.model = model;
    this.defaultAction = defaultAction;
  }

  @Override
  public Decision decide(final String prompt) {
    final String key = sha256(prompt);
    Decision cached = cache.get(key);
    if (cached != null) {
      log.trace("decide(): cache hit {}", key);
      return cached;
    }
    final Decision decision;
    if (apiKey == null || apiKey.isBlank()) {
      decision = new Decision(defaultAction, "Missing API key, using configured default");
    } else {
      decision = ask(prompt);
    }
    Decision existing = cache.putIfAbsent(key, decision);
    return existing != null ? existing : decision;
  }

  private Decision ask(final String prompt) {
    final ChatCompletionResponse response;
    try {
      response = accessor.complete(apiKey, new ChatCompletionRequest(model,
          List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(prompt)), TEMPERATURE));
    } catch (RuntimeException e) {
      throw new DecisionAdvisorException("Decision request to " + model + " failed", e);
    }
    String content = response == null ? null : response.firstContent().orElse(null);
    if (content == null || content.isBlank()) {
      throw new DecisionAdvisorException("Decision response from " + model + " had no content", null);
    }
    try {
      DecisionPayload payload = objectMapper.readValue(stripFence(content), DecisionPayload.class);
      String action = payload.action() == null ? "unknown" : payload.action();
      String reason = payload.reason() == null ? "" : payload.reason();
      log.debug("ask(): action={}", action);
      return new Decision(action, reason);
    } catch (JsonProcessingException e) {
      throw new DecisionAdvisorException("Decision response from " + model + " was not the expected JSON", e);
    }
  }

  static String stripFence(final String content) {
    String trimmed = content.trim();
    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      int closing = trimmed.lastIndexOf("```");
      if (firstNewline > 0 && closing > firstNewline) {
        return trimmed.substring(firstNewline + 1, closing).trim();
      }
    }
    return trimmed;
  }

  static String sha256(final String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
