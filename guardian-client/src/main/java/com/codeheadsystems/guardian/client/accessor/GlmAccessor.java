package com.codeheadsystems.guardian.client.accessor;

import com.codeheadsystems.guardian.client.config.GuardianConfiguration;
import com.codeheadsystems.guardian.client.exceptions.GlmAccessorException;
import com.codeheadsystems.guardian.client.model.ChatCompletionRequest;
import com.codeheadsystems.guardian.client.model.ChatCompletionResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for an OpenAI-style chat-completions endpoint. {@code endpoint} is the full
 * completions URL, not a base.
 * <p>
 * A 401 response is surfaced as a {@link SecurityException}. Other error statuses, I/O errors and
 * interruptions are wrapped in {@link GlmAccessorException}.
 */
@Singleton
public class GlmAccessor {

  private static final Duration TIMEOUT = Duration.ofSeconds(30);
  private static final Logger log = LoggerFactory.getLogger(GlmAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI endpoint;

  /**
   * Instantiates a new GLM accessor against the configured endpoint.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param advisor      the advisor section of the configuration
   */
  @Inject
  public GlmAccessor(final HttpClient httpClient,
                     final ObjectMapper objectMapper,
                     final GuardianConfiguration.Advisor advisor) {
    this(httpClient, objectMapper, URI.create(advisor.apiUrl()));
  }

  /**
   * Instantiates a new GLM accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param endpoint     the completions endpoint
   */
  public GlmAccessor(final HttpClient httpClient, final ObjectMapper objectMapper, final URI endpoint) {
    log.info("GlmAccessor({})", endpoint);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.endpoint = endpoint;
  }

  /**
   * Sends the completion request.
   *
   * @param apiKey  the bearer key
   * @param request the request
   * @return the response
   */
  public ChatCompletionResponse complete(final String apiKey, final ChatCompletionRequest request) {
    log.debug("complete(model={})", request.model());
    try {
      String requestBody = objectMapper.writeValueAsString(request);
      HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(endpoint)
          .timeout(TIMEOUT)
          .header("Authorization", "Bearer " + apiKey)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();
      HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      checkStatus(response.statusCode());
      return objectMapper.readValue(response.body(), ChatCompletionResponse.class);
    } catch (IOException e) {
      throw new GlmAccessorException("HTTP request failed for endpoint: " + endpoint.getHost(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GlmAccessorException("HTTP request interrupted for endpoint: " + endpoint.getHost(), e);
    }
  }

  private void checkStatus(int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Completions endpoint rejected the key (401): " + endpoint.getHost());
    }
    if (statusCode >= 400) {
      throw new GlmAccessorException("Completions endpoint returned HTTP " + statusCode, null);
    }
  }
}
