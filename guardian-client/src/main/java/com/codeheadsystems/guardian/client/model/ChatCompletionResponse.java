package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Chat-completions response body, reduced to the choices.
 *
 * @param choices the choices
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionResponse(@JsonProperty("choices") List<Choice> choices) {

  /**
   * Content of the first choice's message, if there is one.
   *
   * @return the optional
   */
  public Optional<String> firstContent() {
    if (choices == null || choices.isEmpty() || choices.get(0) == null || choices.get(0).message() == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(choices.get(0).message().content());
  }

  /**
   * One choice.
   *
   * @param message the message
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Choice(@JsonProperty("message") ChatMessage message) {
  }
}
