package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A chat-completions message.
 *
 * @param role    system, user or assistant
 * @param content text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(@JsonProperty("role") String role,
                          @JsonProperty("content") String content) {

  public static ChatMessage system(String content) {
    return new ChatMessage("system", content);
  }

  public static ChatMessage user(String content) {
    return new ChatMessage("user", content);
  }
}
