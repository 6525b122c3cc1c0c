package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Chat-completions request body.
 *
 * @param model       model name
 * @param messages    conversation
 * @param temperature sampling temperature
 */
public record ChatCompletionRequest(@JsonProperty("model") String model,
                                    @JsonProperty("messages") List<ChatMessage> messages,
                                    @JsonProperty("temperature") double temperature) {
}
