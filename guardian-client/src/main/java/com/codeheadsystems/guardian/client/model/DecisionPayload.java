package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The JSON object the model is asked to answer with.
 *
 * @param action the action
 * @param reason the reason
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DecisionPayload(@JsonProperty("action") String action,
                              @JsonProperty("reason") String reason) {
}
