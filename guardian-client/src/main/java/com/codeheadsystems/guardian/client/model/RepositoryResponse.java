package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of a repository listing entry used for scoring.
 *
 * @param fullName        owner/name
 * @param htmlUrl         browser URL
 * @param stargazersCount star count
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryResponse(@JsonProperty("full_name") String fullName,
                                 @JsonProperty("html_url") String htmlUrl,
                                 @JsonProperty("stargazers_count") int stargazersCount) {
}
