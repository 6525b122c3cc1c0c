package com.codeheadsystems.guardian.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a repository directory listing.
 *
 * @param name entry name
 * @param type {@code file}, {@code dir}, {@code symlink} or {@code submodule}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentEntry(@JsonProperty("name") String name,
                           @JsonProperty("type") String type) {

  public boolean isFile() {
    return "file".equals(type);
  }
}
