package com.codeheadsystems.guardian.client.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run configuration. Every section and every field is optional; missing values take the
 * defaults below. Secrets are never held here, only the names of the environment variables that
 * hold them.
 *
 * @param app         application and sharding
 * @param github      GitHub API access
 * @param advisor     decision advisor
 * @param warp        network identity rotation
 * @param credentials login credentials lookup
 * @param state       run-state file
 * @param cleanup     temporary file sweep
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GuardianConfiguration(@JsonProperty("app") App app,
                                    @JsonProperty("github") GitHub github,
                                    @JsonProperty("advisor") Advisor advisor,
                                    @JsonProperty("warp") Warp warp,
                                    @JsonProperty("credentials") CredentialsLookup credentials,
                                    @JsonProperty("state") State state,
                                    @JsonProperty("cleanup") Cleanup cleanup) {

  public GuardianConfiguration {
    app = app == null ? new App(null, null, null) : app;
    github = github == null ? new GitHub(null, null, null) : github;
    advisor = advisor == null ? new Advisor(null, null, null, null) : advisor;
    warp = warp == null ? new Warp(null, null) : warp;
    credentials = credentials == null ? new CredentialsLookup(null) : credentials;
    state = state == null ? new State(null) : state;
    cleanup = cleanup == null ? new Cleanup(null) : cleanup;
  }

  /**
   * All defaults.
   *
   * @return the guardian configuration
   */
  public static GuardianConfiguration defaults() {
    return new GuardianConfiguration(null, null, null, null, null, null, null);
  }

  /**
   * Application and sharding.
   *
   * @param name       application name
   * @param shardId    this process's shard
   * @param shardTotal number of shards
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record App(@JsonProperty("name") String name,
                    @JsonProperty("shard_id") Integer shardId,
                    @JsonProperty("shard_total") Integer shardTotal) {
    public App {
      name = name == null ? "cookie-guardian" : name;
      shardId = shardId == null ? 0 : shardId;
      shardTotal = shardTotal == null ? 1 : shardTotal;
    }
  }

  /**
   * GitHub API access.
   *
   * @param apiUrl   REST base URL
   * @param org      organization to discover in
   * @param tokenEnv environment variable holding the token
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record GitHub(@JsonProperty("api_url") String apiUrl,
                       @JsonProperty("org") String org,
                       @JsonProperty("token_env") String tokenEnv) {
    public GitHub {
      apiUrl = apiUrl == null ? "https://api.github.com" : apiUrl;
      org = org == null ? "" : org;
      tokenEnv = tokenEnv == null ? "GITHUB_TOKEN" : tokenEnv;
    }
  }

  /**
   * Decision advisor.
   *
   * @param apiUrl        chat-completions URL
   * @param apiKeyEnv     environment variable holding the key
   * @param model         model name
   * @param defaultAction action used when no key is set
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Advisor(@JsonProperty("api_url") String apiUrl,
                        @JsonProperty("api_key_env") String apiKeyEnv,
                        @JsonProperty("model") String model,
                        @JsonProperty("default_action") String defaultAction) {
    public Advisor {
      apiUrl = apiUrl == null ? "https://open.bigmodel.cn/api/paas/v4/chat/completions" : apiUrl;
      apiKeyEnv = apiKeyEnv == null ? "GLM_API_KEY" : apiKeyEnv;
      model = model == null ? "glm-4-air" : model;
      defaultAction = defaultAction == null ? "extract" : defaultAction;
    }
  }

  /**
   * Network identity rotation.
   *
   * @param enabled           whether to rotate before each target
   * @param connectTimeoutSec seconds to wait for a connection
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Warp(@JsonProperty("enabled") Boolean enabled,
                     @JsonProperty("connect_timeout_sec") Integer connectTimeoutSec) {
    public Warp {
      enabled = enabled == null ? Boolean.FALSE : enabled;
      connectTimeoutSec = connectTimeoutSec == null ? 30 : connectTimeoutSec;
    }
  }

  /**
   * Login credentials lookup.
   *
   * @param prefix environment variable prefix
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CredentialsLookup(@JsonProperty("prefix") String prefix) {
    public CredentialsLookup {
      prefix = prefix == null ? "USER_CREDENTIALS" : prefix;
    }
  }

  /**
   * Run-state file.
   *
   * @param path file path; blank keeps state in memory only
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record State(@JsonProperty("path") String path) {
    public State {
      path = path == null ? "" : path;
    }
  }

  /**
   * Temporary file sweep.
   *
   * @param tempFilePattern glob swept from the temp directory
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Cleanup(@JsonProperty("temp_file_pattern") String tempFilePattern) {
    public Cleanup {
      tempFilePattern = tempFilePattern == null ? "cookie_*" : tempFilePattern;
    }
  }
}
