package com.codeheadsystems.guardian.client.accessor;

import com.codeheadsystems.guardian.client.exceptions.GitHubAccessorException;
import com.codeheadsystems.guardian.client.model.ContentEntry;
import com.codeheadsystems.guardian.client.model.PublicKeyResponse;
import com.codeheadsystems.guardian.client.model.RepositoryResponse;
import com.codeheadsystems.guardian.client.model.SecretUploadRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the GitHub REST endpoints used here: the Actions secrets pair and the
 * organization/contents listings used for discovery.
 * <p>
 * Every request carries the bearer token and {@code application/vnd.github+json}. A 401 response
 * is surfaced as a {@link SecurityException}; any other error status, I/O errors and
 * interruptions are wrapped in {@link GitHubAccessorException}.
 */
@Singleton
public class GitHubAccessor {

  /** Page size for listings. */
  public static final int PAGE_SIZE = 100;

  static final String ACCEPT = "application/vnd.github+json";
  static final String API_VERSION = "2022-11-28";
  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private static final Logger log = LoggerFactory.getLogger(GitHubAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI apiBase;
  private final String token;

  /**
   * Instantiates a new GitHub accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param apiBase      API base, e.g. {@code https://api.github.com}
   * @param token        the bearer token, resolved from the environment by the caller
   */
  public GitHubAccessor(final HttpClient httpClient,
                        final ObjectMapper objectMapper,
                        final URI apiBase,
                        final String token) {
    log.info("GitHubAccessor({})", apiBase);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.apiBase = apiBase;
    this.token = token;
  }

  // ── Secrets ───────────────────────────────────────────────────────────────

  /**
   * Fetches the repository's Actions public key.
   *
   * @param repository owner/name
   * @return the public key response
   */
  public PublicKeyResponse getPublicKey(final String repository) {
    log.debug("getPublicKey(repository={})", repository);
    return get(repository, uri("/repos/" + repository + "/actions/secrets/public-key"),
        new TypeReference<PublicKeyResponse>() { });
  }

  /**
   * Creates or replaces a repository Actions secret.
   *
   * @param repository owner/name
   * @param secretName the secret name
   * @param body       the sealed value and key id
   */
  public void putSecret(final String repository, final String secretName, final SecretUploadRequest body) {
    log.debug("putSecret(repository={}, secretName={})", repository, secretName);
    URI uri = uri("/repos/" + repository + "/actions/secrets/" + encode(secretName));
    try {
      HttpRequest request = builder(uri)
          .header("Content-Type", "application/json")
          .PUT(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(repository, response.statusCode());
    } catch (IOException e) {
      throw new GitHubAccessorException("HTTP request failed for repository: " + repository, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GitHubAccessorException("HTTP request interrupted for repository: " + repository, e);
    }
  }

  // ── Discovery ─────────────────────────────────────────────────────────────

  /**
   * One page of an organization's repositories.
   *
   * @param organization the organization
   * @param page         1-based page number
   * @return the repositories, fewer than {@link #PAGE_SIZE} on the last page
   */
  public List<RepositoryResponse> listOrganizationRepositories(final String organization, final int page) {
    log.debug("listOrganizationRepositories(organization={}, page={})", organization, page);
    return get(organization,
        uri("/orgs/" + encode(organization) + "/repos?per_page=" + PAGE_SIZE + "&page=" + page),
        new TypeReference<List<RepositoryResponse>>() { });
  }

  /**
   * Root directory listing of a repository.
   *
   * @param repository owner/name
   * @return the entries
   */
  public List<ContentEntry> listRootContents(final String repository) {
    log.debug("listRootContents(repository={})", repository);
    return get(repository, uri("/repos/" + repository + "/contents/"),
        new TypeReference<List<ContentEntry>>() { });
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private <T> T get(String subject, URI uri, TypeReference<T> responseType) {
    try {
      HttpRequest request = builder(uri).GET().build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(subject, response.statusCode());
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new GitHubAccessorException("HTTP request failed for: " + subject, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GitHubAccessorException("HTTP request interrupted for: " + subject, e);
    }
  }

  private HttpRequest.Builder builder(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(TIMEOUT)
        .header("Authorization", "Bearer " + token)
        .header("Accept", ACCEPT)
        .header("X-GitHub-Api-Version", API_VERSION);
  }

  private URI uri(String path) {
    String base = apiBase.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8);
  }

  private void checkStatus(String subject, int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("GitHub rejected the token (401) for: " + subject);
    }
    if (statusCode >= 400) {
      throw new GitHubAccessorException("GitHub returned HTTP " + statusCode + " for: " + subject, null);
    }
  }
}
