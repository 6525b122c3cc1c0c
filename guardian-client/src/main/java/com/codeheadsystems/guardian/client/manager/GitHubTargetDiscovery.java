package com.codeheadsystems.guardian.client.manager;

import com.codeheadsystems.guardian.client.accessor.GitHubAccessor;
import com.codeheadsystems.guardian.client.config.GuardianConfiguration;
import com.codeheadsystems.guardian.client.exceptions.DiscoveryException;
import com.codeheadsystems.guardian.client.exceptions.GitHubAccessorException;
import com.codeheadsystems.guardian.client.model.ContentEntry;
import com.codeheadsystems.guardian.client.model.RepositoryResponse;
import com.codeheadsystems.guardian.core.collaborator.TargetDiscovery;
import com.codeheadsystems.guardian.core.model.Target;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists an organization's repositories and scores each one by how likely it is to hold
 * service configuration.
 * <p>
 * Score: {@value #FILE_WEIGHT} per root-level file with a configuration or script extension, plus
 * {@code min(stars / 1000, 0.5)}, capped at 1.0. Repositories scoring zero are dropped. A
 * repository whose root cannot be listed (empty repositories answer 404) is scored on stars
 * alone.
 */
@Singleton
public class GitHubTargetDiscovery implements TargetDiscovery {

  static final double FILE_WEIGHT = 0.1;
  static final List<String> SCORED_EXTENSIONS = List.of(".env", ".yaml", ".yml", ".json", ".py", ".js");

  private static final int MAX_PAGES = 100;
  private static final Logger log = LoggerFactory.getLogger(GitHubTargetDiscovery.class);

  private final GitHubAccessor accessor;
  private final String organization;

  /**
   * Discovery over the configured organization.
   *
   * @param accessor the accessor
   * @param github   the github section of the configuration
   */
  @Inject
  public GitHubTargetDiscovery(final GitHubAccessor accessor, final GuardianConfiguration.GitHub github) {
    this(accessor, github.org());
  }

  /**
   * Instantiates a new GitHub target discovery.
   *
   * @param accessor     the accessor
   * @param organization the organization to list
   */
  public GitHubTargetDiscovery(final GitHubAccessor accessor, final String organization) {
    log.info("GitHubTargetDiscovery({})", organization);
    this.accessor = accessor;
    this.organization = organization;
  }

  @Override
  public List<Target> discover() {
    if (organization == null || organization.isBlank()) {
      throw new DiscoveryException("No organization configured for discovery", null);
    }
    final List<Target> targets = new ArrayList<>();
    for (RepositoryResponse repository : listAll()) {
      double score = score(repository);
      if (score > 0) {
        targets.add(new Target(repository.fullName(), repository.htmlUrl(), score));
      }
    }
    targets.sort(Comparator.comparingDouble(Target::relevanceScore).reversed());
    log.info("Discovered {} candidate(s) in {}", targets.size(), organization);
    return targets;
  }

  double score(final RepositoryResponse repository) {
    double score = 0.0;
    for (ContentEntry entry : rootContents(repository.fullName())) {
      if (entry.isFile() && hasScoredExtension(entry.name())) {
        score += FILE_WEIGHT;
      }
    }
    score += Math.min(repository.stargazersCount() / 1000.0, 0.5);
    return Math.min(score, 1.0);
  }

  private List<RepositoryResponse> listAll() {
    final List<RepositoryResponse> all = new ArrayList<>();
    try {
      for (int page = 1; page <= MAX_PAGES; page++) {
        List<RepositoryResponse> batch = accessor.listOrganizationRepositories(organization, page);
        all.addAll(batch);
        if (batch.size() < GitHubAccessor.PAGE_SIZE) {
          break;
        }
      }
    } catch (GitHubAccessorException | SecurityException e) {
      throw new DiscoveryException("Could not list repositories of " + organization, e);
    }
    return all;
  }

  private List<ContentEntry> rootContents(final String repository) {
    try {
      return accessor.listRootContents(repository);
    } catch (GitHubAccessorException e) {
      log.debug("No root listing for {}: {}", repository, e.getMessage());
      return List.of();
    }
  }

  private static boolean hasScoredExtension(final String name) {
    return name != null && SCORED_EXTENSIONS.stream().anyMatch(name::endsWith);
  }
}
