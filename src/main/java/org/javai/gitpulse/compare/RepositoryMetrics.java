package org.javai.gitpulse.compare;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Health metrics of one repository.
 *
 * @param owner The repository owner
 * @param repo The repository name
 * @param openIssues Open issues excluding pull requests, never negative
 * @param openPullRequests Open pull requests; 0 when they could not be counted
 * @param stars Stargazers
 * @param forks Forks
 * @param watchers Watchers
 * @param lastCommitDate Author date of the latest commit, or null when unknown
 * @param lastCommitAgeDays Whole days since the latest commit, or null when unknown
 * @param language Primary language, or null
 * @param archived Whether the repository is archived
 * @param disabled Whether the repository is disabled
 * @param pushedAt Last push, or null
 */
public record RepositoryMetrics(
        String owner,
        String repo,
        long openIssues,
        long openPullRequests,
        long stars,
        long forks,
        long watchers,
        Instant lastCommitDate,
        Long lastCommitAgeDays,
        String language,
        boolean archived,
        boolean disabled,
        Instant pushedAt
) {

    public RepositoryMetrics {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(repo, "repo must not be null");
        if (openIssues < 0 || openPullRequests < 0) {
            throw new IllegalArgumentException("issue and pull request counts must be >= 0");
        }
    }

    public String key() {
        return owner + "/" + repo;
    }

    /**
     * The value of a comparison metric; empty only for an unknown last commit age.
     */
    public OptionalLong value(ComparisonMetric metric) {
        return switch (metric) {
            case OPEN_ISSUES -> OptionalLong.of(openIssues);
            case OPEN_PRS -> OptionalLong.of(openPullRequests);
            case STARS -> OptionalLong.of(stars);
            case FORKS -> OptionalLong.of(forks);
            case WATCHERS -> OptionalLong.of(watchers);
            case LAST_COMMIT_AGE -> lastCommitAgeDays == null ? OptionalLong.empty() : OptionalLong.of(lastCommitAgeDays);
        };
    }
}
