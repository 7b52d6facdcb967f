package org.javai.gitpulse.compare;

import org.javai.gitpulse.ApiCallException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One repository to compare, identified by owner and name.
 *
 * @param owner The account or organization that owns the repository
 * @param repo The repository name
 */
public record ComparisonTarget(String owner, String repo) {

    static final String OPERATION = "validate_repository";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9._-]+");

    public ComparisonTarget {
        owner = requireName("owner", owner);
        repo = requireName("repo", repo);
    }

    /**
     * Parses {@code owner/repo}.
     *
     * @throws ApiCallException with kind {@code VALIDATION} when the text is not of that form
     */
    public static ComparisonTarget parse(String text) {
        if (text == null) {
            throw ApiCallException.validation(OPERATION, "Repository must be given as owner/repo");
        }
        int slash = text.indexOf('/');
        if (slash < 0 || slash != text.lastIndexOf('/')) {
            throw ApiCallException.validation(OPERATION,
                    "Repository must be given as owner/repo, got '" + text + "'");
        }
        return new ComparisonTarget(text.substring(0, slash), text.substring(slash + 1));
    }

    /**
     * The {@code owner/repo} form used as the key of metric tables and rankings.
     */
    public String key() {
        return owner + "/" + repo;
    }

    /**
     * The API path of the repository, {@code /repos/owner/repo}.
     */
    public String apiPath() {
        return "/repos/" + owner + "/" + repo;
    }

    /**
     * Identity used to detect duplicates; repository names are case-insensitive upstream.
     */
    String identity() {
        return key().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return key();
    }

    private static String requireName(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ApiCallException.validation(OPERATION, field + " must not be blank");
        }
        String trimmed = value.trim();
        if (!NAME.matcher(trimmed).matches() || trimmed.equals(".") || trimmed.equals("..")) {
            throw ApiCallException.validation(OPERATION,
                    field + " contains characters not allowed in a repository path: '" + value + "'");
        }
        return trimmed;
    }
}
