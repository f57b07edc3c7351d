package com.agentrelay.core.errors;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Known failure signatures in the worker's diagnostic output, each with an actionable suggestion.
 * Order matters: the first matching pattern wins.
 */
public enum DiagnosticPattern {

    AUTHENTICATION(ErrorCode.AUTH_ERROR,
            "(?i)(\\b401\\b|unauthori[sz]ed|not logged in|invalid api key|authentication (failed|required)|login required)",
            "Worker authentication failed",
            "Run the worker's login command or set a valid API key, then retry"),
    UNTRUSTED_DIRECTORY(ErrorCode.UNTRUSTED_DIRECTORY,
            "(?i)(not inside a trusted directory|skip-git-repo-check|not a git repository)",
            "Working directory is not trusted by the worker",
            "Run the task inside a git repository or enable skip-git-repo-check for this request"),
    NETWORK(ErrorCode.NETWORK_ERROR,
            "(?i)(ENOTFOUND|ECONNREFUSED|ECONNRESET|connection refused|could not resolve host|network (is )?unreachable|network error)",
            "Worker could not reach its model provider",
            "Check network connectivity and proxy settings, then retry"),
    RATE_LIMIT(ErrorCode.RATE_LIMITED,
            "(?i)(\\b429\\b|rate.?limit|too many requests|quota exceeded|usage limit)",
            "Worker was rate limited by its model provider",
            "Wait before retrying or reduce the number of concurrent tasks"),
    PERMISSION(ErrorCode.PERMISSION_DENIED,
            "(?i)(permission denied|EACCES|EPERM|operation not permitted)",
            "Worker was denied access to a file or command",
            "Check file permissions or run with a less restrictive sandbox mode"),
    TIMEOUT_PHRASE(ErrorCode.UPSTREAM_TIMEOUT,
            "(?i)(timed out|ETIMEDOUT|deadline exceeded|request timeout)",
            "Worker reported an upstream timeout",
            "Retry later; if it persists, split the task into smaller steps");

    private final ErrorCode code;
    private final Pattern pattern;
    private final String message;
    private final String suggestion;

    DiagnosticPattern(ErrorCode code, String regex, String message, String suggestion) {
        this.code = code;
        this.pattern = Pattern.compile(regex);
        this.message = message;
        this.suggestion = suggestion;
    }

    public ErrorCode code() {
        return code;
    }

    public String message() {
        return message;
    }

    public String suggestion() {
        return suggestion;
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }

    public static Optional<DiagnosticPattern> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (DiagnosticPattern candidate : values()) {
            if (candidate.matches(text)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
