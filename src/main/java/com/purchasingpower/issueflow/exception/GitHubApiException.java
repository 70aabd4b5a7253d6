package com.purchasingpower.issueflow.exception;

import lombok.Getter;

@Getter
public class GitHubApiException extends RuntimeException {

    private final int statusCode;

    public GitHubApiException(String operation, int statusCode, String body, Throwable cause) {
        super("GitHub API error during %s (%d): %s".formatted(operation, statusCode, body), cause);
        this.statusCode = statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
