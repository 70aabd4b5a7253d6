package com.purchasingpower.issueflow.exception;

import lombok.Getter;

/**
 * Local push of a working-copy branch failed (rejected ref update or transport error).
 * The workflow recovers from this through the contents API.
 */
@Getter
public class GitPushException extends RuntimeException {

    private final String branch;

    public GitPushException(String branch, String message) {
        super(message);
        this.branch = branch;
    }

    public GitPushException(String branch, String message, Throwable cause) {
        super(message, cause);
        this.branch = branch;
    }
}
