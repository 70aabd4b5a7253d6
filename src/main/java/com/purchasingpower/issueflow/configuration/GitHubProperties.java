package com.purchasingpower.issueflow.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GitHubProperties {

    @NotBlank
    private String apiUrl = "https://api.github.com";

    /**
     * Prefix the repository full name is appended to (plus ".git") when cloning.
     */
    @NotBlank
    private String cloneBaseUrl = "https://github.com/";

    @NotBlank
    private String token;

    /**
     * HMAC secret for X-Hub-Signature-256. Blank disables verification.
     */
    private String webhookSecret;

    @NotBlank
    private String triggerLabel = "ai-agent";
}
