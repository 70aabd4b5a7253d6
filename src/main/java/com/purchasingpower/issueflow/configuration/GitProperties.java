package com.purchasingpower.issueflow.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GitProperties {

    @NotBlank
    private String authorName = "IssueFlow Bot";

    @NotBlank
    private String authorEmail = "issueflow-bot@users.noreply.github.com";

    /**
     * Username paired with the token for HTTPS clone and push.
     */
    @NotBlank
    private String tokenUsername = "x-access-token";
}
