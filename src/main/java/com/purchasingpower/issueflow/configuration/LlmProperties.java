package com.purchasingpower.issueflow.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * OpenAI-compatible chat completion endpoint (OpenAI, OpenRouter, a local gateway).
 */
@Data
public class LlmProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    @NotBlank
    private String model = "gpt-4o-mini";

    /**
     * Optional OpenRouter attribution headers.
     */
    private String referer;

    private String title;
}
