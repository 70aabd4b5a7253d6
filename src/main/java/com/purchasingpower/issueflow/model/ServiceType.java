package com.purchasingpower.issueflow.model;

/**
 * External collaborators whose calls are bracketed by {@link CallContext} log lines.
 *
 * @see com.purchasingpower.issueflow.util.ExternalCallLogger
 */
public enum ServiceType {
    GITHUB("🐙", "GitHub"),
    LLM("🔴", "LLM"),
    GIT("🔷", "Git");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
