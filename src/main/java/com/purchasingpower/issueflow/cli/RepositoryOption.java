package com.purchasingpower.issueflow.cli;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * {@code --repo owner/name}, shared by the commands that talk to one repository.
 */
public class RepositoryOption {

    private static final String REPO_PATTERN = "[\\w.-]+/[\\w.-]+";

    @Spec(Spec.Target.MIXEE)
    private CommandSpec mixee;

    private String repo;

    @Option(names = "--repo", required = true, paramLabel = "OWNER/NAME", description = "Repository (owner/name)")
    void setRepo(String value) {
        if (value != null && !value.matches(REPO_PATTERN)) {
            throw new ParameterException(mixee.commandLine(),
                    "Invalid value '%s' for option '--repo': expected owner/name".formatted(value));
        }
        this.repo = value;
    }

    public String repo() {
        return repo;
    }
}
