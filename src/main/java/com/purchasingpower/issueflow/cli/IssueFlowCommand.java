package com.purchasingpower.issueflow.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command. Subcommands are registered by {@link com.purchasingpower.issueflow.IssueCommandRunner}.
 */
@Command(
        name = "issueflow",
        mixinStandardHelpOptions = true,
        version = "IssueFlow 0.1.0",
        description = "Resolves GitHub issues with pull requests, one review round per invocation"
)
@Component
public class IssueFlowCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
