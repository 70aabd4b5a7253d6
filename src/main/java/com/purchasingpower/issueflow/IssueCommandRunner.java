package com.purchasingpower.issueflow;

import com.purchasingpower.issueflow.cli.ConfigCommand;
import com.purchasingpower.issueflow.cli.IssueFlowCommand;
import com.purchasingpower.issueflow.cli.RunCommand;
import com.purchasingpower.issueflow.cli.SmokeTestCommand;
import com.purchasingpower.issueflow.cli.StatusCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Bridges Spring Boot startup to the picocli commands:
 *
 * <pre>
 * java -jar issueflow.jar run --repo owner/name --issue 42 [--max-iterations 3]
 * java -jar issueflow.jar status --repo owner/name --issue 42
 * java -jar issueflow.jar config
 * java -jar issueflow.jar test --repo owner/name
 * </pre>
 *
 * A bare {@code --repo owner/name --issue 42} means {@code run}. Bad arguments exit 1.
 * Without a command the application starts as the webhook server instead.
 */
@Component
@RequiredArgsConstructor
public class IssueCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    static final Set<String> COMMANDS = Set.of("run", "status", "config", "test", "help");

    private final IssueFlowCommand rootCommand;
    private final RunCommand runCommand;
    private final StatusCommand statusCommand;
    private final ConfigCommand configCommand;
    private final SmokeTestCommand smokeTestCommand;

    private int exitCode = 0;

    static boolean isCommandLineRun(String[] args) {
        if (args.length > 0 && COMMANDS.contains(args[0])) {
            return true;
        }
        return Arrays.stream(args).anyMatch(arg -> arg.equals("--repo") || arg.startsWith("--repo="));
    }

    static String[] normalize(String[] args) {
        if (args.length > 0 && COMMANDS.contains(args[0])) {
            return args;
        }
        return Stream.concat(Stream.of("run"), Arrays.stream(args)).toArray(String[]::new);
    }

    @Override
    public void run(String... args) {
        if (!isCommandLineRun(args)) {
            return;
        }
        exitCode = commandLine().execute(normalize(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(rootCommand)
                .addSubcommand(runCommand)
                .addSubcommand(statusCommand)
                .addSubcommand(configCommand)
                .addSubcommand(smokeTestCommand)
                .addSubcommand(new CommandLine.HelpCommand());
        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            failed.usage(failed.getErr());
            return 1;
        });
        return commandLine;
    }
}
