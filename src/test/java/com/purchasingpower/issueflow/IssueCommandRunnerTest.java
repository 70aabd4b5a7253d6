package com.purchasingpower.issueflow;

import com.purchasingpower.issueflow.cli.ConfigCommand;
import com.purchasingpower.issueflow.cli.IssueFlowCommand;
import com.purchasingpower.issueflow.cli.RunCommand;
import com.purchasingpower.issueflow.cli.SmokeTestCommand;
import com.purchasingpower.issueflow.cli.StatusCommand;
import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.client.LlmClient;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.repository.WorkflowStateStore;
import com.purchasingpower.issueflow.workflow.IssueResolutionWorkflow;
import com.purchasingpower.issueflow.workflow.WorkflowSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Issue Command Runner Tests")
class IssueCommandRunnerTest {

    @Mock
    private IssueResolutionWorkflow workflow;

    @Mock
    private GitHubClient gitHubClient;

    @Mock
    private LlmClient llmClient;

    @Mock
    private WorkflowStateStore stateStore;

    private IssueCommandRunner runner;

    @BeforeEach
    void setUp() {
        WorkflowSettings settings = WorkflowSettings.builder().build();
        runner = new IssueCommandRunner(
                new IssueFlowCommand(),
                new RunCommand(workflow, settings),
                new StatusCommand(gitHubClient, stateStore, settings),
                new ConfigCommand(new AppProperties(), settings),
                new SmokeTestCommand(gitHubClient, llmClient));
    }

    @Test
    @DisplayName("Should detect command line runs by command name or repo option")
    void testIsCommandLineRun_ShouldLookForCommandOrRepo() {
        assertThat(IssueCommandRunner.isCommandLineRun(new String[]{"--repo=acme/app", "--issue=7"})).isTrue();
        assertThat(IssueCommandRunner.isCommandLineRun(new String[]{"config"})).isTrue();
        assertThat(IssueCommandRunner.isCommandLineRun(new String[]{"--server.port=9090"})).isFalse();
        assertThat(IssueCommandRunner.isCommandLineRun(new String[0])).isFalse();
    }

    @Test
    @DisplayName("Should treat bare repo and issue options as the run command")
    void testNormalize_ShouldPrependRun() {
        assertThat(IssueCommandRunner.normalize(new String[]{"--repo=acme/app", "--issue=7"}))
                .containsExactly("run", "--repo=acme/app", "--issue=7");
        assertThat(IssueCommandRunner.normalize(new String[]{"status", "--repo=acme/app"}))
                .containsExactly("status", "--repo=acme/app");
    }

    @Test
    @DisplayName("Should exit 0 when the invocation succeeds")
    void testRun_ShouldExitZeroOnSuccess() {
        // Given
        when(workflow.processIssue("acme/app", 7, 5)).thenReturn(true);

        // When
        runner.run("--repo=acme/app", "--issue=7");

        // Then
        assertThat(runner.getExitCode()).isZero();
        verify(workflow).processIssue("acme/app", 7, 5);
    }

    @Test
    @DisplayName("Should pass --max-iterations as this run's round budget")
    void testRun_ShouldUseMaxIterationsOption() {
        when(workflow.processIssue("acme/app", 7, 2)).thenReturn(true);

        runner.run("run", "--repo", "acme/app", "--issue", "7", "--max-iterations", "2");

        assertThat(runner.getExitCode()).isZero();
        verify(workflow).processIssue("acme/app", 7, 2);
    }

    @Test
    @DisplayName("Should exit 1 when the invocation fails")
    void testRun_ShouldExitOneOnFailure() {
        when(workflow.processIssue("acme/app", 7, 5)).thenReturn(false);

        runner.run("--repo=acme/app", "--issue=7");

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject malformed arguments without running")
    void testRun_ShouldRejectBadArguments() {
        runner.run("--repo=not-a-repo", "--issue=seven");

        assertThat(runner.getExitCode()).isEqualTo(1);
        verifyNoInteractions(workflow);
    }

    @Test
    @DisplayName("Should leave server startups alone")
    void testRun_ShouldIgnoreServerArguments() {
        runner.run("--server.port=9090");

        assertThat(runner.getExitCode()).isZero();
        verifyNoInteractions(workflow, gitHubClient, llmClient, stateStore);
    }
}
