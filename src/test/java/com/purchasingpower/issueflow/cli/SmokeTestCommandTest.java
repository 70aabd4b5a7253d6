package com.purchasingpower.issueflow.cli;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.client.LlmClient;
import com.purchasingpower.issueflow.exception.GitHubApiException;
import com.purchasingpower.issueflow.exception.LlmClientException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Smoke Test Command Tests")
class SmokeTestCommandTest {

    @Mock
    private GitHubClient gitHubClient;

    @Mock
    private LlmClient llmClient;

    private final StringWriter out = new StringWriter();

    @Test
    @DisplayName("Should exit 0 when GitHub and the LLM both answer")
    void testSmokeTest_ShouldPassWhenBothAnswer() {
        // Given
        when(gitHubClient.canPush("acme/app")).thenReturn(true);
        when(llmClient.generate(eq("ping"), any())).thenReturn("pong");

        // When
        int exitCode = execute("--repo", "acme/app");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("GitHub token: OK (push access: yes)").contains("LLM API: OK");
    }

    @Test
    @DisplayName("Should still check the LLM when GitHub fails, then exit 1")
    void testSmokeTest_ShouldReportEachFailure() {
        when(gitHubClient.canPush("acme/app")).thenThrow(new GitHubApiException("canPush", 401, "Bad credentials", null));
        when(llmClient.generate(eq("ping"), any())).thenThrow(new LlmClientException("LLM returned 401"));

        int exitCode = execute("--repo", "acme/app");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("GitHub token failed:").contains("LLM API failed: LLM returned 401");
        verify(llmClient).generate(eq("ping"), any());
    }

    @Test
    @DisplayName("Should require the repo option")
    void testSmokeTest_ShouldRequireRepo() {
        int exitCode = new CommandLine(new SmokeTestCommand(gitHubClient, llmClient))
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(new StringWriter()))
                .execute();

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private int execute(String... args) {
        return new CommandLine(new SmokeTestCommand(gitHubClient, llmClient))
                .setOut(new PrintWriter(out))
                .execute(args);
    }
}
