package com.purchasingpower.issueflow.workflow;

import com.purchasingpower.issueflow.git.WorkingCopy;
import com.purchasingpower.issueflow.git.WorkingCopyService;
import com.purchasingpower.issueflow.model.github.FileUpdate;
import com.purchasingpower.issueflow.support.GitFixtures;
import com.purchasingpower.issueflow.support.WorkflowHarness;
import com.purchasingpower.issueflow.workflow.state.ChangeSet;
import com.purchasingpower.issueflow.workflow.state.FileChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.FileSystemUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Change Publisher Tests")
class ChangePublisherTest {

    private static final String REPO = "acme/app";

    @TempDir
    Path tempDir;

    private WorkflowHarness harness;
    private WorkingCopyService workingCopyService;
    private ChangePublisher publisher;
    private Path remote;

    @BeforeEach
    void setUp() throws Exception {
        harness = new WorkflowHarness(tempDir);
        remote = GitFixtures.createRemote(harness.remotes, REPO, Map.of("main.txt", "hi\n", "old.txt", "bye\n"));
        workingCopyService = new WorkingCopyService(harness.appProperties);
        publisher = new ChangePublisher(harness.gitHub, WorkflowSettings.builder().build());
    }

    @Test
    @DisplayName("Should commit and push applicable changes to the issue branch")
    void testPublish_ShouldPushToIssueBranch() throws Exception {
        // Given
        ChangeSet changeSet = new ChangeSet("Greet", List.of(
                FileChange.modify("main.txt", "hello\n"),
                FileChange.delete("old.txt")));

        try (WorkingCopy workingCopy = workingCopyService.checkout(REPO, "main")) {
            // When
            List<FileChange> applied = publisher.publish(REPO, 4, workingCopy, changeSet);

            // Then
            assertThat(applied).hasSize(2);
            assertThat(workingCopy.currentBranch()).isEqualTo("agent/issue-4");
        }
        assertThat(GitFixtures.readOnRemote(remote, "agent/issue-4", "main.txt")).isEqualTo("hello\n");
        assertThat(GitFixtures.readOnRemote(remote, "agent/issue-4", "old.txt")).isNull();
        assertThat(harness.gitHub.mutationCount()).isZero();
    }

    @Test
    @DisplayName("Should skip unrecognized entries and paths outside the repository")
    void testPublish_ShouldSkipInvalidEntries() throws Exception {
        // Given
        ChangeSet changeSet = new ChangeSet("Partial", List.of(
                FileChange.unrecognized("{\"path\":\"x\",\"action\":\"rename\"}", "unknown action 'rename'"),
                FileChange.modify("../escape.txt", "nope"),
                FileChange.modify("docs/new.md", "# New\n")));

        try (WorkingCopy workingCopy = workingCopyService.checkout(REPO, "main")) {
            // When
            List<FileChange> applied = publisher.publish(REPO, 5, workingCopy, changeSet);

            // Then
            assertThat(applied).extracting(FileChange::path).containsExactly("docs/new.md");
        }
        assertThat(GitFixtures.readOnRemote(remote, "agent/issue-5", "docs/new.md")).isEqualTo("# New\n");
    }

    @Test
    @DisplayName("Should neither commit nor push when nothing is applicable")
    void testPublish_ShouldDoNothingForEmptyChangeSet() throws Exception {
        // Given
        ChangeSet changeSet = new ChangeSet("Nothing", List.of(FileChange.unrecognized("42", "entry is not an object")));

        try (WorkingCopy workingCopy = workingCopyService.checkout(REPO, "main")) {
            // When
            List<FileChange> applied = publisher.publish(REPO, 6, workingCopy, changeSet);

            // Then
            assertThat(applied).isEmpty();
        }
        assertThat(GitFixtures.readOnRemote(remote, "agent/issue-6", "main.txt")).isNull();
        assertThat(harness.gitHub.mutationCount()).isZero();
    }

    @Test
    @DisplayName("Should fall back to the contents API when the push fails")
    void testPublish_ShouldFallBackToApiCommit() {
        // Given
        ChangeSet changeSet = new ChangeSet("Greet", List.of(
                FileChange.modify("main.txt", "hello\n"),
                FileChange.delete("old.txt")));

        try (WorkingCopy workingCopy = workingCopyService.checkout(REPO, "main")) {
            FileSystemUtils.deleteRecursively(remote.toFile());

            // When
            List<FileChange> applied = publisher.publish(REPO, 8, workingCopy, changeSet);

            // Then
            assertThat(applied).hasSize(2);
        }
        assertThat(harness.gitHub.ensuredBranches).containsExactly("agent/issue-8");
        assertThat(harness.gitHub.apiFileUpdates).containsExactly(
                FileUpdate.write("main.txt", "hello\n"),
                FileUpdate.delete("old.txt"));
    }
}
