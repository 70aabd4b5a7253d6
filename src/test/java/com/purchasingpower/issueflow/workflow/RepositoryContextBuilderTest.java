package com.purchasingpower.issueflow.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.issueflow.git.WorkingCopy;
import com.purchasingpower.issueflow.git.WorkingCopyService;
import com.purchasingpower.issueflow.support.GitFixtures;
import com.purchasingpower.issueflow.support.WorkflowHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Repository Context Builder Tests")
class RepositoryContextBuilderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WorkingCopyService workingCopyService;

    @BeforeEach
    void setUp() throws Exception {
        WorkflowHarness harness = new WorkflowHarness(tempDir);
        GitFixtures.createRemote(harness.remotes, "acme/app", Map.of(
                "README.md", "# App\n",
                "src/app.py", "x".repeat(50)));
        workingCopyService = new WorkingCopyService(harness.appProperties);
    }

    @Test
    @DisplayName("Should embed the tree and truncated contents of the selected files")
    void testBuild_ShouldTruncateLargeFiles() throws Exception {
        // Given
        WorkflowSettings settings = WorkflowSettings.builder().maxFileChars(20).build();
        RepositoryContextBuilder builder = new RepositoryContextBuilder(new FileSelector(), objectMapper, settings);

        try (WorkingCopy workingCopy = workingCopyService.checkout("acme/app", "main")) {
            // When
            RepositoryContext context = builder.build(workingCopy, "Crash in src/app.py");

            // Then
            assertThat(context.selectedPaths()).containsExactly("README.md", "src/app.py");
            JsonNode structure = objectMapper.readTree(context.structure());
            assertThat(structure.get("src").has("app.py")).isTrue();

            JsonNode files = objectMapper.readTree(context.relevantFiles());
            assertThat(files).hasSize(2);
            assertThat(files.get(0).get("path").asText()).isEqualTo("README.md");
            assertThat(files.get(0).get("content").asText()).isEqualTo("# App\n");
            assertThat(files.get(1).get("content").asText())
                    .isEqualTo("x".repeat(20) + RepositoryContextBuilder.TRUNCATION_MARKER);
        }
    }
}
