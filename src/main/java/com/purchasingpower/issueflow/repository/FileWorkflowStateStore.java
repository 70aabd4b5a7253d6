package com.purchasingpower.issueflow.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.exception.StateStoreException;
import com.purchasingpower.issueflow.workflow.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One pretty-printed JSON file per issue, named {@code owner_name_<issue>.json}.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the
 * record, so a crash mid-write leaves the previous record intact.
 */
@Slf4j
@Repository
public class FileWorkflowStateStore implements WorkflowStateStore {

    private final Path stateDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileWorkflowStateStore(AppProperties appProperties, ObjectMapper objectMapper) {
        this(Paths.get(appProperties.getStateDir()), objectMapper);
    }

    public FileWorkflowStateStore(Path stateDir, ObjectMapper objectMapper) {
        this.stateDir = stateDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<WorkflowState> load(String repo, int issueNumber) {
        Path path = pathFor(repo, issueNumber);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            WorkflowState state = objectMapper.readValue(path.toFile(), WorkflowState.class);
            if (state == null) {
                throw new StateStoreException("State record " + path + " is empty", null);
            }
            return Optional.of(state);
        } catch (IOException e) {
            throw new StateStoreException("Corrupt state record " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(String repo, int issueNumber, WorkflowState state) {
        Path target = pathFor(repo, issueNumber);
        Path temp = null;
        try {
            Files.createDirectories(stateDir);
            temp = Files.createTempFile(stateDir, target.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            moveIntoPlace(temp, target);
            log.debug("💾 Saved state {} (step={}, iteration={})", target.getFileName(),
                    state.getStep(), state.getIteration());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StateStoreException("Failed to write state record " + target, e);
        }
    }

    @Override
    public void clear(String repo, int issueNumber) {
        try {
            Files.deleteIfExists(pathFor(repo, issueNumber));
        } catch (IOException e) {
            throw new StateStoreException("Failed to clear state for " + repo + "#" + issueNumber, e);
        }
    }

    Path pathFor(String repo, int issueNumber) {
        return stateDir.resolve(repo.replace('/', '_') + "_" + issueNumber + ".json");
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary state file {}", temp, e);
        }
    }
}
