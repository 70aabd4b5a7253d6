package com.purchasingpower.issueflow.workflow;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.exception.GitPushException;
import com.purchasingpower.issueflow.git.WorkingCopy;
import com.purchasingpower.issueflow.model.github.FileUpdate;
import com.purchasingpower.issueflow.workflow.state.ChangeSet;
import com.purchasingpower.issueflow.workflow.state.FileChange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a change set to the working copy and gets it onto the issue branch on GitHub.
 *
 * <p>The normal path is commit and push. When the push fails the same files are written
 * through the contents API instead, so a round is never lost to a rejected push.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangePublisher {

    private final GitHubClient gitHubClient;
    private final WorkflowSettings settings;

    /**
     * @return the changes that were applied; empty when there was nothing to publish
     */
    public List<FileChange> publish(String repo, int issueNumber, WorkingCopy workingCopy, ChangeSet changeSet) {
        List<FileChange> applied = apply(workingCopy, changeSet);
        if (applied.isEmpty()) {
            log.warn("⚠️ Change set for {}#{} has no applicable entries, nothing to publish", repo, issueNumber);
            return applied;
        }

        String branch = settings.branchFor(issueNumber);
        workingCopy.ensureBranch(branch);
        workingCopy.stageAndCommit(applied.stream().map(FileChange::path).toList(), changeSet.commitMessage());

        try {
            workingCopy.push(branch);
            log.info("⬆️ Pushed {} to {}", branch, repo);
        } catch (GitPushException e) {
            log.warn("⚠️ Git push failed ({}). Falling back to API commit.", e.getMessage());
            gitHubClient.ensureBranch(repo, settings.getBaseBranch(), branch);
            gitHubClient.applyFileChanges(repo, branch, toFileUpdates(applied), changeSet.commitMessage());
        }
        return applied;
    }

    private List<FileChange> apply(WorkingCopy workingCopy, ChangeSet changeSet) {
        List<FileChange> applied = new ArrayList<>();
        for (FileChange change : changeSet.files()) {
            if (!change.isApplicable()) {
                log.warn("⚠️ Skipping invalid file entry ({}): {}", change.reason(), change.raw());
                continue;
            }
            try {
                switch (change.kind()) {
                    case MODIFY -> workingCopy.writeFile(change.path(), change.content());
                    case DELETE -> workingCopy.deleteFile(change.path());
                    default -> throw new IllegalStateException("Unexpected change kind " + change.kind());
                }
                applied.add(change);
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ Skipping {}: {}", change.path(), e.getMessage());
            }
        }
        return applied;
    }

    private static List<FileUpdate> toFileUpdates(List<FileChange> changes) {
        return changes.stream()
                .map(c -> c.kind() == FileChange.Kind.DELETE
                        ? FileUpdate.delete(c.path())
                        : FileUpdate.write(c.path(), c.content()))
                .toList();
    }
}
