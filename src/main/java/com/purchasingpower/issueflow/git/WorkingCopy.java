package com.purchasingpower.issueflow.git;

import com.purchasingpower.issueflow.exception.GitPushException;
import com.purchasingpower.issueflow.model.CallContext;
import com.purchasingpower.issueflow.model.ServiceType;
import com.purchasingpower.issueflow.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.CreateBranchCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * A cloned repository the workflow may modify.
 *
 * <p>All paths are relative to the clone root and use {@code /} separators; a path that
 * resolves outside the root is rejected with {@link IllegalArgumentException}.
 * Closing the working copy deletes its directory.
 */
@Slf4j
public class WorkingCopy implements AutoCloseable {

    static final Set<String> EXCLUDED_DIRS =
            Set.of(".git", ".venv", "__pycache__", ".pytest_cache", "node_modules", "target");

    private static final String STASH_MESSAGE = "agent-autostash";

    private final Git git;
    private final Path root;
    private final PersonIdent identity;
    private final CredentialsProvider credentials;

    WorkingCopy(Git git, Path root, PersonIdent identity, CredentialsProvider credentials) {
        this.git = git;
        this.root = root.toAbsolutePath().normalize();
        this.identity = identity;
        this.credentials = credentials;
    }

    public Path getRoot() {
        return root;
    }

    public String currentBranch() {
        try {
            return git.getRepository().getBranch();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Regular files of the working tree, sorted, skipping VCS, virtualenv, cache and build directories.
     */
    public List<String> listFiles() {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(WorkingCopy::isIncluded)
                    .map(WorkingCopy::toSlashPath)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files under " + root, e);
        }
    }

    /**
     * Nested directory tree of {@link #listFiles()}: directories map to child maps, files map to null.
     */
    public Map<String, Object> structure() {
        Map<String, Object> tree = new TreeMap<>();
        for (String file : listFiles()) {
            String[] parts = file.split("/");
            Map<String, Object> current = tree;
            for (int i = 0; i < parts.length - 1; i++) {
                current = childDirectory(current, parts[i]);
            }
            current.put(parts[parts.length - 1], null);
        }
        return tree;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> childDirectory(Map<String, Object> parent, String name) {
        Object child = parent.get(name);
        if (child instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        Map<String, Object> created = new TreeMap<>();
        parent.put(name, created);
        return created;
    }

    public String readFile(String path) throws IOException {
        return Files.readString(resolve(path), StandardCharsets.UTF_8);
    }

    public void writeFile(String path, String content) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    /**
     * @return false when the file did not exist
     */
    public boolean deleteFile(String path) {
        try {
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + path, e);
        }
    }

    /**
     * Switches to {@code branch}, keeping uncommitted work.
     *
     * <p>Local changes (untracked files included) are stashed first. The branch is checked out
     * locally when it exists, else created tracking {@code origin/branch}, else created from HEAD.
     * The stash is re-applied afterwards; a failed re-apply is logged and the stash is kept.
     */
    public void ensureBranch(String branch) {
        boolean stashed = stashIfNeeded();
        try {
            fetchOrigin();
            if (git.getRepository().findRef("refs/heads/" + branch) != null) {
                if (!branch.equals(currentBranch())) {
                    git.checkout().setName(branch).call();
                }
            } else if (git.getRepository().findRef("refs/remotes/origin/" + branch) != null) {
                git.checkout()
                        .setCreateBranch(true)
                        .setName(branch)
                        .setStartPoint("origin/" + branch)
                        .setUpstreamMode(CreateBranchCommand.SetupUpstreamMode.TRACK)
                        .call();
            } else {
                git.checkout().setCreateBranch(true).setName(branch).call();
            }
            log.info("🌿 On branch {}", branch);
        } catch (GitAPIException | IOException e) {
            throw new IllegalStateException("Failed to switch to branch " + branch, e);
        } finally {
            if (stashed) {
                restoreStash();
            }
        }
    }

    /**
     * Stages exactly {@code paths} (a path missing from disk is staged as a deletion) and commits.
     *
     * @return false when the paths produced no staged change, in which case nothing is committed
     */
    public boolean stageAndCommit(Collection<String> paths, String message) {
        try {
            for (String path : paths) {
                String normalized = toSlashPath(root.relativize(resolve(path)));
                if (Files.exists(root.resolve(normalized))) {
                    git.add().addFilepattern(normalized).call();
                } else {
                    git.rm().setCached(true).addFilepattern(normalized).call();
                }
            }

            Status status = git.status().call();
            if (status.getAdded().isEmpty() && status.getChanged().isEmpty() && status.getRemoved().isEmpty()) {
                log.info("Nothing staged, skipping commit");
                return false;
            }

            RevCommit commit = git.commit()
                    .setMessage(message)
                    .setAuthor(identity)
                    .setCommitter(identity)
                    .call();
            log.info("📦 Committed {} on {}: {}", commit.abbreviate(7).name(), currentBranch(), message);
            return true;
        } catch (GitAPIException e) {
            throw new IllegalStateException("Failed to commit changes: " + e.getMessage(), e);
        }
    }

    /**
     * Pushes {@code branch:branch} to origin.
     *
     * @throws GitPushException on transport errors or when the remote rejects the update
     */
    public void push(String branch) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GIT, "push", log);
        callCtx.logRequest(branch);
        try {
            Iterable<PushResult> results = git.push()
                    .setRemote("origin")
                    .setRefSpecs(new RefSpec(branch + ":" + branch))
                    .setCredentialsProvider(credentials)
                    .call();

            for (PushResult result : results) {
                for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                    RemoteRefUpdate.Status status = update.getStatus();
                    if (status != RemoteRefUpdate.Status.OK && status != RemoteRefUpdate.Status.UP_TO_DATE) {
                        callCtx.logError("Push rejected: " + status, null);
                        throw new GitPushException(branch, "Push of " + branch + " rejected: " + status
                                + (update.getMessage() == null ? "" : " (" + update.getMessage() + ")"));
                    }
                }
            }
            callCtx.logResponse(null);
        } catch (GitAPIException e) {
            callCtx.logError(e.getMessage(), e);
            throw new GitPushException(branch, "Push of " + branch + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        git.close();
        if (!FileSystemUtils.deleteRecursively(root.toFile())) {
            log.warn("Working copy {} was already gone", root);
        }
    }

    Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Empty path");
        }
        Path resolved = root.resolve(path.replace('\\', '/')).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Path escapes the working copy: " + path);
        }
        return resolved;
    }

    private boolean stashIfNeeded() {
        try {
            if (git.status().call().isClean()) {
                return false;
            }
            RevCommit stash = git.stashCreate()
                    .setIncludeUntracked(true)
                    .setWorkingDirectoryMessage(STASH_MESSAGE)
                    .setIndexMessage(STASH_MESSAGE)
                    .call();
            if (stash != null) {
                log.warn("⚠️ Working copy had local changes; stashed before branch switch");
            }
            return stash != null;
        } catch (GitAPIException e) {
            throw new IllegalStateException("Failed to stash local changes", e);
        }
    }

    private void restoreStash() {
        try {
            git.stashApply().setStashRef("stash@{0}").call();
            git.stashDrop().setStashRef(0).call();
        } catch (GitAPIException e) {
            log.warn("⚠️ Failed to re-apply stashed changes: {}", e.getMessage());
        }
    }

    private void fetchOrigin() {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GIT, "fetch", log);
        callCtx.logRequest("origin");
        try {
            git.fetch().setRemote("origin").setCredentialsProvider(credentials).call();
            callCtx.logResponse(null);
        } catch (GitAPIException e) {
            callCtx.logError("Fetch failed, continuing with local refs: " + e.getMessage(), e);
        }
    }

    private static boolean isIncluded(Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (EXCLUDED_DIRS.contains(relative.getName(i).toString())) {
                return false;
            }
        }
        return true;
    }

    private static String toSlashPath(Path relative) {
        List<String> parts = new ArrayList<>();
        relative.forEach(p -> parts.add(p.toString()));
        return String.join("/", parts);
    }
}
