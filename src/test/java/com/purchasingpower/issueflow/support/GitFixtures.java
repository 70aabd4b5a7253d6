package com.purchasingpower.issueflow.support;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.treewalk.TreeWalk;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Local bare repositories standing in for GitHub remotes. A remote for {@code owner/name}
 * lives at {@code <base>/owner/name.git}, so {@code base.toUri()} works as clone base URL.
 */
public final class GitFixtures {

    private static final PersonIdent SEEDER = new PersonIdent("Seeder", "seeder@example.com");

    private GitFixtures() {
    }

    public static Path createRemote(Path base, String repo, Map<String, String> files) throws Exception {
        Path bare = base.resolve(repo + ".git");
        Files.createDirectories(bare);
        Git.init().setBare(true).setDirectory(bare.toFile()).setInitialBranch("main").call().close();

        Path seed = Files.createTempDirectory("seed");
        try (Git git = Git.init().setDirectory(seed.toFile()).setInitialBranch("main").call()) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                Path target = seed.resolve(file.getKey());
                Files.createDirectories(target.getParent());
                Files.writeString(target, file.getValue(), StandardCharsets.UTF_8);
            }
            git.add().addFilepattern(".").call();
            git.commit().setMessage("Initial commit").setAuthor(SEEDER).setCommitter(SEEDER).call();
            git.remoteAdd().setName("origin").setUri(new URIish(bare.toUri().toString())).call();
            git.push().setRemote("origin").setRefSpecs(new RefSpec("main:main")).call();
        }
        return bare;
    }

    /**
     * Commits {@code content} to {@code path} on {@code branch} of the remote through a scratch clone.
     */
    public static void commitOnRemote(Path bare, String branch, String path, String content) throws Exception {
        Path scratch = Files.createTempDirectory("scratch");
        try (Git git = Git.cloneRepository().setURI(bare.toUri().toString()).setDirectory(scratch.toFile()).call()) {
            boolean remoteHasBranch = git.getRepository().findRef("refs/remotes/origin/" + branch) != null;
            if (remoteHasBranch) {
                git.checkout().setCreateBranch(true).setName(branch).setStartPoint("origin/" + branch).call();
            } else if (!branch.equals(git.getRepository().getBranch())) {
                git.checkout().setCreateBranch(true).setName(branch).call();
            }
            Path target = scratch.resolve(path);
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
            git.add().addFilepattern(path).call();
            git.commit().setMessage("Remote change to " + path).setAuthor(SEEDER).setCommitter(SEEDER).call();
            git.push().setRemote("origin").setRefSpecs(new RefSpec(branch + ":" + branch)).call();
        }
    }

    /**
     * Content of {@code path} at the tip of {@code branch} in the remote, or null when absent.
     */
    public static String readOnRemote(Path bare, String branch, String path) throws IOException {
        try (Git git = Git.open(bare.toFile())) {
            Repository repository = git.getRepository();
            Ref ref = repository.findRef("refs/heads/" + branch);
            if (ref == null) {
                return null;
            }
            try (RevWalk walk = new RevWalk(repository)) {
                RevCommit commit = walk.parseCommit(ref.getObjectId());
                try (TreeWalk treeWalk = TreeWalk.forPath(repository, path, commit.getTree())) {
                    if (treeWalk == null) {
                        return null;
                    }
                    return new String(repository.open(treeWalk.getObjectId(0)).getBytes(), StandardCharsets.UTF_8);
                }
            }
        }
    }

    public static String lastCommitMessage(Path bare, String branch) throws IOException {
        try (Git git = Git.open(bare.toFile())) {
            Repository repository = git.getRepository();
            Ref ref = repository.findRef("refs/heads/" + branch);
            if (ref == null) {
                return null;
            }
            try (RevWalk walk = new RevWalk(repository)) {
                return walk.parseCommit(ref.getObjectId()).getFullMessage();
            }
        }
    }
}
