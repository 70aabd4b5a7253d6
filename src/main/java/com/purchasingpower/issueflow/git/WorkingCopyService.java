package com.purchasingpower.issueflow.git;

import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.model.CallContext;
import com.purchasingpower.issueflow.model.ServiceType;
import com.purchasingpower.issueflow.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.util.UUID;

/**
 * Hands out fresh clones of a repository. Each clone lives in its own directory under
 * {@code app.workspace-dir} and is removed when the {@link WorkingCopy} is closed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkingCopyService {

    private final AppProperties appProperties;

    public WorkingCopy checkout(String repo, String baseBranch) {
        String cloneUrl = cloneUrl(repo);
        File destination = new File(appProperties.getWorkspaceDir(),
                repo.replace('/', '_') + "-" + UUID.randomUUID().toString().substring(0, 8));
        destination.mkdirs();

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GIT, "clone", log);
        callCtx.logRequest(cloneUrl + " @ " + baseBranch, "directory", destination.getName());

        CredentialsProvider credentials = credentials();
        try {
            Git git = Git.cloneRepository()
                    .setURI(cloneUrl)
                    .setDirectory(destination)
                    .setBranch(baseBranch)
                    .setCredentialsProvider(credentials)
                    .call();
            callCtx.logResponse("on branch " + git.getRepository().getBranch());

            PersonIdent identity = new PersonIdent(
                    appProperties.getGit().getAuthorName(), appProperties.getGit().getAuthorEmail());
            return new WorkingCopy(git, destination.toPath(), identity, credentials);

        } catch (GitAPIException | IOException e) {
            callCtx.logError("Clone failed: " + e.getMessage(), e);
            FileSystemUtils.deleteRecursively(destination);
            throw new IllegalStateException("Git clone of " + repo + " failed: " + e.getMessage(), e);
        }
    }

    String cloneUrl(String repo) {
        String base = appProperties.getGithub().getCloneBaseUrl();
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        return base + repo + ".git";
    }

    /**
     * Token credentials for this clone only; they are never written to the remote config.
     */
    private CredentialsProvider credentials() {
        String token = appProperties.getGithub().getToken();
        return new UsernamePasswordCredentialsProvider(
                appProperties.getGit().getTokenUsername(), token == null ? "" : token);
    }
}
