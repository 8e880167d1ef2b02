package io.vulnscan.analysis.vcs;

import io.vulnscan.PermanentInputException;
import io.vulnscan.TransientProviderException;
import io.vulnscan.cache.Hashing;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.api.errors.TransportException;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Git client backed by JGit.
 *
 * <p>With caching on, clones live in {@code <cacheDir>/<sha256(url:branch)>}
 * and are refreshed with a pull on later checkouts (falling back to the
 * existing tree when offline). With caching off, each checkout is a fresh
 * shallow clone into a temporary directory that {@link #release} deletes.</p>
 */
public class JGitVcsClient implements VcsClient {

    private static final Logger log = LoggerFactory.getLogger(JGitVcsClient.class);

    private final Path cacheDir;
    private final boolean useCache;
    private final CredentialsProvider credentials;

    public JGitVcsClient(Path cacheDir, boolean useCache) {
        this(cacheDir, useCache, null);
    }

    public JGitVcsClient(Path cacheDir, boolean useCache, CredentialsProvider credentials) {
        this.cacheDir = cacheDir;
        this.useCache = useCache;
        this.credentials = credentials;
    }

    static String cacheKey(String url, String branch) {
        return Hashing.sha256Hex(url + ":" + (branch != null ? branch : "default"));
    }

    @Override
    public WorkingCopy checkout(String url, String branch) {
        if (useCache) {
            Path cached = cacheDir.resolve(cacheKey(url, branch));
            if (Files.isDirectory(cached.resolve(".git"))) {
                refresh(cached);
                return new WorkingCopy(cached, false);
            }
            deleteTree(cached);
            cloneInto(url, branch, cached);
            return new WorkingCopy(cached, false);
        }

        Path target;
        try {
            target = Files.createTempDirectory("vulnscan-");
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create temporary clone directory", e);
        }
        cloneInto(url, branch, target);
        return new WorkingCopy(target, true);
    }

    private void refresh(Path cached) {
        try (Git git = Git.open(cached.toFile())) {
            git.pull().setCredentialsProvider(credentials).call();
            log.info("Using cached repository at {} (updated)", cached);
        } catch (IOException | GitAPIException e) {
            log.info("Using cached repository at {} (offline: {})", cached, e.getMessage());
        }
    }

    private void cloneInto(String url, String branch, Path target) {
        log.info("Cloning {} into {}", url, target);
        CloneCommand clone = Git.cloneRepository()
            .setURI(url)
            .setDirectory(target.toFile())
            .setDepth(1)
            .setCredentialsProvider(credentials);
        if (branch != null) {
            clone.setBranch(branch).setBranchesToClone(List.of("refs/heads/" + branch));
        }
        try (Git git = clone.call()) {
            log.info("Cloned {} into {}", url, git.getRepository().getWorkTree());
        } catch (InvalidRemoteException e) {
            deleteTree(target);
            throw new PermanentInputException(PermanentInputException.Reason.NOT_FOUND,
                "Repository not found: " + url, e);
        } catch (TransportException e) {
            deleteTree(target);
            throw classify(url, e);
        } catch (GitAPIException e) {
            deleteTree(target);
            throw new PermanentInputException(PermanentInputException.Reason.INVALID_INPUT,
                "Failed to clone " + url + ": " + e.getMessage(), e);
        }
    }

    static RuntimeException classify(String url, TransportException e) {
        String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        if (message.contains("not authorized") || message.contains("authentication")
                || message.contains("401") || message.contains("403")) {
            return new PermanentInputException(PermanentInputException.Reason.AUTH_REQUIRED,
                "Authentication required for " + url, e);
        }
        if (message.contains("not found") || message.contains("404") || message.contains("does not appear")) {
            return new PermanentInputException(PermanentInputException.Reason.NOT_FOUND,
                "Repository not found: " + url, e);
        }
        return new TransientProviderException(TransientProviderException.Reason.NETWORK,
            "Cannot reach " + url + ": " + e.getMessage(), e);
    }

    @Override
    public void release(WorkingCopy copy) {
        if (copy.disposable()) {
            deleteTree(copy.path());
            log.info("Cleaned up temporary repository at {}", copy.path());
        }
    }

    static void deleteTree(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", root, e.getMessage());
        }
    }
}
