package io.vulnscan.fingerprint;

import io.vulnscan.cache.Hashing;
import io.vulnscan.chunk.ChunkerConfig;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.util.*;

/**
 * Computes a short, stable identity for a repository tree, used only as a cache key.
 *
 * <p>Under git the identity is the HEAD commit id: cheap, independent of file
 * timestamps, and identical for every checkout of the same commit.</p>
 *
 * <p>Without git metadata it falls back to hashing the sorted list of
 * {@code relative/path:size} lines for every non-ignored file. This is
 * size-based, not content-based: an edit that keeps a file's byte count is
 * not detected.</p>
 */
public class ContentFingerprint {

    private static final Logger log = LoggerFactory.getLogger(ContentFingerprint.class);

    static final String REVISION_PREFIX = "rev-";
    static final String TREE_PREFIX = "tree-";

    private final Set<String> ignoredDirectories;

    public ContentFingerprint() {
        this(ChunkerConfig.DEFAULT_IGNORED_DIRECTORIES);
    }

    public ContentFingerprint(Set<String> ignoredDirectories) {
        this.ignoredDirectories = Set.copyOf(ignoredDirectories);
    }

    public String fingerprint(Path repoPath) throws IOException {
        Optional<String> revision = revision(repoPath);
        if (revision.isPresent()) {
            return REVISION_PREFIX + revision.get();
        }
        return TREE_PREFIX + treeHash(repoPath);
    }

    /**
     * Returns the HEAD commit id if {@code repoPath} is the root of a git
     * working tree with at least one commit.
     */
    public Optional<String> revision(Path repoPath) {
        if (!Files.exists(repoPath.resolve(Constants.DOT_GIT))) {
            return Optional.empty();
        }
        try (Git git = Git.open(repoPath.toFile())) {
            ObjectId head = git.getRepository().resolve(Constants.HEAD);
            if (head == null) {
                log.debug("Repository at {} has no commits yet", repoPath);
                return Optional.empty();
            }
            return Optional.of(head.getName());
        } catch (RepositoryNotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cannot read git revision at {}, falling back to tree hash: {}", repoPath, e.getMessage());
            return Optional.empty();
        }
    }

    String treeHash(Path repoPath) throws IOException {
        List<String> entries = new ArrayList<>();
        Files.walkFileTree(repoPath, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(repoPath)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                return name.startsWith(".") || ignoredDirectories.contains(name)
                    ? FileVisitResult.SKIP_SUBTREE
                    : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !file.getFileName().toString().startsWith(".")) {
                    String relative = repoPath.relativize(file).toString().replace('\\', '/');
                    entries.add(relative + ":" + attrs.size());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.debug("Skipping unreadable {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(entries);
        MessageDigest digest = Hashing.digest();
        for (String entry : entries) {
            digest.update(entry.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
