package io.vulnscan.cache;

import io.vulnscan.fingerprint.ContentFingerprint;
import io.vulnscan.index.IndexFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Decides whether an already-built index can be reused for a repository.
 *
 * <p>Key = SHA-256 of {@code repoUrl + ":" + fingerprint(repoPath)}. The index
 * for a key lives in {@code <base>/<key>/}. Validity depends only on the files
 * in that directory, never on wall-clock time.</p>
 *
 * <p>{@link #lock(String)} gives per-key mutual exclusion inside one process so
 * that at most one run builds a given key while others wait and then reuse.</p>
 */
public class IndexReuseCache {

    private static final Logger log = LoggerFactory.getLogger(IndexReuseCache.class);

    private final Path baseDirectory;
    private final ContentFingerprint fingerprint;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public IndexReuseCache(Path baseDirectory, ContentFingerprint fingerprint) {
        this.baseDirectory = baseDirectory;
        this.fingerprint = fingerprint;
    }

    /**
     * Resolves the index location for a repository. On a miss the directory is
     * created so the caller can build into it.
     */
    public IndexLocation resolve(String repoUrl, Path repoPath) throws IOException {
        String print = fingerprint.fingerprint(repoPath);
        String key = Hashing.sha256Hex(repoUrl + ":" + print);
        return locate(key, print);
    }

    /**
     * Re-checks validity of an already-resolved location, e.g. after waiting on its lock.
     */
    public IndexLocation refresh(IndexLocation location) {
        return locate(location.key(), location.fingerprint());
    }

    private IndexLocation locate(String key, String print) {
        Path dir = baseDirectory.resolve(key);
        IndexFiles files = IndexFiles.in(dir);
        boolean valid = files.isPresent();
        if (valid) {
            log.info("Reusable index found for key {}", key);
        } else {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                log.warn("Cannot create index directory {}: {}", dir, e.getMessage());
            }
            log.debug("No reusable index for key {}", key);
        }
        return new IndexLocation(key, print, files, valid);
    }

    /**
     * Acquires the build lock for a key. Callers must {@link KeyLock#close()} it.
     */
    public KeyLock lock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.info("Waiting for another run to finish building index {}", key);
        }
        lock.lock();
        return lock::unlock;
    }

    /**
     * Deletes a key's directory, e.g. when its contents were built by a
     * different embedding model.
     */
    public void invalidate(IndexLocation location) {
        Path dir = location.files().indexFile().getParent();
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                if (!path.equals(dir)) {
                    Files.deleteIfExists(path);
                }
            }
            log.info("Invalidated index {}", location.key());
        } catch (IOException e) {
            log.warn("Cannot clear index directory {}: {}", dir, e.getMessage());
        }
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    /**
     * Held build lock for one key.
     */
    @FunctionalInterface
    public interface KeyLock extends AutoCloseable {
        @Override
        void close();
    }
}
