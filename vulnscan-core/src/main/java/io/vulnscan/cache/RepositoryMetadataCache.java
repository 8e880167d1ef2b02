package io.vulnscan.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * TTL cache of structural-analysis results keyed by (repository URL, revision).
 *
 * <p>Each entry is one JSON file named by SHA-256 of
 * {@code url + ":" + (revision or "latest")}. Expiry is checked lazily on read
 * against the file's modification time; there is no background sweep.</p>
 */
public class RepositoryMetadataCache {

    private static final Logger log = LoggerFactory.getLogger(RepositoryMetadataCache.class);

    public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(24);
    public static final int DEFAULT_MAX_AGE_DAYS = 7;
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;

    public RepositoryMetadataCache(Path directory) {
        this(directory, new ObjectMapper(), Clock.systemUTC());
    }

    public RepositoryMetadataCache(Path directory, ObjectMapper mapper, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.mapper = mapper;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("Cannot create metadata cache directory {}: {}", directory, e.getMessage());
        }
    }

    public static String key(String repoUrl, String revision) {
        return Hashing.sha256Hex(repoUrl + ":" + (revision != null ? revision : "latest"));
    }

    /**
     * Returns the cached result if present and younger than {@code maxAge}.
     */
    public Optional<JsonNode> get(String repoUrl, String revision, Duration maxAge) {
        Path file = fileFor(repoUrl, revision);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            Instant written = Files.getLastModifiedTime(file).toInstant();
            if (written.plus(maxAge).isBefore(clock.instant())) {
                log.debug("Metadata cache entry for {}@{} expired", repoUrl, revision);
                return Optional.empty();
            }
            JsonNode entry = mapper.readTree(file.toFile());
            return Optional.ofNullable(entry.get("result"));
        } catch (IOException e) {
            log.warn("Unreadable metadata cache entry {}, treating as miss: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Typed variant of {@link #get(String, String, Duration)}.
     */
    public <T> Optional<T> get(String repoUrl, String revision, Duration maxAge, Class<T> type) {
        return get(repoUrl, revision, maxAge).flatMap(node -> {
            try {
                return Optional.of(mapper.treeToValue(node, type));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Cached metadata for {} does not match {}: {}", repoUrl, type.getSimpleName(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    public void set(String repoUrl, Object result, String revision) {
        Path file = fileFor(repoUrl, revision);
        ObjectNode entry = mapper.createObjectNode();
        entry.put("repo_url", repoUrl);
        entry.put("revision", revision);
        entry.put("cached_at", clock.instant().toString());
        entry.set("result", mapper.valueToTree(result));

        Path tmp = file.resolveSibling(file.getFileName() + "." + Thread.currentThread().getId() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), entry);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Cached metadata for {}@{}", repoUrl, revision);
        } catch (IOException e) {
            log.warn("Cannot write metadata cache entry {}: {}", file, e.getMessage());
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                log.debug("Cannot remove temporary {}: {}", tmp, cleanup.getMessage());
            }
        }
    }

    /**
     * Removes entries older than {@code days}, regardless of the TTL callers pass to {@code get}.
     *
     * @return number of files removed
     */
    public int clearOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int removed = 0;
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files.filter(p -> p.toString().endsWith(SUFFIX))::iterator) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("Cannot remove metadata cache entry {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list metadata cache {}: {}", directory, e.getMessage());
        }
        log.info("Removed {} metadata cache entries older than {} days", removed, days);
        return removed;
    }

    public long size() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.toString().endsWith(SUFFIX)).count();
        } catch (IOException e) {
            return 0;
        }
    }

    private Path fileFor(String repoUrl, String revision) {
        return directory.resolve(key(repoUrl, revision) + SUFFIX);
    }
}
