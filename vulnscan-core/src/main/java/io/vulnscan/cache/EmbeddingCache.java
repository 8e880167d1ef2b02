package io.vulnscan.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Content-addressed cache of embedding vectors keyed by (model, text).
 *
 * <p>Two tiers share one key, the SHA-256 of {@code model + ":" + text}:</p>
 * <ul>
 *   <li>a bounded in-process map; once full, new entries are rejected, never evicted</li>
 *   <li>an unbounded directory of {@code <key>.vec} files</li>
 * </ul>
 *
 * <p>Cache failures never reach the caller: an I/O error is logged and treated
 * as a miss.</p>
 */
public class EmbeddingCache {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    public static final int DEFAULT_MEMORY_CAPACITY = 1000;
    public static final int DEFAULT_MAX_AGE_DAYS = 30;
    private static final String SUFFIX = ".vec";

    private final Path directory;
    private final int memoryCapacity;
    private final Clock clock;
    private final Map<String, CacheEntry<String, float[]>> memory = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public EmbeddingCache(Path directory) {
        this(directory, DEFAULT_MEMORY_CAPACITY, Clock.systemUTC());
    }

    public EmbeddingCache(Path directory, int memoryCapacity, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.memoryCapacity = memoryCapacity;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.warn("Cannot create embedding cache directory {}: {}", directory, e.getMessage());
        }
    }

    public static String key(String model, String text) {
        return Hashing.sha256Hex(model + ":" + text);
    }

    // ==================== Single Lookup ====================

    public Optional<float[]> get(String model, String text) {
        String key = key(model, text);
        CacheEntry<String, float[]> entry = memory.get(key);
        if (entry != null) {
            hits.incrementAndGet();
            return Optional.of(entry.value().clone());
        }

        Optional<float[]> fromDisk = readDisk(key);
        if (fromDisk.isPresent()) {
            hits.incrementAndGet();
            putMemory(key, fromDisk.get());
            return Optional.of(fromDisk.get().clone());
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    public void set(String model, String text, float[] vector) {
        Objects.requireNonNull(vector, "vector cannot be null");
        String key = key(model, text);
        CacheEntry<String, float[]> existing = memory.get(key);
        if (existing != null && Arrays.equals(existing.value(), vector)) {
            return;
        }
        if (existing == null && readDisk(key).filter(v -> Arrays.equals(v, vector)).isPresent()) {
            putMemory(key, vector);
            return;
        }
        if (existing != null) {
            memory.put(key, new CacheEntry<>(key, vector.clone(), clock.instant()));
        } else {
            putMemory(key, vector);
        }
        writeDisk(key, vector);
    }

    // ==================== Batch ====================

    /**
     * Result of a batch lookup: one slot per input text, {@code null} where absent.
     */
    public record BatchLookup(List<float[]> vectors, List<Integer> missingIndices) {

        public boolean isComplete() {
            return missingIndices.isEmpty();
        }
    }

    /**
     * Looks up every text. The caller embeds exactly the texts at
     * {@link BatchLookup#missingIndices()} in one upstream request.
     */
    public BatchLookup getBatch(String model, List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            Optional<float[]> cached = get(model, texts.get(i));
            vectors.add(cached.orElse(null));
            if (cached.isEmpty()) {
                missing.add(i);
            }
        }
        log.debug("Embedding cache batch: {} hits, {} misses", texts.size() - missing.size(), missing.size());
        return new BatchLookup(vectors, List.copyOf(missing));
    }

    public void setBatch(String model, List<String> texts, List<float[]> vectors) {
        if (texts.size() != vectors.size()) {
            throw new IllegalArgumentException(String.format(
                "Text count (%d) does not match vector count (%d)", texts.size(), vectors.size()));
        }
        for (int i = 0; i < texts.size(); i++) {
            set(model, texts.get(i), vectors.get(i));
        }
    }

    // ==================== Maintenance ====================

    /**
     * Removes disk entries older than {@code days}. The memory tier is left alone.
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
                    log.warn("Cannot remove cached embedding {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list embedding cache {}: {}", directory, e.getMessage());
        }
        log.info("Removed {} cached embeddings older than {} days", removed, days);
        return removed;
    }

    public CacheStats stats() {
        long diskEntries = 0;
        try (Stream<Path> files = Files.list(directory)) {
            diskEntries = files.filter(p -> p.toString().endsWith(SUFFIX)).count();
        } catch (IOException e) {
            log.warn("Cannot list embedding cache {}: {}", directory, e.getMessage());
        }
        return new CacheStats(memory.size(), memoryCapacity, diskEntries, hits.get(), misses.get());
    }

    public Path getDirectory() {
        return directory;
    }

    // ==================== Tiers ====================

    private void putMemory(String key, float[] vector) {
        if (memory.size() >= memoryCapacity) {
            return;
        }
        memory.putIfAbsent(key, new CacheEntry<>(key, vector.clone(), clock.instant()));
    }

    private Optional<float[]> readDisk(String key) {
        Path file = directory.resolve(key + SUFFIX);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            int length = in.readInt();
            long capacity = (Files.size(file) - Integer.BYTES) / Float.BYTES;
            if (length < 0 || length > capacity) {
                log.warn("Cached embedding {} declares {} values but holds {}, treating as miss", file, length, capacity);
                return Optional.empty();
            }
            float[] vector = new float[length];
            for (int i = 0; i < length; i++) {
                vector[i] = in.readFloat();
            }
            return Optional.of(vector);
        } catch (IOException e) {
            log.warn("Unreadable cached embedding {}, treating as miss: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeDisk(String key, float[] vector) {
        Path file = directory.resolve(key + SUFFIX);
        Path tmp = directory.resolve(key + SUFFIX + "." + Thread.currentThread().getId() + ".tmp");
        try {
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp)))) {
                out.writeInt(vector.length);
                for (float v : vector) {
                    out.writeFloat(v);
                }
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Cannot write cached embedding {}: {}", file, e.getMessage());
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                log.debug("Cannot remove temporary {}: {}", tmp, cleanup.getMessage());
            }
        }
    }
}
