package io.vulnscan.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryMetadataCacheTest {

    private static final String URL = "https://github.com/example/app";

    @TempDir
    Path tempDir;

    record Profile(String language, int files) {
    }

    @Test
    void testSetThenGet() {
        RepositoryMetadataCache cache = new RepositoryMetadataCache(tempDir);
        cache.set(URL, Map.of("languages", List.of("java")), "abc123");

        JsonNode result = cache.get(URL, "abc123", Duration.ofHours(1)).orElseThrow();

        assertEquals("java", result.get("languages").get(0).asText());
    }

    @Test
    void testTypedGet() {
        RepositoryMetadataCache cache = new RepositoryMetadataCache(tempDir);
        cache.set(URL, new Profile("go", 12), null);

        Profile profile = cache.get(URL, null, Duration.ofHours(1), Profile.class).orElseThrow();

        assertEquals(new Profile("go", 12), profile);
    }

    @Test
    void testRevisionsAreIndependent() {
        RepositoryMetadataCache cache = new RepositoryMetadataCache(tempDir);
        cache.set(URL, Map.of("v", 1), "rev1");
        cache.set(URL, Map.of("v", 2), "rev2");

        assertEquals(1, cache.get(URL, "rev1", Duration.ofHours(1)).orElseThrow().get("v").asInt());
        assertEquals(2, cache.get(URL, "rev2", Duration.ofHours(1)).orElseThrow().get("v").asInt());
        assertEquals(2, cache.size());
    }

    @Test
    void testExpiryIsEvaluatedOnRead() {
        RepositoryMetadataCache writer = new RepositoryMetadataCache(tempDir);
        writer.set(URL, Map.of("v", 1), "rev");

        RepositoryMetadataCache future = new RepositoryMetadataCache(tempDir, new ObjectMapper(),
            Clock.fixed(Instant.now().plus(Duration.ofHours(30)), ZoneOffset.UTC));

        assertTrue(future.get(URL, "rev", RepositoryMetadataCache.DEFAULT_MAX_AGE).isEmpty());
        assertTrue(future.get(URL, "rev", Duration.ofHours(48)).isPresent());
    }

    @Test
    void testCorruptEntryIsAMiss() throws IOException {
        RepositoryMetadataCache cache = new RepositoryMetadataCache(tempDir);
        Files.writeString(tempDir.resolve(RepositoryMetadataCache.key(URL, "rev") + ".json"), "{not json");

        assertTrue(cache.get(URL, "rev", Duration.ofHours(1)).isEmpty());
    }

    @Test
    void testClearOlderThan() throws IOException {
        RepositoryMetadataCache cache = new RepositoryMetadataCache(tempDir);
        cache.set(URL, Map.of("v", 1), "old");
        cache.set(URL, Map.of("v", 2), "new");
        Files.setLastModifiedTime(tempDir.resolve(RepositoryMetadataCache.key(URL, "old") + ".json"),
            FileTime.from(Instant.now().minus(Duration.ofDays(10))));

        assertEquals(1, cache.clearOlderThan(7));
        assertEquals(1, cache.size());
    }
}
