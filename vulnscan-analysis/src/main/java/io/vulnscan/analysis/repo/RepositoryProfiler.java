package io.vulnscan.analysis.repo;

import io.vulnscan.cache.RepositoryMetadataCache;
import io.vulnscan.chunk.ChunkerConfig;
import io.vulnscan.fingerprint.ContentFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Scans a repository for its {@link RepositoryProfile}, caching the result per
 * (repository, revision) in the {@link RepositoryMetadataCache}.
 */
public class RepositoryProfiler {

    private static final Logger log = LoggerFactory.getLogger(RepositoryProfiler.class);

    private static final Map<String, String> FRAMEWORK_BY_MANIFEST = Map.of(
        "package.json", "Node.js/JavaScript",
        "requirements.txt", "Python",
        "Gemfile", "Ruby",
        "pom.xml", "Java/Maven",
        "build.gradle", "Java/Gradle",
        "Cargo.toml", "Rust",
        "go.mod", "Go"
    );

    private final RepositoryMetadataCache cache;
    private final ContentFingerprint fingerprint;

    public RepositoryProfiler(RepositoryMetadataCache cache, ContentFingerprint fingerprint) {
        this.cache = cache;
        this.fingerprint = fingerprint;
    }

    /**
     * Returns the profile of {@code root}. Without version control there is no
     * revision, so the entry is stored under "latest" and expires by age only.
     */
    public RepositoryProfile profile(String repoUrl, Path root) throws IOException {
        String revision = fingerprint.revision(root).orElse(null);
        Optional<RepositoryProfile> cached = cache.get(repoUrl, revision,
            RepositoryMetadataCache.DEFAULT_MAX_AGE, RepositoryProfile.class);
        if (cached.isPresent()) {
            log.info("Using cached repository profile for {}", repoUrl);
            return cached.get();
        }

        RepositoryProfile profile = scan(root);
        cache.set(repoUrl, profile, revision);
        log.info("Profiled {}: {} files, frameworks {}", repoUrl, profile.totalFiles(), profile.frameworks());
        return profile;
    }

    static RepositoryProfile scan(Path root) throws IOException {
        Map<String, Integer> extensions = new TreeMap<>();
        Set<String> frameworks = new LinkedHashSet<>();
        List<String> rootManifests = new ArrayList<>();
        int[] total = {0};

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (!dir.equals(root) && (name.startsWith(".")
                        || ChunkerConfig.DEFAULT_IGNORED_DIRECTORIES.contains(name))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString();
                if (name.startsWith(".") || !attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                total[0]++;
                int dot = name.lastIndexOf('.');
                if (dot > 0) {
                    extensions.merge(name.substring(dot), 1, Integer::sum);
                }
                String framework = FRAMEWORK_BY_MANIFEST.get(name);
                if (framework != null) {
                    frameworks.add(framework);
                    if (root.equals(file.getParent())) {
                        rootManifests.add(name);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.debug("Skipping unreadable {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(rootManifests);
        return new RepositoryProfile(total[0], extensions, new ArrayList<>(frameworks), rootManifests);
    }
}
