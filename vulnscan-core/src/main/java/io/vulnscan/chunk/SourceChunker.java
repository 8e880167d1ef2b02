package io.vulnscan.chunk;

import io.vulnscan.CodeChunk;
import io.vulnscan.ProgressCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default {@link Chunker}: walks the tree, then picks a strategy per file.
 *
 * <ol>
 *   <li>syntax-aware for Java (JavaParser)</li>
 *   <li>declaration regex plus bracket balance for other brace languages</li>
 *   <li>sliding line window for everything else, and whenever the first two
 *       fail to parse or find nothing</li>
 * </ol>
 */
public class SourceChunker implements Chunker {

    private static final Logger log = LoggerFactory.getLogger(SourceChunker.class);

    private final ChunkerConfig config;
    private final JavaSyntaxChunker syntax;
    private final PatternChunker pattern;
    private final WindowChunker window;

    public SourceChunker() {
        this(ChunkerConfig.defaults());
    }

    public SourceChunker(ChunkerConfig config) {
        this.config = config;
        this.syntax = new JavaSyntaxChunker(config);
        this.pattern = new PatternChunker();
        this.window = new WindowChunker(config);
    }

    @Override
    public List<CodeChunk> process(Path repoPath, ChunkLimits limits, ProgressCallback progress) throws IOException {
        List<Path> files = sourceFiles(repoPath, limits);
        log.info("Chunking {} source files under {}", files.size(), repoPath);

        List<CodeChunk> chunks = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            String relative = repoPath.relativize(file).toString().replace('\\', '/');
            try {
                List<CodeChunk> found = chunkFile(relative, Files.readString(file, StandardCharsets.UTF_8));
                chunks.addAll(found.subList(0, limits.capChunks(found.size())));
            } catch (CharacterCodingException e) {
                log.debug("Skipping non-UTF-8 file {}", relative);
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", relative, e.getMessage());
            }
            progress.onProgress(i + 1, files.size());
        }

        log.info("Created {} chunks from {} files", chunks.size(), files.size());
        return chunks;
    }

    /**
     * Chunks one file's text. Falls back to the window strategy when the
     * preferred one fails or finds no boundaries.
     */
    public List<CodeChunk> chunkFile(String relativePath, String content) {
        Optional<String> language = Languages.forFileName(relativePath);
        if (language.isEmpty()) {
            return List.of();
        }
        String tag = language.get();
        SourceText source = new SourceText(content);

        List<CodeChunk> chunks = List.of();
        if (Languages.JAVA.equals(tag)) {
            chunks = syntax.chunk(relativePath, source, tag);
        } else if (PatternChunker.supports(tag)) {
            chunks = pattern.chunk(relativePath, source, tag);
        }
        if (chunks.isEmpty()) {
            chunks = window.chunk(relativePath, source, tag);
        }
        return chunks;
    }

    /**
     * Supported files in sorted path order, capped at {@code limits.maxFiles()}.
     */
    List<Path> sourceFiles(Path repoPath, ChunkLimits limits) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(repoPath, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(repoPath) && config.ignoredDirectories().contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()
                        && attrs.size() <= config.maxFileBytes()
                        && Languages.forFileName(file.getFileName().toString()).isPresent()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.debug("Skipping unreadable {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return limits.maxFiles() > 0 && files.size() > limits.maxFiles()
            ? new ArrayList<>(files.subList(0, limits.maxFiles()))
            : files;
    }
}
