package io.vulnscan.chunk;

import java.util.Set;

/**
 * Configuration for source chunking.
 */
public record ChunkerConfig(
    /** Lines per sliding-window chunk */
    int windowSize,

    /** Lines shared by consecutive windows */
    int windowOverlap,

    /** Declarations longer than this are split into their members (syntax strategy) */
    int maxDeclarationLines,

    /** Files larger than this are skipped */
    long maxFileBytes,

    /** Directory names never descended into */
    Set<String> ignoredDirectories
) {
    public static final Set<String> DEFAULT_IGNORED_DIRECTORIES = Set.of(
        "node_modules", ".git", "__pycache__", ".venv", "venv", "env", "dist", "build",
        ".next", ".cache", "coverage", ".pytest_cache", ".mypy_cache", "target"
    );

    public ChunkerConfig {
        if (windowSize < 1) throw new IllegalArgumentException("windowSize must be >= 1");
        if (windowOverlap < 0 || windowOverlap >= windowSize) {
            throw new IllegalArgumentException("windowOverlap must be in [0, windowSize)");
        }
        ignoredDirectories = Set.copyOf(ignoredDirectories);
    }

    public static ChunkerConfig defaults() {
        return new ChunkerConfig(100, 20, 200, 1_000_000, DEFAULT_IGNORED_DIRECTORIES);
    }

    public ChunkerConfig withWindow(int windowSize, int windowOverlap) {
        return new ChunkerConfig(windowSize, windowOverlap, maxDeclarationLines, maxFileBytes, ignoredDirectories);
    }

    public ChunkerConfig withMaxDeclarationLines(int maxDeclarationLines) {
        return new ChunkerConfig(windowSize, windowOverlap, maxDeclarationLines, maxFileBytes, ignoredDirectories);
    }
}
