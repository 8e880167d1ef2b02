package io.vulnscan.chunk;

/**
 * Caps on how much of a repository is chunked. Zero means unlimited.
 */
public record ChunkLimits(int maxFiles, int maxChunksPerFile) {

    public ChunkLimits {
        if (maxFiles < 0 || maxChunksPerFile < 0) {
            throw new IllegalArgumentException("limits must be >= 0");
        }
    }

    public static ChunkLimits unlimited() {
        return new ChunkLimits(0, 0);
    }

    public int capChunks(int found) {
        return maxChunksPerFile > 0 ? Math.min(found, maxChunksPerFile) : found;
    }
}
