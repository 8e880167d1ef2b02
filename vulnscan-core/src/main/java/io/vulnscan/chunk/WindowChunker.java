package io.vulnscan.chunk;

import io.vulnscan.ChunkStrategy;
import io.vulnscan.CodeChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size overlapping line windows. Content-agnostic; the universal fallback.
 */
class WindowChunker implements FileChunker {

    private final int size;
    private final int step;

    WindowChunker(ChunkerConfig config) {
        this.size = config.windowSize();
        this.step = config.windowSize() - config.windowOverlap();
    }

    @Override
    public List<CodeChunk> chunk(String file, SourceText source, String language) {
        List<CodeChunk> chunks = new ArrayList<>();
        if (source.isBlank()) {
            return chunks;
        }
        int total = source.lineCount();
        for (int start = 1; start <= total; start += step) {
            int end = Math.min(start + size - 1, total);
            String text = source.slice(start, end);
            if (!text.isBlank()) {
                chunks.add(CodeChunk.of(file, start, end, language, text, ChunkStrategy.WINDOW));
            }
            if (end == total) {
                break;
            }
        }
        return chunks;
    }
}
