package io.vulnscan.chunk;

import io.vulnscan.CodeChunk;

import java.util.List;

/**
 * One chunking strategy applied to a single file's text.
 */
interface FileChunker {

    /**
     * Returns the chunks found, or an empty list when the strategy finds no
     * boundaries. Never throws for malformed input.
     */
    List<CodeChunk> chunk(String file, SourceText source, String language);
}
