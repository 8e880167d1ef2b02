package io.vulnscan.chunk;

import io.vulnscan.CodeChunk;
import io.vulnscan.ProgressCallback;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Splits a source tree into analyzable code units.
 */
public interface Chunker {

    /**
     * Chunks every supported file under {@code repoPath}, in path-walk order.
     *
     * @param limits caps on files scanned and chunks kept per file
     * @param progress receives (files processed, files to process)
     */
    List<CodeChunk> process(Path repoPath, ChunkLimits limits, ProgressCallback progress) throws IOException;

    default List<CodeChunk> process(Path repoPath) throws IOException {
        return process(repoPath, ChunkLimits.unlimited(), ProgressCallback.NONE);
    }
}
