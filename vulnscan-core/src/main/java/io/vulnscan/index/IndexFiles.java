package io.vulnscan.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The pair of files a persisted index lives in: the binary vector file and its
 * JSON metadata table. The pair is only meaningful together.
 */
public record IndexFiles(Path indexFile, Path metadataFile) {

    public static final String INDEX_FILE_NAME = "codebase.vidx";
    public static final String METADATA_FILE_NAME = "codebase.meta.json";

    public IndexFiles {
        Objects.requireNonNull(indexFile, "indexFile cannot be null");
        Objects.requireNonNull(metadataFile, "metadataFile cannot be null");
    }

    /**
     * Standard file pair inside a directory.
     */
    public static IndexFiles in(Path directory) {
        return new IndexFiles(directory.resolve(INDEX_FILE_NAME), directory.resolve(METADATA_FILE_NAME));
    }

    /**
     * True when both files exist and are non-empty. A missing or zero-length
     * file means no index exists.
     */
    public boolean isPresent() {
        try {
            return Files.isRegularFile(metadataFile)
                && Files.size(metadataFile) > 0
                && Files.isRegularFile(indexFile)
                && Files.size(indexFile) > 0;
        } catch (IOException e) {
            return false;
        }
    }
}
