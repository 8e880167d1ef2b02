package io.vulnscan.cache;

import io.vulnscan.index.IndexFiles;

import java.nio.file.Path;

/**
 * Where the index for a (repository URL, fingerprint) pair lives and whether
 * a usable copy is already there.
 */
public record IndexLocation(String key, String fingerprint, IndexFiles files, boolean valid) {

    public Path indexPath() {
        return files.indexFile();
    }

    public Path metadataPath() {
        return files.metadataFile();
    }
}
