package io.vulnscan.analysis.vcs;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A local source tree to analyze.
 *
 * @param path root of the tree
 * @param disposable true when the tree was created for one run and may be deleted afterwards;
 *                   cache-backed clones and user-supplied directories are never disposable
 */
public record WorkingCopy(Path path, boolean disposable) {

    public WorkingCopy {
        Objects.requireNonNull(path, "path cannot be null");
    }

    public static WorkingCopy local(Path path) {
        return new WorkingCopy(path, false);
    }
}
