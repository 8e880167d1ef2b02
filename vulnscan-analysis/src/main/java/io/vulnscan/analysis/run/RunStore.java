package io.vulnscan.analysis.run;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Persists run snapshots by id.
 */
public interface RunStore {

    void save(RunRecord record) throws IOException;

    Optional<RunRecord> find(String id);

    /**
     * All stored runs, most recently started first.
     */
    List<RunRecord> list();
}
