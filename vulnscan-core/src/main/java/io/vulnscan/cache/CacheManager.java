package io.vulnscan.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups the process-wide caches for maintenance.
 */
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final EmbeddingCache embeddings;
    private final RepositoryMetadataCache repositories;
    private final IndexReuseCache indexes;

    public CacheManager(EmbeddingCache embeddings, RepositoryMetadataCache repositories, IndexReuseCache indexes) {
        this.embeddings = embeddings;
        this.repositories = repositories;
        this.indexes = indexes;
    }

    /**
     * Removes aged entries from the embedding and metadata caches.
     * Indexes are not aged out; their validity is a function of the fingerprint.
     */
    public int clearOld(int embeddingDays, int metadataDays) {
        int removed = embeddings.clearOlderThan(embeddingDays) + repositories.clearOlderThan(metadataDays);
        log.info("Cache cleanup removed {} entries", removed);
        return removed;
    }

    public int clearOld() {
        return clearOld(EmbeddingCache.DEFAULT_MAX_AGE_DAYS, RepositoryMetadataCache.DEFAULT_MAX_AGE_DAYS);
    }

    public EmbeddingCache embeddings() {
        return embeddings;
    }

    public RepositoryMetadataCache repositories() {
        return repositories;
    }

    public IndexReuseCache indexes() {
        return indexes;
    }
}
