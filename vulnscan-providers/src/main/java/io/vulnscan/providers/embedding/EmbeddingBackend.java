package io.vulnscan.providers.embedding;

/**
 * Available embedding backends.
 */
public enum EmbeddingBackend {
    /** OpenAI/Voyage-compatible REST endpoint */
    HTTP,

    /** Local token feature hashing; offline and deterministic */
    HASHING
}
