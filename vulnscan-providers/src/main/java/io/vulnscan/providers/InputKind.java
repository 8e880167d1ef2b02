package io.vulnscan.providers;

/**
 * Whether text being embedded is a stored document or a search query.
 * Retrieval-tuned providers embed the two differently.
 */
public enum InputKind {
    DOCUMENT("document"),
    QUERY("query");

    private final String wireName;

    InputKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
