package io.vulnscan;

import java.util.Objects;

/**
 * A contiguous span of source lines treated as one embeddable unit.
 *
 * <p>Line numbers are 1-indexed and inclusive. {@code file} is relative to
 * the repository root and always uses forward slashes.</p>
 */
public record CodeChunk(
    /** Source file path relative to the repository root */
    String file,

    /** First line (1-indexed, inclusive) */
    int startLine,

    /** Last line (1-indexed, inclusive) */
    int endLine,

    /** Language tag, e.g. "java", "javascript", "python" */
    String language,

    /** Raw source text of the span */
    String text,

    /** How the boundaries were found */
    ChunkStrategy strategy,

    /** Declaration name when known, otherwise null */
    String symbol
) {
    public CodeChunk {
        Objects.requireNonNull(file, "file cannot be null");
        Objects.requireNonNull(language, "language cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");
        if (startLine < 1) throw new IllegalArgumentException("startLine must be >= 1");
        if (endLine < startLine) throw new IllegalArgumentException("endLine must be >= startLine");
    }

    public static CodeChunk of(String file, int startLine, int endLine, String language,
                               String text, ChunkStrategy strategy) {
        return new CodeChunk(file, startLine, endLine, language, text, strategy, null);
    }

    /**
     * Returns the text the embedding provider sees for this chunk.
     */
    public String embeddingText() {
        return "File: " + file + "\nLines " + startLine + "-" + endLine + "\n\n" + text;
    }

    /**
     * Returns a truncated version of the text for display purposes.
     */
    public String truncatedText(int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }

    public String location() {
        return file + ":" + startLine + "-" + endLine;
    }
}
