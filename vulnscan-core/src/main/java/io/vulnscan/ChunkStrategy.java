package io.vulnscan;

/**
 * How a chunk's boundaries were determined.
 */
public enum ChunkStrategy {
    /** Declaration boundaries from a real parser */
    SYNTAX,

    /** Declaration keyword regex plus bracket balance */
    PATTERN,

    /** Fixed-size overlapping line window */
    WINDOW
}
