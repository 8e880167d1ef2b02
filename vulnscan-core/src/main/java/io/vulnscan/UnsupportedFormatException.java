package io.vulnscan;

/**
 * Exception thrown when a persisted index was written with an unknown format version.
 */
public class UnsupportedFormatException extends RuntimeException {

    private final int version;

    public UnsupportedFormatException(int version) {
        super(String.format("Unsupported index format version: %d", version));
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
