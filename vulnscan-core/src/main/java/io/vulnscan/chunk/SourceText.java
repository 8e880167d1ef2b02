package io.vulnscan.chunk;

import java.util.Arrays;

/**
 * A file's text split into lines, addressed 1-indexed.
 */
final class SourceText {

    private final String raw;
    private final String[] lines;

    SourceText(String raw) {
        this.raw = raw;
        String[] split = raw.split("\r?\n", -1);
        // A trailing newline does not start another line
        int count = split.length;
        if (count > 0 && split[count - 1].isEmpty()) {
            count--;
        }
        this.lines = Arrays.copyOf(split, count);
    }

    String raw() {
        return raw;
    }

    int lineCount() {
        return lines.length;
    }

    String line(int number) {
        return lines[number - 1];
    }

    /**
     * Lines {@code start..end}, inclusive and 1-indexed, joined with newlines.
     */
    String slice(int start, int end) {
        return String.join("\n", Arrays.copyOfRange(lines, start - 1, end));
    }

    boolean isBlank() {
        return raw.isBlank();
    }
}
