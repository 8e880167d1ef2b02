package io.vulnscan.chunk;

import java.util.Map;
import java.util.Optional;

/**
 * Maps file extensions to language tags.
 */
public final class Languages {

    public static final String JAVA = "java";
    public static final String JAVASCRIPT = "javascript";
    public static final String PYTHON = "python";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
        Map.entry("java", JAVA),
        Map.entry("py", PYTHON),
        Map.entry("js", JAVASCRIPT),
        Map.entry("jsx", JAVASCRIPT),
        Map.entry("mjs", JAVASCRIPT),
        Map.entry("ts", JAVASCRIPT),
        Map.entry("tsx", JAVASCRIPT),
        Map.entry("go", "go"),
        Map.entry("c", "c"),
        Map.entry("h", "c"),
        Map.entry("cpp", "cpp"),
        Map.entry("cc", "cpp"),
        Map.entry("hpp", "cpp"),
        Map.entry("cs", "csharp"),
        Map.entry("php", "php"),
        Map.entry("rb", "ruby"),
        Map.entry("rs", "rust"),
        Map.entry("swift", "swift"),
        Map.entry("kt", "kotlin"),
        Map.entry("scala", "scala")
    );

    private Languages() {
    }

    /**
     * Returns the language tag for a file name, or empty if the file is not source code we analyze.
     */
    public static Optional<String> forFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_EXTENSION.get(fileName.substring(dot + 1).toLowerCase()));
    }
}
