package io.vulnscan.chunk;

import io.vulnscan.ChunkStrategy;
import io.vulnscan.CodeChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declaration detection for brace languages without a parser.
 *
 * <p>A declaration-keyword regex marks a candidate start line; the declaration
 * ends at the first line where the running bracket balance returns to zero
 * after having gone positive. Brackets inside string literals and line
 * comments are ignored. Scanning resumes after the end line, so nested
 * declarations stay inside their parent's chunk.</p>
 */
class PatternChunker implements FileChunker {

    private static final String NAME = "(?<name>[A-Za-z_$][\\w$]*)";

    private static final Map<String, List<Pattern>> PATTERNS = Map.of(
        Languages.JAVASCRIPT, List.of(
            Pattern.compile("^\\s*(export\\s+)?(default\\s+)?(async\\s+)?function\\s*\\*?\\s*" + NAME + "\\s*\\("),
            Pattern.compile("^\\s*(export\\s+)?(const|let|var)\\s+" + NAME
                + "\\s*(:[^=]+)?=\\s*(async\\s+)?(function\\b|\\([^)]*\\)\\s*(:[^=]+)?=>|[\\w$]+\\s*=>)"),
            Pattern.compile("^\\s*(export\\s+)?(default\\s+)?(abstract\\s+)?class\\s+" + NAME),
            Pattern.compile("^\\s*" + NAME + "\\s*:\\s*(async\\s+)?function\\s*\\(")
        ),
        "go", List.of(
            Pattern.compile("^func\\s+(\\([^)]*\\)\\s*)?" + NAME + "\\s*[\\[(]"),
            Pattern.compile("^type\\s+" + NAME + "\\s+(struct|interface)\\b")
        ),
        "c", cFamily(),
        "cpp", cFamily(),
        "csharp", keywordStyle("class|struct|interface|enum|record|void|public|private|protected|internal|static"),
        "php", List.of(
            Pattern.compile("^\\s*((abstract|final|public|private|protected|static)\\s+)*(function|class|interface|trait)\\s+&?" + NAME)
        ),
        "rust", List.of(
            Pattern.compile("^\\s*(pub(\\([^)]*\\))?\\s+)?(async\\s+)?(unsafe\\s+)?(fn|struct|enum|trait|impl|mod)\\s+(<[^>]*>\\s*)?" + NAME)
        ),
        "swift", keywordStyle("func|class|struct|enum|protocol|extension"),
        "kotlin", keywordStyle("fun|class|object|interface"),
        "scala", keywordStyle("def|class|object|trait")
    );

    static boolean supports(String language) {
        return PATTERNS.containsKey(language);
    }

    private static List<Pattern> cFamily() {
        return List.of(
            Pattern.compile("^(?!\\s*(if|for|while|switch|return|else|do|case)\\b)"
                + "[A-Za-z_][\\w\\s\\*&:<>,~]*?\\b" + NAME + "\\s*\\([^;]*$"),
            Pattern.compile("^\\s*(typedef\\s+)?(struct|class|union|enum|namespace)\\s+" + NAME + "\\s*[^;]*$")
        );
    }

    private static List<Pattern> keywordStyle(String keywords) {
        return List.of(Pattern.compile("^\\s*([\\w@]+\\s+)*?(" + keywords + ")\\s+(\\w+\\s+)*?" + NAME + "\\s*[(<{:]?"));
    }

    @Override
    public List<CodeChunk> chunk(String file, SourceText source, String language) {
        List<CodeChunk> chunks = new ArrayList<>();
        List<Pattern> patterns = PATTERNS.get(language);
        if (patterns == null) {
            return chunks;
        }

        int line = 1;
        while (line <= source.lineCount()) {
            String name = match(patterns, source.line(line));
            if (name == null) {
                line++;
                continue;
            }
            int end = findEnd(source, line);
            if (end < 0) {
                line++;
                continue;
            }
            chunks.add(new CodeChunk(file, line, end, language, source.slice(line, end), ChunkStrategy.PATTERN, name));
            line = end + 1;
        }
        return chunks;
    }

    private static String match(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(line);
            if (m.find()) {
                return m.group("name");
            }
        }
        return null;
    }

    /**
     * Returns the line where the bracket balance first returns to zero after
     * going positive, the last line if the file ends first, or -1 when a
     * semicolon closes the statement before any bracket opens.
     */
    static int findEnd(SourceText source, int startLine) {
        int balance = 0;
        boolean opened = false;
        for (int n = startLine; n <= source.lineCount(); n++) {
            String line = source.line(n);
            char quote = 0;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quote != 0) {
                    if (c == '\\') {
                        i++;
                    } else if (c == quote) {
                        quote = 0;
                    }
                    continue;
                }
                if (c == '"' || c == '\'' || c == '`') {
                    quote = c;
                } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                    break;
                } else if (c == '{') {
                    balance++;
                    opened = true;
                } else if (c == '}') {
                    balance--;
                    if (opened && balance <= 0) {
                        return n;
                    }
                } else if (c == ';' && !opened) {
                    return -1;
                }
            }
        }
        return opened ? source.lineCount() : -1;
    }
}
