package io.vulnscan.chunk;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import io.vulnscan.ChunkStrategy;
import io.vulnscan.CodeChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax-aware chunking for Java using JavaParser.
 *
 * <p>Each top-level type becomes one chunk. A type longer than
 * {@link ChunkerConfig#maxDeclarationLines()} is split into its members
 * (methods, constructors, nested types, initializers), with annotations kept
 * on the member they decorate. Fields are left to the enclosing context.</p>
 */
class JavaSyntaxChunker implements FileChunker {

    private static final Logger log = LoggerFactory.getLogger(JavaSyntaxChunker.class);

    private final JavaParser parser;
    private final int maxDeclarationLines;

    JavaSyntaxChunker(ChunkerConfig config) {
        this.parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        this.maxDeclarationLines = config.maxDeclarationLines();
    }

    @Override
    public List<CodeChunk> chunk(String file, SourceText source, String language) {
        List<CodeChunk> chunks = new ArrayList<>();

        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(source.raw());
        } catch (RuntimeException e) {
            log.warn("Parser failed on {}: {}", file, e.getMessage());
            return chunks;
        } catch (StackOverflowError e) {
            log.warn("Parser ran out of stack on {}, nesting too deep", file);
            return chunks;
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.debug("Failed to parse {}: {}", file, result.getProblems());
            return chunks;
        }

        for (TypeDeclaration<?> type : result.getResult().get().getTypes()) {
            int start = beginLine(type);
            int end = type.getEnd().map(p -> p.line).orElse(start);
            if (end - start + 1 <= maxDeclarationLines || type.getMembers().isEmpty()) {
                add(chunks, file, source, language, start, end, type.getNameAsString());
                continue;
            }
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof FieldDeclaration) {
                    continue;
                }
                int memberStart = beginLine(member);
                int memberEnd = member.getEnd().map(p -> p.line).orElse(memberStart);
                add(chunks, file, source, language, memberStart, memberEnd,
                    type.getNameAsString() + "." + memberName(member));
            }
        }

        log.debug("Extracted {} declaration chunks from {}", chunks.size(), file);
        return chunks;
    }

    private void add(List<CodeChunk> chunks, String file, SourceText source, String language,
                     int start, int end, String symbol) {
        end = Math.min(end, source.lineCount());
        if (start < 1 || end < start) {
            return;
        }
        chunks.add(new CodeChunk(file, start, end, language, source.slice(start, end), ChunkStrategy.SYNTAX, symbol));
    }

    /**
     * First line of a declaration, moved up to its first annotation or comment.
     */
    private static int beginLine(BodyDeclaration<?> node) {
        int line = node.getBegin().map(p -> p.line).orElse(1);
        if (!node.getAnnotations().isEmpty()) {
            line = Math.min(line, node.getAnnotation(0).getBegin().map(p -> p.line).orElse(line));
        }
        int commentLine = node.getComment().flatMap(Node::getBegin).map(p -> p.line).orElse(line);
        return Math.min(line, commentLine);
    }

    private static String memberName(BodyDeclaration<?> member) {
        if (member instanceof NodeWithSimpleName<?> named) {
            return named.getNameAsString();
        }
        return member.getClass().getSimpleName();
    }
}
