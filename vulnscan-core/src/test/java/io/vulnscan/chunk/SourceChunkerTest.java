package io.vulnscan.chunk;

import io.vulnscan.ChunkStrategy;
import io.vulnscan.CodeChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SourceChunkerTest {

    @TempDir
    Path tempDir;

    private SourceChunker chunker;

    @BeforeEach
    void setUp() {
        chunker = new SourceChunker();
    }

    // ==================== Syntax Strategy ====================

    @Test
    void testJavaTopLevelTypes() {
        String source = """
            package demo;

            /** Users. */
            public class UserService {
                public User find(long id) {
                    return repo.find(id);
                }
            }

            enum Role { ADMIN, USER }
            """;

        List<CodeChunk> chunks = chunker.chunkFile("src/UserService.java", source);

        assertEquals(2, chunks.size());
        CodeChunk first = chunks.get(0);
        assertEquals(ChunkStrategy.SYNTAX, first.strategy());
        assertEquals("java", first.language());
        assertEquals("UserService", first.symbol());
        assertEquals(3, first.startLine());
        assertEquals(8, first.endLine());
        assertTrue(first.text().contains("repo.find(id)"));
        assertEquals(10, chunks.get(1).startLine());
    }

    @Test
    void testLongJavaTypeSplitIntoMembers() {
        SourceChunker small = new SourceChunker(ChunkerConfig.defaults().withMaxDeclarationLines(5));
        String source = """
            class Big {
                private int x;

                @Override
                public String toString() {
                    return "big";
                }

                void run() {
                    x++;
                }
            }
            """;

        List<CodeChunk> chunks = small.chunkFile("Big.java", source);

        assertEquals(List.of("Big.toString", "Big.run"),
            chunks.stream().map(CodeChunk::symbol).collect(Collectors.toList()));
        assertEquals(4, chunks.get(0).startLine());
        assertEquals(7, chunks.get(0).endLine());
    }

    @Test
    void testUnparseableJavaFallsBackToWindow() {
        String source = "public class Broken {\n    void x( {\n}\n";

        List<CodeChunk> chunks = chunker.chunkFile("Broken.java", source);

        assertFalse(chunks.isEmpty());
        assertEquals(ChunkStrategy.WINDOW, chunks.get(0).strategy());
        assertEquals(1, chunks.get(0).startLine());
        assertEquals(3, chunks.get(0).endLine());
    }

    @Test
    void testDeeplyNestedJavaFallsBackToWindow() throws InterruptedException {
        String source = "class Deep {\n    int x = " + "(".repeat(20_000) + "1" + ")".repeat(20_000) + ";\n}\n";
        AtomicReference<List<CodeChunk>> chunks = new AtomicReference<>();
        AtomicReference<Throwable> escaped = new AtomicReference<>();

        // initialize parser classes on the normal stack first
        assertEquals(ChunkStrategy.SYNTAX, chunker.chunkFile("Warm.java", "class Warm { int x = ((1)); }").get(0).strategy());
        // a small stack makes the parser overflow deterministically
        Thread worker = new Thread(null, () -> {
            try {
                chunks.set(chunker.chunkFile("Deep.java", source));
            } catch (Throwable t) {
                escaped.set(t);
            }
        }, "deep-parse", 256 * 1024);
        worker.start();
        worker.join();

        assertNull(escaped.get());
        assertFalse(chunks.get().isEmpty());
        assertEquals(ChunkStrategy.WINDOW, chunks.get().get(0).strategy());
    }

    // ==================== Pattern Strategy ====================

    @Test
    void testJavaScriptDeclarationsByBraceBalance() {
        String source = """
            import x from 'x';

            function login(user, pass) {
              if (user) {
                return check("}" + pass);
              }
            }

            const handler = async (req) => {
              return req.body;
            };

            export class Api {
              get() { return 1; }
            }
            """;

        List<CodeChunk> chunks = chunker.chunkFile("web/app.ts", source);

        assertEquals(3, chunks.size());
        assertEquals("login", chunks.get(0).symbol());
        assertEquals(3, chunks.get(0).startLine());
        assertEquals(7, chunks.get(0).endLine());
        assertEquals("handler", chunks.get(1).symbol());
        assertEquals(9, chunks.get(1).startLine());
        assertEquals(11, chunks.get(1).endLine());
        assertEquals("Api", chunks.get(2).symbol());
        assertEquals(ChunkStrategy.PATTERN, chunks.get(2).strategy());
        assertEquals("javascript", chunks.get(2).language());
    }

    @Test
    void testGoFunctions() {
        String source = """
            package main

            func (s *Server) Handle(w http.ResponseWriter, r *http.Request) {
            \tfmt.Fprintf(w, "ok")
            }
            """;

        List<CodeChunk> chunks = chunker.chunkFile("server.go", source);

        assertEquals(1, chunks.size());
        assertEquals("Handle", chunks.get(0).symbol());
        assertEquals(3, chunks.get(0).startLine());
        assertEquals(5, chunks.get(0).endLine());
    }

    @Test
    void testUnbalancedBracesRunToEndOfFile() {
        SourceText text = new SourceText("function a() {\n  if (x) {\n");

        assertEquals(2, PatternChunker.findEnd(text, 1));
    }

    // ==================== Window Strategy ====================

    @Test
    void testPythonUsesOverlappingWindows() {
        String source = IntStream.rangeClosed(1, 250)
            .mapToObj(i -> "x" + i + " = " + i)
            .collect(Collectors.joining("\n", "", "\n"));

        List<CodeChunk> chunks = chunker.chunkFile("app/main.py", source);

        assertEquals(3, chunks.size());
        assertEquals(1, chunks.get(0).startLine());
        assertEquals(100, chunks.get(0).endLine());
        assertEquals(81, chunks.get(1).startLine());
        assertEquals(180, chunks.get(1).endLine());
        assertEquals(161, chunks.get(2).startLine());
        assertEquals(250, chunks.get(2).endLine());
        assertEquals("python", chunks.get(0).language());
    }

    @Test
    void testUnsupportedExtensionYieldsNothing() {
        assertTrue(chunker.chunkFile("README.md", "# hello").isEmpty());
    }

    // ==================== Tree Walk ====================

    @Test
    void testProcessSkipsIgnoredDirectoriesAndAppliesCaps() throws IOException {
        write("src/a.js", "function a() {\n}\nfunction b() {\n}\nfunction c() {\n}\n");
        write("src/b.py", "print(1)\n");
        write("node_modules/dep/index.js", "function dep() {\n}\n");
        write("target/Gen.java", "class Gen {}\n");
        write("docs/readme.txt", "hello\n");

        List<CodeChunk> all = chunker.process(tempDir);
        assertEquals(4, all.size());
        assertTrue(all.stream().noneMatch(c -> c.file().startsWith("node_modules")));

        List<CodeChunk> capped = chunker.process(tempDir, new ChunkLimits(1, 2), (current, total) -> { });
        assertEquals(2, capped.size());
        assertEquals("src/a.js", capped.get(0).file());
        assertEquals("a", capped.get(0).symbol());
        assertEquals("b", capped.get(1).symbol());
    }

    @Test
    void testRepositoryWithNoSourceFiles() throws IOException {
        write("README.md", "# nothing here\n");

        assertTrue(chunker.process(tempDir).isEmpty());
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
