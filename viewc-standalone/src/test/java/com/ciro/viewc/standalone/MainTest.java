package com.ciro.viewc.standalone;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private Path fixture(String name) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(name)) {
            Files.copy(in, target);
        }
        return target;
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void withoutArgumentsPrintsUsage() {
        assertEquals(Main.USAGE, new Main().run(new String[0], out));
        assertTrue(printed().startsWith("uso:"));
    }

    @Test
    void tooManyFilesIsUsageError() {
        assertEquals(Main.USAGE, new Main().run(new String[]{"a.json", "b.txt", "c.txt"}, out));
    }

    @Test
    void printsTextListingToStdout() throws IOException {
        Path bundle = fixture("counter.json");

        assertEquals(Main.OK, new Main().run(new String[]{bundle.toString()}, out));

        String listing = printed();
        assertTrue(listing.contains("// ===== Counter ====="));
        assertTrue(listing.contains("update_count"));
        assertTrue(listing.contains("_update_el1_text"));
    }

    @Test
    void writesJsonListingToOutputFile() throws IOException {
        Path bundle = fixture("counter.json");
        Path target = dir.resolve("counter.out.json");

        int code = new Main().run(new String[]{"-Dviewc.output=json", bundle.toString(), target.toString()}, out);

        assertEquals(Main.OK, code);
        assertEquals("", printed());
        String json = Files.readString(target);
        assertTrue(json.contains("\"components\""));
        assertTrue(json.contains("\"Counter\""));
        assertTrue(json.contains("\"update_count\""));
    }

    @Test
    void runRendersMountedHtml() throws IOException {
        Path bundle = fixture("counter.json");

        int code = new Main().run(new String[]{"-Dviewc.run=Counter", "-Dviewc.scope-attribute=none", bundle.toString()}, out);

        assertEquals(Main.OK, code);
        assertEquals("<body><p>hola</p><span>0</span></body>", printed().trim());
    }

    @Test
    void runWithUnknownComponentFails() throws IOException {
        Path bundle = fixture("counter.json");
        assertEquals(Main.COMPILE_ERROR, new Main().run(new String[]{"-Dviewc.run=Nope", bundle.toString()}, out));
    }

    @Test
    void compileErrorIsReportedWithExitCode() throws IOException {
        Path bundle = fixture("broken.json");
        assertEquals(Main.COMPILE_ERROR, new Main().run(new String[]{bundle.toString()}, out));
        assertEquals("", printed());
    }

    @Test
    void missingFileIsReportedWithExitCode() {
        String missing = dir.resolve("no-existe.json").toString();
        assertEquals(Main.COMPILE_ERROR, new Main().run(new String[]{missing}, out));
    }
}
