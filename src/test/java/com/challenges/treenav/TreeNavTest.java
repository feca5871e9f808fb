package com.challenges.treenav;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TreeNavTest {

    private static final String DOCUMENT = """
        {
          "users": [
            {"id": 1, "name": "John", "address": {"city": "Oslo"}},
            {"id": 2, "name": "Jane", "address": {"city": "Bergen"}}
          ],
          "meta": {"count": 2}
        }
        """;

    @TempDir
    Path tempDir;

    private Path input;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void writeDocument() throws IOException {
        input = tempDir.resolve("users.json");
        Files.writeString(input, DOCUMENT, StandardCharsets.UTF_8);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new TreeNav());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    public void testCascadingSearch() {
        int exitCode = run("-i", input.toString(), "-c", "name=users", "name=city");

        assertEquals(0, exitCode);
        assertEquals("\"Oslo\"\n\"Bergen\"", out.toString().strip().replace("\r\n", "\n"));
    }

    @Test
    public void testWithNames() {
        int exitCode = run("-i", input.toString(), "-c", "-n", "name=meta");

        assertEquals(0, exitCode);
        assertEquals("meta:{\"count\":2}", out.toString().strip());
    }

    @Test
    public void testPrettyOutputIsDefault() {
        int exitCode = run("-i", input.toString(), "name=meta");

        assertEquals(0, exitCode);
        assertEquals("{\n  \"count\": 2\n}", out.toString().strip().replace("\r\n", "\n"));
    }

    @Test
    public void testFirstMatch() {
        int exitCode = run("-i", input.toString(), "-c", "--first", "name=name");

        assertEquals(0, exitCode);
        assertEquals("\"John\"", out.toString().strip());
    }

    @Test
    public void testDirectChildren() {
        int exitCode = run("-i", input.toString(), "-c", "-n", "--children", "type=object");

        assertEquals(0, exitCode);
        assertEquals("meta:{\"count\":2}", out.toString().strip());
    }

    @Test
    public void testNoMatchesIsNotAnError() {
        int exitCode = run("-i", input.toString(), "name=missing");

        assertEquals(0, exitCode);
        assertEquals("", out.toString());
    }

    @Test
    public void testInvalidCriteriaReportsError() {
        int exitCode = run("-i", input.toString(), "size=3");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: Unsupported criteria: size=3"), err.toString());
    }

    @Test
    public void testMissingFileReportsError() {
        int exitCode = run("-i", tempDir.resolve("nope.json").toString(), "name=users");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error:"));
    }

    @Test
    public void testMalformedDocumentReportsError() throws IOException {
        Files.writeString(input, "{\"users\": [", StandardCharsets.UTF_8);

        assertEquals(1, run("-i", input.toString(), "name=users"));
        assertTrue(err.toString().startsWith("Error:"));
    }

    @Test
    public void testExclusiveModes() {
        int exitCode = run("-i", input.toString(), "--first", "--children", "name=users");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("mutually exclusive"));
    }

    @Test
    public void testSingleCriteriaModesRejectSeveralCriteria() {
        int exitCode = run("-i", input.toString(), "--first", "name=users", "name=id");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
    }

    @Test
    public void testCriteriaAreRequired() {
        assertEquals(CommandLine.ExitCode.USAGE, run("-i", input.toString()));
    }
}
