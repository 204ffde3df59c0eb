package work.lcod.layout.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class LayoutCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void printsFramesAsJson() throws Exception {
        int exit = run("--document", "src/test/resources/documents/long.yaml", "--width", "200pt", "--height", "100pt");

        assertEquals(0, exit, err::toString);
        var tree = new ObjectMapper().readTree(out.toString());
        assertEquals("success", tree.get("status").asText());
        assertEquals(200, tree.get("frames").get(0).get("width").asDouble());
    }

    @Test
    void writesJsonToOutputFile(@TempDir Path tempDir) throws Exception {
        var output = tempDir.resolve("out/frames.json");

        int exit = run("-d", "src/test/resources/documents/basic.yaml", "-s", "src/test/resources/documents/small.toml",
            "-o", output.toString());

        assertEquals(0, exit, err::toString);
        assertTrue(Files.readString(output).contains("\"frames\""));
        assertTrue(out.toString().isEmpty());
    }

    @Test
    void failedLayoutExitsWithOne() {
        int exit = run("--document", "src/test/resources/documents/invalid.yaml");

        assertEquals(1, exit);
        assertTrue(out.toString().contains("\"failure\""));
        assertTrue(err.toString().contains("Unknown content kind 'shape'"));
    }

    @Test
    void rejectsColumnCountBelowOne() {
        int exit = run("--document", "src/test/resources/documents/long.yaml", "--columns", "0");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("--columns must be at least 1."));
    }

    @Test
    void rejectsUnknownMode() {
        int exit = run("--document", "src/test/resources/documents/long.yaml", "--mode", "inline");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("Unsupported --mode: inline"));
    }

    @Test
    void unwritableOutputIsReportedShortly(@TempDir Path tempDir) throws Exception {
        var blocker = Files.writeString(tempDir.resolve("blocker"), "");

        int exit = run("-d", "src/test/resources/documents/long.yaml", "-o", blocker.resolve("frames.json").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("blocker"));
    }

    @Test
    void requiresDocument() {
        assertEquals(2, run());
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("lcod-layout "));
    }
}
