package main;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void help_shouldListOptions() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--help");

        assertEquals(0, exitCode);
        for (String option : new String[]{"--config", "--compare", "--detailed", "--print-structure", "--log-level"}) {
            assertTrue(out.toString().contains(option), option + " missing from help");
        }
    }

    @Test
    void call_shouldFailWithoutConfiguration() {
        int exitCode = new CommandLine(new Main()).execute("--config", tempDir.resolve("missing.json").toString());

        assertEquals(1, exitCode);
    }
}
