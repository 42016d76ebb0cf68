package work.enamap.mapper.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class MapperCommandTest {
    @Test
    void missingRequestFileIsUsageError() {
        var err = new StringWriter();
        var commandLine = new CommandLine(new MapperCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setErr(new PrintWriter(err));

        int exitCode = commandLine.execute("does-not-exist.yaml");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Request file not found: does-not-exist.yaml"));
    }

    @Test
    void requiresAtLeastOneRequest() {
        var commandLine = new CommandLine(new MapperCommand()).setErr(new PrintWriter(new StringWriter()));

        assertEquals(2, commandLine.execute());
    }

    @Test
    void printsVersion() {
        var out = new StringWriter();
        var commandLine = new CommandLine(new MapperCommand()).setOut(new PrintWriter(out));

        assertEquals(0, commandLine.execute("--version"));
        assertTrue(out.toString().startsWith("ena-mapper "));
    }
}
