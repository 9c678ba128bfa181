package work.lcod.ftml.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ExtractCommandTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures").toAbsolutePath();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cli = Main.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    @Test
    void printsReportUsingTheConfigNextToTheInput() {
        int exit = run("-i", FIXTURES.resolve("arith.html").toString(), "--log-level", "error");

        assertEquals(0, exit, err::toString);
        String json = out.toString().trim();
        assertTrue(json.startsWith("{\"status\":\"success\""), json);
        assertTrue(json.contains("\"document\""));
        assertTrue(json.contains("\"blobs\""));
    }

    @Test
    void writesReportToFile(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("out").resolve("report.json");
        int exit = run("-i", FIXTURES.resolve("arith.html").toString(),
            "-u", "https://mathhub.info?a=test/arith&d=other&l=de", "-o", target.toString());

        assertEquals(0, exit, err::toString);
        assertEquals("", out.toString());
        String json = Files.readString(target);
        assertTrue(json.contains("d=other&l=de"), json);
    }

    @Test
    void failedExtractionExitsWithOne() {
        int exit = run("-i", FIXTURES.resolve("broken.html").toString(), "--log-level", "fatal");

        assertEquals(1, exit);
        assertTrue(out.toString().contains("\"errorKind\":\"NOT_IN\""), out::toString);
        assertTrue(err.toString().contains("arg"), err::toString);
    }

    @Test
    void rejectsBadArguments() {
        assertEquals(2, run("-i", FIXTURES.resolve("arith.html").toString(), "-c", FIXTURES.resolve("none.toml").toString()));
        assertEquals(2, run("-i", FIXTURES.resolve("arith.html").toString(), "-u", "not a uri"));
        assertEquals(2, run());
    }
}
