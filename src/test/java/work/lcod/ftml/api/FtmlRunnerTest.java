package work.lcod.ftml.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.ftml.shared.Diagnostics;
import work.lcod.ftml.uri.DocumentUri;

class FtmlRunnerTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures").toAbsolutePath();

    @Test
    void extractsFixtureDocument() throws Exception {
        var uri = DocumentUri.parse("https://mathhub.info?a=test/arith&d=arith&l=en");
        var config = ExtractionConfiguration.builder()
            .input(FIXTURES.resolve("arith.html"))
            .documentUri(uri)
            .includeBlobs(true)
            .build();

        var report = new FtmlRunner().run(config, Diagnostics.silent(LogLevel.WARN));
        assertEquals(ExtractionReport.Status.SUCCESS, report.status(), () -> String.valueOf(report.metadata()));
        assertEquals(1, ((List<?>) report.metadata().get("modules")).size());
        assertEquals(1, ((List<?>) report.metadata().get("notations")).size());
        var solutions = (Map<?, ?>) report.metadata().get("solutions");
        assertTrue(solutions.containsKey(uri.element("sum").toString()));
        assertTrue((Integer) report.metadata().get("blobSize") > 0);
        assertTrue(report.metadata().containsKey("blobs"));

        String html = (String) report.metadata().get("html");
        assertFalse(html.contains("Zero."));
        assertFalse(html.contains("data-ftml-notationcomp"));

        var json = report.toCompactJson();
        assertTrue(json.startsWith("{\"status\":\"success\""));
        assertTrue(json.contains(uri.toString()));
    }

    @Test
    void reportsExtractionErrors() {
        var config = ExtractionConfiguration.builder().input(FIXTURES.resolve("broken.html")).build();
        var report = new FtmlRunner().run(config, Diagnostics.silent(LogLevel.WARN));

        assertEquals(ExtractionReport.Status.FAILURE, report.status());
        assertEquals(1, report.status().exitCode());
        assertEquals("NOT_IN", report.metadata().get("errorKind"));
        assertEquals("arg", report.metadata().get("key"));
        assertEquals("http://localhost?a=local&d=broken&l=en", report.metadata().get("document"));
    }

    @Test
    void reportsMissingInput() {
        var config = ExtractionConfiguration.builder().input(FIXTURES.resolve("nowhere.html")).build();
        var report = new FtmlRunner().run(config, Diagnostics.silent(LogLevel.WARN));

        assertFalse(report.succeeded());
        assertEquals("IllegalArgumentException", report.metadata().get("errorKind"));
        assertTrue(((String) report.metadata().get("error")).startsWith("input file not found"));
    }
}
