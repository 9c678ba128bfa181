package work.lcod.ftml.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.ftml.uri.DocumentUri;

class ExtractionConfigLoaderTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures").toAbsolutePath();

    @Test
    void readsEverySection() throws Exception {
        var settings = ExtractionConfigLoader.load(FIXTURES.resolve(ExtractionConfigLoader.DEFAULT_FILE_NAME)).orElseThrow();
        assertEquals(Optional.of(DocumentUri.parse("https://mathhub.info?a=test/arith&d=arith&l=en")), settings.documentUri());
        assertEquals(Optional.of(false), settings.pretty());
        assertEquals(Optional.of(true), settings.includeBlobs());
        assertEquals(Optional.of(LogLevel.INFO), settings.logLevel());
    }

    @Test
    void absentEntriesKeepDefaults() {
        var settings = ExtractionConfigLoader.parse("[output]\npretty = false\n");
        var config = settings.applyTo(ExtractionConfiguration.builder().input(FIXTURES.resolve("arith.html"))).build();
        assertFalse(config.pretty());
        assertFalse(config.includeBlobs());
        assertEquals(LogLevel.WARN, config.logLevel());
        assertEquals(ExtractionConfiguration.defaultDocumentUri(FIXTURES.resolve("arith.html")), config.documentUri());
        assertEquals("http://localhost?a=local&d=arith&l=en", config.documentUri().toString());
    }

    @Test
    void missingFileIsNotAnError() throws Exception {
        assertTrue(ExtractionConfigLoader.load(FIXTURES.resolve("missing.toml")).isEmpty());
    }

    @Test
    void rejectsInvalidContent() {
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfigLoader.parse("[document\nuri ="));
        assertThrows(IllegalArgumentException.class,
            () -> ExtractionConfigLoader.parse("[document]\nuri = \"https://mathhub.info?a=x&m=mod\"\n"));
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfigLoader.parse("[log]\nlevel = \"loud\"\n"));
    }
}
