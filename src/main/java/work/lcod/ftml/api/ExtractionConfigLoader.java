package work.lcod.ftml.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.UriParseException;

/**
 * Reads {@code ftml.toml} files:
 * <pre>
 * [document]
 * uri = "https://mathhub.info?a=smglom/sets&amp;d=sets&amp;l=en"
 * [output]
 * pretty = true
 * include-blobs = false
 * [log]
 * level = "warn"
 * </pre>
 * Every entry is optional.
 */
public final class ExtractionConfigLoader {
    public static final String DEFAULT_FILE_NAME = "ftml.toml";

    private ExtractionConfigLoader() {}

    /** Values found in a config file; absent entries keep the builder's defaults. */
    public record Settings(
        Optional<DocumentUri> documentUri,
        Optional<Boolean> pretty,
        Optional<Boolean> includeBlobs,
        Optional<LogLevel> logLevel
    ) {
        public ExtractionConfiguration.Builder applyTo(ExtractionConfiguration.Builder builder) {
            documentUri.ifPresent(builder::documentUri);
            pretty.ifPresent(builder::pretty);
            includeBlobs.ifPresent(builder::includeBlobs);
            logLevel.ifPresent(builder::logLevel);
            return builder;
        }
    }

    /**
     * @return empty if there is no such file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid TOML or holds an invalid document uri
     */
    public static Optional<Settings> load(Path configPath) throws IOException {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return Optional.empty();
        }
        return Optional.of(parse(Files.readString(configPath)));
    }

    public static Settings parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("invalid config: " + result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; ")));
        }
        return fromToml(result);
    }

    public static Settings fromToml(TomlParseResult result) {
        Optional<DocumentUri> uri = Optional.empty();
        String rawUri = result.getString("document.uri");
        if (rawUri != null && !rawUri.isBlank()) {
            try {
                uri = Optional.of(DocumentUri.parse(rawUri.trim()));
            } catch (UriParseException ex) {
                throw new IllegalArgumentException("invalid document.uri: " + ex.getMessage(), ex);
            }
        }
        Optional<LogLevel> level = Optional.ofNullable(result.getString("log.level"))
            .filter(value -> !value.isBlank())
            .map(LogLevel::from);
        return new Settings(
            uri,
            Optional.ofNullable(result.getBoolean("output.pretty")),
            Optional.ofNullable(result.getBoolean("output.include-blobs")),
            level
        );
    }
}
