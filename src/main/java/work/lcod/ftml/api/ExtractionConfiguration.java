package work.lcod.ftml.api;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.PathUri;

/**
 * Immutable configuration of one extraction run.
 */
public record ExtractionConfiguration(
    Path input,
    DocumentUri documentUri,
    Optional<Path> output,
    LogLevel logLevel,
    boolean pretty,
    boolean includeBlobs
) {
    /** Archive used when neither the command line nor the config file names the document. */
    public static final PathUri LOCAL_ARCHIVE = PathUri.of("http://localhost", "local");

    public ExtractionConfiguration {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(documentUri, "documentUri");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** {@code http://localhost?a=local&d=<file stem>&l=en}. */
    public static DocumentUri defaultDocumentUri(Path input) {
        String file = input.getFileName() == null ? "document" : input.getFileName().toString();
        int dot = file.indexOf('.');
        String stem = dot > 0 ? file.substring(0, dot) : file;
        String name = stem.replaceAll("[^A-Za-z0-9_-]", "_");
        return new DocumentUri(LOCAL_ARCHIVE, name.isEmpty() ? "document" : name.toLowerCase(Locale.ROOT), "en");
    }

    public static final class Builder {
        private Path input;
        private DocumentUri documentUri;
        private Optional<Path> output = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;
        private boolean pretty = true;
        private boolean includeBlobs;

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public Builder documentUri(DocumentUri documentUri) {
            this.documentUri = documentUri;
            return this;
        }

        public Builder output(Optional<Path> output) {
            this.output = output;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder pretty(boolean pretty) {
            this.pretty = pretty;
            return this;
        }

        public Builder includeBlobs(boolean includeBlobs) {
            this.includeBlobs = includeBlobs;
            return this;
        }

        public ExtractionConfiguration build() {
            DocumentUri uri = documentUri;
            if (uri == null && input != null) {
                uri = defaultDocumentUri(input);
            }
            return new ExtractionConfiguration(input, uri, output, logLevel, pretty, includeBlobs);
        }
    }
}
