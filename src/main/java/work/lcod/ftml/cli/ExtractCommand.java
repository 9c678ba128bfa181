package work.lcod.ftml.cli;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.ftml.api.ExtractionConfigLoader;
import work.lcod.ftml.api.ExtractionConfiguration;
import work.lcod.ftml.api.ExtractionReport;
import work.lcod.ftml.api.FtmlRunner;
import work.lcod.ftml.api.LogLevel;
import work.lcod.ftml.shared.Diagnostics;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.UriParseException;

@CommandLine.Command(
    name = "ftml-extract",
    description = "Extract modules, notations, paragraphs and problems from an FTML document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ExtractCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--input"},
        required = true,
        paramLabel = "HTML",
        description = "HTML file to extract."
    )
    private Path input;

    @CommandLine.Option(
        names = {"-u", "--uri"},
        paramLabel = "DOCUMENT-URI",
        description = "Document uri (default: document.uri from the config, else derived from the file name).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String uri;

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "TOML",
        description = "Config file (default: ftml.toml next to the input, when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "JSON",
        description = "Write the report here instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostics threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(names = "--compact", description = "Single-line JSON output.")
    private boolean compact;

    @CommandLine.Option(names = "--include-blobs", description = "Embed the blob buffer (base64) in the report.")
    private boolean includeBlobs;

    @Override
    public Integer call() throws Exception {
        ExtractionConfiguration configuration = configuration();
        Diagnostics diagnostics = new Diagnostics(configuration.logLevel(), System.err);
        ExtractionReport report = new FtmlRunner().run(configuration, diagnostics);
        String json = configuration.pretty() ? report.toPrettyJson() : report.toCompactJson();
        if (configuration.output().isPresent()) {
            Path target = configuration.output().get();
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.println(json);
            out.flush();
        }
        if (!report.succeeded()) {
            PrintWriter err = spec.commandLine().getErr();
            err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(report.metadata().get("error"))));
            err.flush();
        }
        return report.status().exitCode();
    }

    ExtractionConfiguration configuration() throws Exception {
        Path inputPath = input.toAbsolutePath().normalize();
        ExtractionConfiguration.Builder builder = ExtractionConfiguration.builder().input(inputPath);

        Path configPath = config;
        if (configPath == null && inputPath.getParent() != null) {
            configPath = inputPath.getParent().resolve(ExtractionConfigLoader.DEFAULT_FILE_NAME);
        } else if (configPath != null && !Files.isRegularFile(configPath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + configPath);
        }
        ExtractionConfigLoader.load(configPath).ifPresent(settings -> settings.applyTo(builder));

        if (uri != null && !uri.isBlank()) {
            try {
                builder.documentUri(DocumentUri.parse(uri.trim()));
            } catch (UriParseException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Invalid document uri: " + ex.getMessage());
            }
        }
        if (logLevelRaw != null && !logLevelRaw.isBlank()) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        if (compact) {
            builder.pretty(false);
        }
        if (includeBlobs) {
            builder.includeBlobs(true);
        }
        return builder.output(Optional.ofNullable(output)).build();
    }
}
