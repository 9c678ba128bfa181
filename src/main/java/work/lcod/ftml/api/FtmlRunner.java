package work.lcod.ftml.api;

import java.nio.file.Files;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jsoup.nodes.Document;
import work.lcod.ftml.extraction.ExtractionResult;
import work.lcod.ftml.extraction.FtmlExtractionException;
import work.lcod.ftml.extraction.HtmlExtractor;
import work.lcod.ftml.node.HtmlSource;
import work.lcod.ftml.shared.Diagnostics;

/**
 * Public entry point for embedding the extractor: reads one HTML file and reports what was extracted.
 */
public final class FtmlRunner {
    private final HtmlExtractor extractor;

    public FtmlRunner() {
        this(new HtmlExtractor());
    }

    public FtmlRunner(HtmlExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public ExtractionReport run(ExtractionConfiguration configuration) {
        return run(configuration, Diagnostics.stderr(configuration.logLevel()));
    }

    public ExtractionReport run(ExtractionConfiguration configuration, Diagnostics diagnostics) {
        var started = Instant.now();
        try {
            if (!Files.isRegularFile(configuration.input())) {
                throw new IllegalArgumentException("input file not found: " + configuration.input());
            }
            Document html = HtmlSource.read(configuration.input());
            diagnostics.info("extracting %s as %s", configuration.input(), configuration.documentUri());
            ExtractionResult result = extractor.extract(html, configuration.documentUri(), diagnostics);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("input", configuration.input().toString());
            metadata.put("document", result.document());
            metadata.put("modules", result.modules());
            metadata.put("notations", result.notations());
            metadata.put("solutions", solutionsByProblem(result));
            metadata.put("blobSize", result.data().length);
            if (configuration.includeBlobs()) {
                metadata.put("blobs", Base64.getEncoder().encodeToString(result.data()));
            }
            metadata.put("html", html.html());
            metadata.put("diagnostics", diagnostics.emitted());
            return ExtractionReport.success(metadata, started);
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("input", configuration.input().toString());
            errorMeta.put("document", configuration.documentUri().toString());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            if (ex instanceof FtmlExtractionException extraction) {
                errorMeta.put("errorKind", extraction.kind().name());
                if (extraction.key() != null) {
                    errorMeta.put("key", extraction.key().keyName());
                }
            } else {
                errorMeta.put("errorKind", ex.getClass().getSimpleName());
            }
            errorMeta.put("diagnostics", diagnostics.emitted());
            if (Boolean.getBoolean("ftml.debug")) {
                ex.printStackTrace();
            }
            return ExtractionReport.failure(ex.getMessage(), errorMeta, started);
        }
    }

    private static Map<String, Object> solutionsByProblem(ExtractionResult result) {
        var solutions = new LinkedHashMap<String, Object>();
        result.solutions().forEach((problem, data) -> solutions.put(problem.toString(), data));
        return solutions;
    }
}
