package work.lcod.ftml.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.ftml.model.domain.ModuleData;
import work.lcod.ftml.model.narrative.Document;
import work.lcod.ftml.model.problem.SolutionData;
import work.lcod.ftml.uri.DocumentElementUri;

/**
 * Everything extracted from one document. {@code data} is the blob buffer that the
 * {@link work.lcod.ftml.model.DataRef}s in the document point into.
 */
public record ExtractionResult(
    Document document,
    List<ModuleData> modules,
    byte[] data,
    List<NotationEntry> notations,
    Map<DocumentElementUri, List<SolutionData>> solutions
) {
    public ExtractionResult {
        modules = List.copyOf(modules);
        notations = List.copyOf(notations);
        solutions = Collections.unmodifiableMap(new LinkedHashMap<>(solutions));
    }
}
