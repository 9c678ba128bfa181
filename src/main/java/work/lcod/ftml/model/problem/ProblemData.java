package work.lcod.ftml.model.problem;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.ftml.model.DataRef;
import work.lcod.ftml.node.SourceRange;

/**
 * Everything a finished problem carries besides its uri and children. Solutions, hints and notes
 * live in the blob buffer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemData(
    boolean subProblem,
    boolean autogradable,
    Float points,
    Float minutes,
    DataRef solutions,
    List<DataRef> gradingNotes,
    List<DataRef> hints,
    List<DataRef> notes,
    List<String> styles,
    String title,
    List<DimensionedSymbol> preconditions,
    List<DimensionedSymbol> objectives,
    SourceRange source
) {
    public ProblemData {
        gradingNotes = List.copyOf(gradingNotes);
        hints = List.copyOf(hints);
        notes = List.copyOf(notes);
        styles = List.copyOf(styles);
        preconditions = List.copyOf(preconditions);
        objectives = List.copyOf(objectives);
    }
}
