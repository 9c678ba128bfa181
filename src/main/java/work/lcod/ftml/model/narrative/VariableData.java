package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.ftml.model.domain.AssocType;
import work.lcod.ftml.model.term.ArgumentSpec;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.node.SourceRange;

/**
 * A variable declared in the narrative; {@code bind} marks variables bound by the surrounding paragraph.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableData(
    ArgumentSpec arity,
    String macroname,
    List<String> role,
    Term tp,
    Term df,
    Term returnType,
    List<Term> argumentTypes,
    AssocType assoctype,
    String reordering,
    boolean bind,
    boolean isSeq,
    SourceRange source
) {
    public VariableData {
        arity = arity == null ? ArgumentSpec.NONE : arity;
        role = role == null ? List.of() : List.copyOf(role);
        argumentTypes = argumentTypes == null ? List.of() : List.copyOf(argumentTypes);
    }
}
