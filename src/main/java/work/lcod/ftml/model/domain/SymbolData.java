package work.lcod.ftml.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.ftml.model.term.ArgumentSpec;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.node.SourceRange;

/**
 * Everything known about a declared symbol or variable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolData(
    ArgumentSpec arity,
    String macroname,
    List<String> role,
    Term tp,
    Term df,
    Term returnType,
    List<Term> argumentTypes,
    AssocType assoctype,
    String reordering,
    SourceRange source
) {
    public SymbolData {
        arity = arity == null ? ArgumentSpec.NONE : arity;
        role = role == null ? List.of() : List.copyOf(role);
        argumentTypes = argumentTypes == null ? List.of() : List.copyOf(argumentTypes);
    }

    public SymbolData withDefiniens(Term definiens) {
        return new SymbolData(arity, macroname, role, tp, definiens, returnType, argumentTypes, assoctype, reordering, source);
    }
}
