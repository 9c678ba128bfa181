package work.lcod.ftml.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.node.SourceRange;
import work.lcod.ftml.uri.SymbolUri;

/**
 * What a morphism does with one symbol of its domain.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Assignment(
    SymbolUri original,
    SymbolUri morphism,
    Term definiens,
    Term refinedType,
    String newName,
    String macroname,
    SourceRange source
) {
    public static Assignment of(SymbolUri original, SymbolUri morphism, SourceRange source) {
        return new Assignment(original, morphism, null, null, null, null, source);
    }

    public Assignment withDefiniens(Term df) {
        return new Assignment(original, morphism, df, refinedType, newName, macroname, source);
    }

    public Assignment withRefinedType(Term tp) {
        return new Assignment(original, morphism, definiens, tp, newName, macroname, source);
    }

    public Assignment renamed(String name, String macro) {
        return new Assignment(original, morphism, definiens, refinedType, name, macro, source);
    }
}
