package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import work.lcod.ftml.uri.SymbolUri;

/**
 * Head of a term or notation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
public sealed interface VarOrSym {
    record Sym(SymbolUri uri) implements VarOrSym {}

    record Var(Variable variable) implements VarOrSym {}

    default Term toTerm() {
        if (this instanceof Sym s) {
            return new Term.Symbol(s.uri());
        }
        return new Term.Var(((Var) this).variable());
    }
}
