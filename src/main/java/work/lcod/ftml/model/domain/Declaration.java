package work.lcod.ftml.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.node.SourceRange;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;

/**
 * A declaration inside a module, nested module or structure.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Declaration {
    record Symbol(SymbolUri uri, SymbolData data) implements Declaration {}

    record NestedModule(ModuleUri uri, List<Declaration> declarations, SourceRange source) implements Declaration {
        public NestedModule {
            declarations = List.copyOf(declarations);
        }
    }

    record MathStructure(SymbolUri uri, String macroname, List<Declaration> elements, SourceRange source)
        implements Declaration {
        public MathStructure {
            elements = List.copyOf(elements);
        }
    }

    /** A conservative extension of the structure {@code target}. */
    record Extension(SymbolUri uri, SymbolUri target, List<Declaration> elements, SourceRange source)
        implements Declaration {
        public Extension {
            elements = List.copyOf(elements);
        }
    }

    record Morphism(SymbolUri uri, ModuleUri domain, boolean total, List<Assignment> elements, SourceRange source)
        implements Declaration {
        public Morphism {
            elements = List.copyOf(elements);
        }
    }

    record Import(ModuleUri uri, SourceRange source) implements Declaration {}

    record Rule(String id, List<Term> parameters, SourceRange source) implements Declaration {
        public Rule {
            parameters = List.copyOf(parameters);
        }
    }

    /** Whether the declaration may appear inside a structure. */
    default boolean allowedInStructure() {
        return this instanceof Symbol || this instanceof Import || this instanceof Morphism || this instanceof Rule;
    }
}
