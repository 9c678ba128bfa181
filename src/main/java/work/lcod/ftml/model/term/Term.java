package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Map;
import work.lcod.ftml.uri.SymbolUri;

/**
 * Closed terms recovered from the markup.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Term {
    record Symbol(SymbolUri uri) implements Term {}

    record Var(Variable variable) implements Term {}

    /** {@code presentation} is the head as written when an explicit head term replaced it. */
    record Application(Term head, List<Argument> arguments, VarOrSym presentation) implements Term {
        public Application {
            arguments = List.copyOf(arguments);
        }
    }

    record Bound(Term head, List<BoundArgument> arguments, VarOrSym presentation) implements Term {
        public Bound {
            arguments = List.copyOf(arguments);
        }
    }

    record Label(String name, Term df, Term tp) implements Term {}

    /** Markup that is not itself a term, with the terms found inside it. */
    record Opaque(String tag, Map<String, String> attributes, List<OpaqueNode> children, List<Term> terms)
        implements Term {
        public Opaque {
            attributes = Map.copyOf(attributes);
            children = List.copyOf(children);
            terms = List.copyOf(terms);
        }
    }

    /** Unwraps opaque wrappers that only carry a single sub-term and ftml bookkeeping attributes. */
    default Term simplify() {
        Term current = this;
        while (current instanceof Opaque o) {
            if (!o.attributes().keySet().stream().allMatch(Term::isIgnorableAttribute)) {
                break;
            }
            OpaqueNode.TermRef only = null;
            boolean single = true;
            for (OpaqueNode child : o.children()) {
                if (child instanceof OpaqueNode.Text t && t.text().isBlank()) {
                    continue;
                }
                if (child instanceof OpaqueNode.TermRef ref && only == null) {
                    only = ref;
                } else {
                    single = false;
                }
            }
            if (!single || only == null) {
                break;
            }
            current = o.terms().get(only.index());
        }
        return current;
    }

    static boolean isIgnorableAttribute(String name) {
        return name.startsWith("data-ftml-") || name.equals("class") || name.equals("style");
    }
}
