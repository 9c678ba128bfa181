package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * A closed argument of a binding term: plain terms, or variables bound by the binder.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
public sealed interface BoundArgument {
    record Simple(Term term) implements BoundArgument {}

    record SequenceTerm(Term term) implements BoundArgument {}

    record Sequence(List<Term> terms) implements BoundArgument {
        public Sequence {
            terms = List.copyOf(terms);
        }
    }

    record Bound(ComponentVar variable) implements BoundArgument {}

    record BoundSequenceTerm(ComponentVar variable) implements BoundArgument {}

    record BoundSequence(List<ComponentVar> variables) implements BoundArgument {
        public BoundSequence {
            variables = List.copyOf(variables);
        }
    }
}
