package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * A closed argument of an application.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
public sealed interface Argument {
    record Simple(Term term) implements Argument {}

    /** A single term standing for the whole sequence. */
    record SequenceTerm(Term term) implements Argument {}

    record Sequence(List<Term> terms) implements Argument {
        public Sequence {
            terms = List.copyOf(terms);
        }
    }
}
