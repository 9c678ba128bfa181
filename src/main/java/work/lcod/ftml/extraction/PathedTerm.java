package work.lcod.ftml.extraction;

import java.util.List;
import work.lcod.ftml.model.term.Term;

/**
 * A candidate sub-term together with its child-index path from the collecting frame's node.
 */
public record PathedTerm(Term term, List<Integer> path) {
    public PathedTerm {
        path = List.copyOf(path);
    }
}
