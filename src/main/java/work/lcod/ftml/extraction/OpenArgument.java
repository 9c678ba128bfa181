package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.List;
import work.lcod.ftml.model.term.Argument;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.Term;

/**
 * An argument slot of an application that is still being filled. Unfilled slots are {@code null}.
 */
public sealed interface OpenArgument {
    record Simple(Term term) implements OpenArgument {}

    /** One term for the whole sequence. */
    record SequenceTerm(Term term) implements OpenArgument {}

    /** Sequence elements filled by index; entries may be null until closed. */
    record Sequence(List<Term> terms) implements OpenArgument {}

    /**
     * Puts {@code term} at {@code position}. Re-filling a simple slot with an equal term is accepted;
     * any other second assignment with a different term is a mismatch.
     */
    static void set(List<OpenArgument> args, ArgumentPosition position, Term term) {
        int idx = position.index();
        while (args.size() <= idx) {
            args.add(null);
        }
        OpenArgument current = args.get(idx);
        if (current == null) {
            if (position instanceof ArgumentPosition.Sequence seq) {
                args.set(idx, new Sequence(padded(new ArrayList<>(), seq.sequenceIndex(), term)));
            } else if (position.mode().isSequence()) {
                args.set(idx, new SequenceTerm(term));
            } else {
                args.set(idx, new Simple(term));
            }
            return;
        }
        if (current instanceof Sequence s && position instanceof ArgumentPosition.Sequence seq) {
            List<Term> terms = s.terms();
            int slot = seq.sequenceIndex() - 1;
            while (terms.size() <= slot) {
                terms.add(null);
            }
            Term existing = terms.get(slot);
            if (existing != null && !existing.equals(term)) {
                throw FtmlExtractionException.mismatchedArgument(position);
            }
            terms.set(slot, term);
            return;
        }
        if (current instanceof Simple s && position instanceof ArgumentPosition.Simple && s.term().equals(term)) {
            return;
        }
        throw FtmlExtractionException.mismatchedArgument(position);
    }

    /** The finished argument, or null while some sequence element is missing. */
    default Argument close() {
        if (this instanceof Simple s) {
            return new Argument.Simple(s.term());
        }
        if (this instanceof SequenceTerm s) {
            return new Argument.SequenceTerm(s.term());
        }
        List<Term> terms = ((Sequence) this).terms();
        if (terms.contains(null)) {
            return null;
        }
        return new Argument.Sequence(terms);
    }

    static List<Term> padded(List<Term> list, int sequenceIndex, Term term) {
        while (list.size() < sequenceIndex - 1) {
            list.add(null);
        }
        list.add(term);
        return list;
    }
}
