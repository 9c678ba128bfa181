package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.List;
import work.lcod.ftml.model.term.ArgumentMode;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.BoundArgument;
import work.lcod.ftml.model.term.ComponentVar;
import work.lcod.ftml.model.term.Term;

/**
 * An argument slot of a binding term; {@code shouldBeVar} marks slots that bind variables.
 */
public sealed interface OpenBoundArgument {
    boolean shouldBeVar();

    record Simple(Term term, boolean shouldBeVar) implements OpenBoundArgument {}

    record SequenceTerm(Term term, boolean shouldBeVar) implements OpenBoundArgument {}

    record Sequence(List<Term> terms, boolean shouldBeVar) implements OpenBoundArgument {}

    static void set(List<OpenBoundArgument> args, ArgumentPosition position, Term term) {
        int idx = position.index();
        while (args.size() <= idx) {
            args.add(null);
        }
        OpenBoundArgument current = args.get(idx);
        ArgumentMode mode = position.mode();
        if (current == null) {
            if (position instanceof ArgumentPosition.Sequence seq) {
                args.set(idx, new Sequence(OpenArgument.padded(new ArrayList<>(), seq.sequenceIndex(), term), mode.isBound()));
            } else if (mode.isSequence()) {
                args.set(idx, new SequenceTerm(term, mode == ArgumentMode.BOUND_VARIABLE_SEQUENCE));
            } else {
                args.set(idx, new Simple(term, mode == ArgumentMode.BOUND_VARIABLE));
            }
            return;
        }
        if (current instanceof Sequence s && position instanceof ArgumentPosition.Sequence seq && mode.isSequence()) {
            List<Term> terms = s.terms();
            int slot = seq.sequenceIndex() - 1;
            while (terms.size() <= slot) {
                terms.add(null);
            }
            Term existing = terms.get(slot);
            if (existing != null && !existing.equals(term)) {
                throw FtmlExtractionException.mismatchedBoundArgument(position);
            }
            terms.set(slot, term);
            return;
        }
        if (current instanceof Simple s && position instanceof ArgumentPosition.Simple && s.term().equals(term)) {
            return;
        }
        throw FtmlExtractionException.mismatchedBoundArgument(position);
    }

    /** The finished argument, or null while some sequence element is missing. */
    default BoundArgument close() {
        if (this instanceof Simple s) {
            if (s.shouldBeVar() && s.term() instanceof Term.Var v) {
                return new BoundArgument.Bound(ComponentVar.of(v.variable()));
            }
            return new BoundArgument.Simple(s.term());
        }
        if (this instanceof SequenceTerm s) {
            if (s.shouldBeVar() && s.term() instanceof Term.Var v) {
                return new BoundArgument.BoundSequenceTerm(ComponentVar.of(v.variable()));
            }
            return new BoundArgument.SequenceTerm(s.term());
        }
        Sequence seq = (Sequence) this;
        if (seq.terms().contains(null)) {
            return null;
        }
        if (seq.shouldBeVar() && seq.terms().stream().allMatch(t -> t instanceof Term.Var)) {
            List<ComponentVar> vars = new ArrayList<>();
            for (Term t : seq.terms()) {
                vars.add(ComponentVar.of(((Term.Var) t).variable()));
            }
            return new BoundArgument.BoundSequence(vars);
        }
        return new BoundArgument.Sequence(seq.terms());
    }
}
