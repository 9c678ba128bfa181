package work.lcod.ftml.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.ftml.support.FtmlTestSupport.symbol;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.ftml.model.term.Argument;
import work.lcod.ftml.model.term.ArgumentMode;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.Term;

class OpenArgumentTest {
    private static final Term ONE = new Term.Symbol(symbol("one"));
    private static final Term TWO = new Term.Symbol(symbol("two"));

    @Test
    void fillsSlotsByPosition() {
        List<OpenArgument> args = new ArrayList<>();
        OpenArgument.set(args, new ArgumentPosition.Simple(2, ArgumentMode.SIMPLE), TWO);
        OpenArgument.set(args, new ArgumentPosition.Simple(1, ArgumentMode.SIMPLE), ONE);

        assertEquals(2, args.size());
        assertEquals(new Argument.Simple(ONE), args.get(0).close());
        assertEquals(new Argument.Simple(TWO), args.get(1).close());
    }

    @Test
    void leavesEarlierSlotsOpen() {
        List<OpenArgument> args = new ArrayList<>();
        OpenArgument.set(args, new ArgumentPosition.Simple(3, ArgumentMode.SIMPLE), ONE);
        assertEquals(3, args.size());
        assertNull(args.get(0));
        assertNull(args.get(1));
    }

    @Test
    void acceptsTheSameTermTwice() {
        List<OpenArgument> args = new ArrayList<>();
        var position = new ArgumentPosition.Simple(1, ArgumentMode.SIMPLE);
        OpenArgument.set(args, position, ONE);
        OpenArgument.set(args, position, new Term.Symbol(symbol("one")));
        assertEquals(new Argument.Simple(ONE), args.get(0).close());
    }

    @Test
    void rejectsADifferentTermForAFilledSlot() {
        List<OpenArgument> args = new ArrayList<>();
        var position = new ArgumentPosition.Simple(1, ArgumentMode.SIMPLE);
        OpenArgument.set(args, position, ONE);
        var ex = assertThrows(FtmlExtractionException.class, () -> OpenArgument.set(args, position, TWO));
        assertEquals(FtmlErrorKind.MISMATCHED_ARGUMENT, ex.kind());
    }

    @Test
    void assemblesSequencesByIndex() {
        List<OpenArgument> args = new ArrayList<>();
        OpenArgument.set(args, new ArgumentPosition.Sequence(1, 2, ArgumentMode.SEQUENCE), TWO);
        assertNull(args.get(0).close());

        OpenArgument.set(args, new ArgumentPosition.Sequence(1, 1, ArgumentMode.SEQUENCE), ONE);
        assertEquals(new Argument.Sequence(List.of(ONE, TWO)), args.get(0).close());
    }

    @Test
    void wholeSequenceTermFillsTheSlot() {
        List<OpenArgument> args = new ArrayList<>();
        OpenArgument.set(args, new ArgumentPosition.Simple(1, ArgumentMode.SEQUENCE), ONE);
        assertEquals(new Argument.SequenceTerm(ONE), args.get(0).close());

        var ex = assertThrows(FtmlExtractionException.class,
            () -> OpenArgument.set(args, new ArgumentPosition.Sequence(1, 1, ArgumentMode.SEQUENCE), ONE));
        assertEquals(FtmlErrorKind.MISMATCHED_ARGUMENT, ex.kind());
    }
}
