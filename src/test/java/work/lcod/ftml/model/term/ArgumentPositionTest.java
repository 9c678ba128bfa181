package work.lcod.ftml.model.term;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ArgumentPositionTest {
    @Test
    void singleDigitIsAWholePosition() {
        assertEquals(Optional.of(new ArgumentPosition.Simple(3, ArgumentMode.SIMPLE)), ArgumentPosition.parse("3", null));
        assertEquals(2, ArgumentPosition.parse("3", ArgumentMode.SEQUENCE).orElseThrow().index());
    }

    @Test
    void trailingDigitsIndexIntoTheSequence() {
        assertEquals(Optional.of(new ArgumentPosition.Sequence(1, 12, ArgumentMode.SEQUENCE)),
            ArgumentPosition.parse("112", ArgumentMode.SEQUENCE));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertTrue(ArgumentPosition.parse("", null).isEmpty());
        assertTrue(ArgumentPosition.parse("0", null).isEmpty());
        assertTrue(ArgumentPosition.parse("x", null).isEmpty());
        assertTrue(ArgumentPosition.parse("10", null).isEmpty());
        assertTrue(ArgumentPosition.parse("1256", null).isEmpty());
    }

    @Test
    void modesHaveSingleLetterCodes() {
        assertEquals(Optional.of(ArgumentMode.BOUND_VARIABLE_SEQUENCE), ArgumentMode.parse("B"));
        assertEquals(Optional.of(ArgumentMode.BOUND_VARIABLE), ArgumentMode.parse("b"));
        assertTrue(ArgumentMode.parse("ab").isEmpty());
        assertTrue(ArgumentMode.SEQUENCE.isSequence());
        assertTrue(ArgumentMode.BOUND_VARIABLE.isBound());
    }
}
