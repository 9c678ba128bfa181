package work.lcod.ftml.model.term;

import java.util.Optional;

/**
 * Where an argument term goes: a whole position, or one index inside a sequence position. Numbers are 1-based.
 */
public sealed interface ArgumentPosition {
    ArgumentMode mode();

    /** 1-based argument number. */
    int argumentNumber();

    /** 0-based slot index. */
    default int index() {
        return argumentNumber() - 1;
    }

    record Simple(int argumentNumber, ArgumentMode mode) implements ArgumentPosition {}

    record Sequence(int argumentNumber, int sequenceIndex, ArgumentMode mode) implements ArgumentPosition {}

    /**
     * Parses the value of an {@code arg} attribute: a single digit is a whole position, a longer
     * value is the argument digit followed by the 1-based index inside the sequence.
     */
    public static Optional<ArgumentPosition> parse(String value, ArgumentMode mode) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        ArgumentMode m = mode == null ? ArgumentMode.SIMPLE : mode;
        int argument = Character.digit(value.charAt(0), 10);
        if (argument <= 0) {
            return Optional.empty();
        }
        if (value.length() == 1) {
            return Optional.of(new Simple(argument, m));
        }
        try {
            int sequenceIndex = Integer.parseInt(value.substring(1));
            if (sequenceIndex <= 0 || sequenceIndex > 255) {
                return Optional.empty();
            }
            return Optional.of(new Sequence(argument, sequenceIndex, m));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
