package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * How an argument position is filled: one term, a sequence, a bound variable or a sequence of them.
 */
public enum ArgumentMode {
    SIMPLE('i'),
    SEQUENCE('a'),
    BOUND_VARIABLE('b'),
    BOUND_VARIABLE_SEQUENCE('B');

    private final char code;

    ArgumentMode(char code) {
        this.code = code;
    }

    @JsonValue
    public char code() {
        return code;
    }

    public boolean isSequence() {
        return this == SEQUENCE || this == BOUND_VARIABLE_SEQUENCE;
    }

    public boolean isBound() {
        return this == BOUND_VARIABLE || this == BOUND_VARIABLE_SEQUENCE;
    }

    public static Optional<ArgumentMode> fromCode(char c) {
        for (ArgumentMode mode : values()) {
            if (mode.code == c) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    public static Optional<ArgumentMode> parse(String value) {
        if (value == null || value.length() != 1) {
            return Optional.empty();
        }
        return fromCode(value.charAt(0));
    }
}
