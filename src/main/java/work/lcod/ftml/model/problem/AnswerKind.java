package work.lcod.ftml.model.problem;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Optional;

/**
 * Points of an answer class: an absolute value replaces the score, a trait ({@code +n} / {@code -n}) adjusts it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
public sealed interface AnswerKind {
    record Absolute(float points) implements AnswerKind {}

    record Trait(float points) implements AnswerKind {}

    AnswerKind DEFAULT = new Trait(0.0f);

    public static Optional<AnswerKind> parse(String value) {
        String v = value.trim();
        if (v.startsWith("+")) {
            return number(v.substring(1)).map(Trait::new);
        }
        if (v.startsWith("-")) {
            return number(v.substring(1)).map(f -> new Trait(-f));
        }
        return number(v).map(Absolute::new);
    }

    private static Optional<Float> number(String s) {
        try {
            if (s.contains(".")) {
                return Optional.of(Float.parseFloat(s));
            }
            return Optional.of((float) Integer.parseInt(s));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
