package work.lcod.ftml.model.problem;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One accepted (or explicitly rejected) answer of a fill-in-the-blank block.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface FillInSolOption {
    boolean verdict();

    String feedback();

    FillInSolOption withFeedback(String feedback);

    record Exact(String value, boolean verdict, String feedback) implements FillInSolOption {
        @Override
        public FillInSolOption withFeedback(String text) {
            return new Exact(value, verdict, text);
        }
    }

    /** Open bounds are null. */
    record NumericalRange(Float from, Float to, boolean verdict, String feedback) implements FillInSolOption {
        @Override
        public FillInSolOption withFeedback(String text) {
            return new NumericalRange(from, to, verdict, text);
        }
    }

    record Regex(String regex, boolean verdict, String feedback) implements FillInSolOption {
        @Override
        public FillInSolOption withFeedback(String text) {
            return new Regex(regex, verdict, text);
        }
    }

    /**
     * Builds an option from the case attributes: kind {@code exact}, {@code numrange}
     * ({@code from-to}, {@code -to}, {@code to}, either bound may be a decimal) or {@code regex}.
     */
    public static Optional<FillInSolOption> fromValues(String kind, String value, boolean verdict) {
        switch (kind) {
            case "exact":
                return Optional.of(new Exact(value, verdict, ""));
            case "numrange":
                return numericalRange(value, verdict);
            case "regex":
                try {
                    Pattern.compile(value);
                } catch (PatternSyntaxException ex) {
                    return Optional.empty();
                }
                return Optional.of(new Regex(value, verdict, ""));
            default:
                return Optional.empty();
        }
    }

    private static Optional<FillInSolOption> numericalRange(String value, boolean verdict) {
        boolean negative = value.startsWith("-");
        String s = negative ? value.substring(1) : value;
        int dash = s.indexOf('-');
        String from = dash < 0 ? "" : s.substring(0, dash);
        String to = dash < 0 ? s : s.substring(dash + 1);
        Optional<Optional<Float>> lower = bound(from);
        Optional<Optional<Float>> upper = bound(to);
        if (lower.isEmpty() || upper.isEmpty()) {
            return Optional.empty();
        }
        Float f = lower.get().orElse(null);
        if (negative && f != null) {
            f = -f;
        }
        return Optional.of(new NumericalRange(f, upper.get().orElse(null), verdict, ""));
    }

    /** Empty outer optional on a malformed bound, empty inner optional on an open bound. */
    private static Optional<Optional<Float>> bound(String s) {
        if (s.isEmpty()) {
            return Optional.of(Optional.empty());
        }
        try {
            if (s.contains(".")) {
                return Optional.of(Optional.of(Float.parseFloat(s)));
            }
            return Optional.of(Optional.of((float) Long.parseLong(s)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
