package work.lcod.ftml.model.problem;

import java.util.Optional;

/**
 * Bloom-style dimension of a learning objective or precondition.
 */
public enum CognitiveDimension {
    REMEMBER,
    UNDERSTAND,
    APPLY,
    ANALYZE,
    EVALUATE,
    CREATE;

    public static Optional<CognitiveDimension> parse(String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("analyse")) {
            return Optional.of(ANALYZE);
        }
        for (CognitiveDimension dim : values()) {
            if (dim.name().equalsIgnoreCase(v)) {
                return Optional.of(dim);
            }
        }
        return Optional.empty();
    }
}
