package work.lcod.ftml.model.narrative;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum ParagraphKind {
    DEFINITION,
    ASSERTION,
    PARAGRAPH,
    PROOF,
    SUBPROOF,
    EXAMPLE;

    /** The lowercase name used in attributes and as uri prefix. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Definitions, assertions and proofs define their subjects; other kinds only when styled as such. */
    public boolean isDefinitionLike(List<String> styles) {
        switch (this) {
            case DEFINITION:
            case ASSERTION:
            case PROOF:
            case SUBPROOF:
                return true;
            default:
                return styles.stream().anyMatch(s -> s.equals("symdoc") || s.equals("decl"));
        }
    }

    public static Optional<ParagraphKind> parse(String value) {
        for (ParagraphKind kind : values()) {
            if (kind.key().equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
