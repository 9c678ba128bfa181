package work.lcod.ftml.model.domain;

import java.util.Optional;

public enum AssocType {
    LEFT_ASSOCIATIVE_BINARY,
    RIGHT_ASSOCIATIVE_BINARY,
    CONJUNCTIVE,
    PAIRWISE_CONJUNCTIVE,
    PRENEX;

    public static Optional<AssocType> parse(String value) {
        switch (value.trim()) {
            case "binl":
            case "bin":
                return Optional.of(LEFT_ASSOCIATIVE_BINARY);
            case "binr":
                return Optional.of(RIGHT_ASSOCIATIVE_BINARY);
            case "conj":
                return Optional.of(CONJUNCTIVE);
            case "pwconj":
                return Optional.of(PAIRWISE_CONJUNCTIVE);
            case "pre":
                return Optional.of(PRENEX);
            default:
                return Optional.empty();
        }
    }
}
