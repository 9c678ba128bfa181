package work.lcod.ftml.model.notation;

import java.util.List;

/**
 * A notation for a symbol or variable; {@code id} is null for the default notation.
 */
public record Notation(
    String id,
    long precedence,
    List<Long> argumentPrecedences,
    NotationComponent component,
    NotationComponent.Node op
) {
    public Notation {
        argumentPrecedences = List.copyOf(argumentPrecedences);
    }
}
