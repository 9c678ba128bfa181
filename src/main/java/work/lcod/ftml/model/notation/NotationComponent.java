package work.lcod.ftml.model.notation;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Map;
import work.lcod.ftml.model.term.ArgumentMode;

/**
 * One node of a notation template. Sub-components are addressed by their child index path
 * relative to the notation's own node, so the template can be replayed against other markup.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
public sealed interface NotationComponent {
    record Text(String text) implements NotationComponent {}

    record Node(String tag, Map<String, String> attributes, List<NotationComponent> children)
        implements NotationComponent {
        public Node {
            attributes = Map.copyOf(attributes);
            children = List.copyOf(children);
        }
    }

    /** Placeholder for argument {@code index} (1-based). */
    record Argument(int index, ArgumentMode mode) implements NotationComponent {}

    /** A sequence argument together with the separator placed between its elements. */
    record ArgSep(int index, ArgumentMode mode, List<NotationComponent> separator) implements NotationComponent {
        public ArgSep {
            separator = List.copyOf(separator);
        }
    }

    /** A presentation of the notation's head. */
    record Comp(Node node) implements NotationComponent {}

    /** The principal presentation of the notation's head. */
    record MainComp(Node node) implements NotationComponent {}
}
