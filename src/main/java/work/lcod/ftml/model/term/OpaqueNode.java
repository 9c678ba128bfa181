package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Map;

/**
 * Markup kept verbatim inside an {@link Term.Opaque} term.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "kind")
public sealed interface OpaqueNode {
    record Text(String text) implements OpaqueNode {}

    record Element(String tag, Map<String, String> attributes, List<OpaqueNode> children) implements OpaqueNode {
        public Element {
            attributes = Map.copyOf(attributes);
            children = List.copyOf(children);
        }
    }

    /** Placeholder for the {@code index}-th sub-term of the enclosing opaque term. */
    record TermRef(int index) implements OpaqueNode {}
}
