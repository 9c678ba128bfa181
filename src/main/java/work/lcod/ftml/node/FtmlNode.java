package work.lcod.ftml.node;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The tree capabilities the extractor needs from an element of the source document.
 */
public interface FtmlNode {
    String tagName();

    /** All child nodes in document order; indices match {@link #pathFrom(FtmlNode)}. */
    List<NodeChild> children();

    /** Attributes in document order. */
    Map<String, String> attributes();

    Optional<String> attribute(String name);

    void setAttribute(String name, String value);

    Optional<String> removeAttribute(String name);

    /** Verbatim markup of the node itself. */
    String string();

    /** Markup of the node's children. */
    String innerString();

    SourceRange range();

    SourceRange innerRange();

    /**
     * Child indices leading from {@code ancestor} down to this node; empty when both are the same node.
     *
     * @throws IllegalArgumentException if this node is not inside {@code ancestor}
     */
    List<Integer> pathFrom(FtmlNode ancestor);

    /** Detaches the node from the output tree. */
    void delete();

    boolean sameNode(FtmlNode other);
}
