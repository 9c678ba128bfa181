package work.lcod.ftml.node;

/**
 * One child of a node: an element, a text run, or anything else (comments, data).
 */
public sealed interface NodeChild {
    record Element(FtmlNode node) implements NodeChild {}

    record Text(String text) implements NodeChild {}

    record Other(String markup) implements NodeChild {}
}
