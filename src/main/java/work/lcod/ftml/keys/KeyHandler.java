package work.lcod.ftml.keys;

import work.lcod.ftml.extraction.ExtractorState;
import work.lcod.ftml.node.FtmlNode;

/**
 * Interprets one FTML key on a node.
 */
@FunctionalInterface
public interface KeyHandler {
    KeyResult handle(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node);
}
