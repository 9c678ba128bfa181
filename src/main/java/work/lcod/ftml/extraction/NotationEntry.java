package work.lcod.ftml.extraction;

import work.lcod.ftml.model.notation.Notation;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.FtmlUri;

/**
 * A notation found in the document; {@code leaf} is the symbol or variable declaration it is for.
 */
public record NotationEntry(FtmlUri leaf, DocumentElementUri uri, Notation notation) {}
