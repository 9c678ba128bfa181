package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.uri.SymbolUri;

/**
 * A symbol a paragraph is about, with the definiens the paragraph gives it, if any.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForEntry(SymbolUri symbol, Term term) {}
