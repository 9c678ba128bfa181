package work.lcod.ftml.extraction;

import work.lcod.ftml.model.narrative.DocumentCounter;
import work.lcod.ftml.model.narrative.DocumentKind;
import work.lcod.ftml.model.narrative.DocumentStyle;
import work.lcod.ftml.model.narrative.SectionLevel;
import work.lcod.ftml.model.problem.CognitiveDimension;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;

/**
 * Directives applied to the state immediately, without opening a frame.
 */
public sealed interface MetaDatum {
    record Style(DocumentStyle style) implements MetaDatum {}

    record Counter(DocumentCounter counter) implements MetaDatum {}

    record InputRef(DocumentUri target, DocumentElementUri uri) implements MetaDatum {}

    record IfInputref(boolean value) implements MetaDatum {}

    record SetSectionLevel(SectionLevel level) implements MetaDatum {}

    record ImportModule(ModuleUri uri) implements MetaDatum {}

    record UseModule(ModuleUri uri) implements MetaDatum {}

    /** {@code name} and {@code macroname} may be null. */
    record Rename(SymbolUri source, String name, String macroname) implements MetaDatum {}

    record Kind(DocumentKind kind) implements MetaDatum {}

    record Uri(DocumentUri uri) implements MetaDatum {}

    record Precondition(SymbolUri symbol, CognitiveDimension dimension) implements MetaDatum {}

    record Objective(SymbolUri symbol, CognitiveDimension dimension) implements MetaDatum {}

    record AnswerClassFeedback() implements MetaDatum {}

    record ProofBody() implements MetaDatum {}
}
