package work.lcod.ftml.uri;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Any uri addressing an archive location, document, module, symbol or document element.
 */
public sealed interface FtmlUri extends Comparable<FtmlUri>
    permits PathUri, NarrativeUri, ModuleUri, SymbolUri {

    @JsonValue
    String toString();

    @Override
    default int compareTo(FtmlUri other) {
        return toString().compareTo(other.toString());
    }
}
