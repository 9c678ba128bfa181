package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Optional;
import work.lcod.ftml.uri.UriNames;

/**
 * A paragraph style, written {@code kind} or {@code kind-name}, optionally numbered by a counter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentStyle(ParagraphKind kind, String name, String counter) {
    public static Optional<DocumentStyle> parse(String value) {
        String v = value.trim();
        int dash = v.indexOf('-');
        String kind = dash < 0 ? v : v.substring(0, dash);
        String name = dash < 0 ? null : v.substring(dash + 1);
        if (name != null && !UriNames.isId(name)) {
            return Optional.empty();
        }
        return ParagraphKind.parse(kind).map(k -> new DocumentStyle(k, name, null));
    }

    public DocumentStyle withCounter(String counterName) {
        return new DocumentStyle(kind, name, counterName);
    }
}
