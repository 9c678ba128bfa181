package work.lcod.ftml.uri;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the query-style uri syntax: {@code base?a=..[&p=..](&d=..&l=..[&e=..] | &m=..[&s=..])}.
 */
public final class UriParser {
    private static final List<String> ORDER = List.of("a", "p", "d", "l", "e", "m", "s");

    private UriParser() {}

    public static FtmlUri parse(String value) throws UriParseException {
        if (value == null) {
            throw new UriParseException("empty uri");
        }
        String trimmed = value.trim();
        int q = trimmed.indexOf('?');
        if (q <= 0) {
            throw new UriParseException("missing base in uri: " + value);
        }
        String base = trimmed.substring(0, q);
        Map<String, String> parts = new LinkedHashMap<>();
        int lastIndex = -1;
        for (String component : trimmed.substring(q + 1).split("&", -1)) {
            int eq = component.indexOf('=');
            if (eq < 0) {
                throw new UriParseException("malformed uri component '" + component + "' in " + value);
            }
            String key = component.substring(0, eq);
            int index = ORDER.indexOf(key);
            if (index < 0 || index <= lastIndex || parts.containsKey(key)) {
                throw new UriParseException("unexpected uri component '" + key + "' in " + value);
            }
            lastIndex = index;
            parts.put(key, component.substring(eq + 1));
        }
        String archive = parts.get("a");
        if (archive == null || !UriNames.isName(archive)) {
            throw new UriParseException("missing or invalid archive in uri: " + value);
        }
        String p = parts.get("p");
        if (p != null) {
            UriNames.requireName(p, "path");
        }
        var path = new PathUri(base, archive, p);
        if (parts.containsKey("d")) {
            if (parts.containsKey("m") || parts.containsKey("s")) {
                throw new UriParseException("document uri with module component: " + value);
            }
            String lang = parts.get("l");
            if (lang == null || lang.isEmpty()) {
                throw new UriParseException("document uri without language: " + value);
            }
            var doc = new DocumentUri(path, UriNames.requireId(parts.get("d"), "document"), lang);
            String element = parts.get("e");
            return element == null ? doc : new DocumentElementUri(doc, UriNames.requireName(element, "element"));
        }
        if (parts.containsKey("l") || parts.containsKey("e")) {
            throw new UriParseException("element or language component without document: " + value);
        }
        if (parts.containsKey("m")) {
            var module = new ModuleUri(path, UriNames.requireName(parts.get("m"), "module"));
            String symbol = parts.get("s");
            return symbol == null ? module : new SymbolUri(module, UriNames.requireName(symbol, "symbol"));
        }
        if (parts.containsKey("s")) {
            throw new UriParseException("symbol component without module: " + value);
        }
        return path;
    }
}
