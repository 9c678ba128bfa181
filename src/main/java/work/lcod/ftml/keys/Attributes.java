package work.lcod.ftml.keys;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import work.lcod.ftml.extraction.ExtractorState;
import work.lcod.ftml.extraction.FtmlExtractionException;
import work.lcod.ftml.model.term.VarOrSym;
import work.lcod.ftml.model.term.Variable;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.FtmlUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;
import work.lcod.ftml.uri.UriNames;
import work.lcod.ftml.uri.UriParseException;
import work.lcod.ftml.uri.UriParser;

/**
 * Typed access to the {@code data-ftml-*} attributes of the node being handled. The {@code take}
 * variants also remove the attribute from the output markup.
 *
 * <p>Required readers fail with {@code MissingKey} for absent or blank values and with
 * {@code InvalidValue} / {@code InvalidUri} for values that do not parse. Optional readers only
 * treat absence as "not given".
 */
public final class Attributes {
    private static final Pattern LANGUAGE = Pattern.compile("[a-z]{2,3}");

    @FunctionalInterface
    public interface UriReader<T> {
        T read(String value) throws UriParseException;
    }

    private final FtmlNode node;
    private final ExtractorState state;

    public Attributes(FtmlNode node, ExtractorState state) {
        this.node = node;
        this.state = state;
    }

    public FtmlNode node() {
        return node;
    }

    public Optional<String> value(FtmlKey key) {
        return node.attribute(key.attributeName());
    }

    public void set(FtmlKey key, String value) {
        node.setAttribute(key.attributeName(), value);
    }

    public Optional<String> take(FtmlKey key) {
        return node.removeAttribute(key.attributeName());
    }

    private static Optional<String> trimmed(Optional<String> raw) {
        return raw.map(String::trim).filter(v -> !v.isEmpty());
    }

    public String string(FtmlKey key) {
        return trimmed(value(key)).orElseThrow(() -> FtmlExtractionException.missingKey(key));
    }

    public Optional<String> optional(FtmlKey key) {
        return trimmed(value(key));
    }

    public Optional<String> takeOptional(FtmlKey key) {
        return trimmed(take(key));
    }

    // ---- typed values

    public <T> T typed(FtmlKey key, Function<String, Optional<T>> parser) {
        return parser.apply(string(key)).orElseThrow(() -> FtmlExtractionException.invalidValue(key));
    }

    public <T> Optional<T> optionalTyped(FtmlKey key, Function<String, Optional<T>> parser) {
        return optional(key).map(v -> parser.apply(v).orElseThrow(() -> FtmlExtractionException.invalidValue(key)));
    }

    public <T> Optional<T> takeTyped(FtmlKey key, Function<String, Optional<T>> parser) {
        return takeOptional(key).map(v -> parser.apply(v).orElseThrow(() -> FtmlExtractionException.invalidValue(key)));
    }

    /** Comma separated values; blank entries are skipped and an absent attribute is an empty list. */
    public <T> List<T> typedList(FtmlKey key, Function<String, Optional<T>> parser) {
        List<T> result = new ArrayList<>();
        Optional<String> raw = optional(key);
        if (raw.isEmpty()) {
            return result;
        }
        for (String part : raw.get().split(",")) {
            String v = part.trim();
            if (v.isEmpty()) {
                continue;
            }
            result.add(parser.apply(v).orElseThrow(() -> FtmlExtractionException.invalidValue(key)));
        }
        return result;
    }

    public List<String> stringList(FtmlKey key) {
        return typedList(key, Optional::of);
    }

    public boolean bool(FtmlKey key) {
        return value(key).map(v -> "true".equals(v.trim())).orElse(false);
    }

    public boolean takeBool(FtmlKey key) {
        return take(key).map(v -> "true".equals(v.trim())).orElse(false);
    }

    public String language(FtmlKey key) {
        String v = string(key);
        if (!LANGUAGE.matcher(v).matches()) {
            throw FtmlExtractionException.invalidLanguage(key, v);
        }
        return v;
    }

    public Optional<String> takeLanguage(FtmlKey key) {
        Optional<String> v = takeOptional(key);
        v.ifPresent(l -> {
            if (!LANGUAGE.matcher(l).matches()) {
                throw FtmlExtractionException.invalidLanguage(key, l);
            }
        });
        return v;
    }

    // ---- uris

    private static <T> T parseUri(FtmlKey key, String value, UriReader<T> reader) {
        try {
            return reader.read(value);
        } catch (UriParseException ex) {
            throw FtmlExtractionException.invalidUri(key, ex.getMessage());
        }
    }

    public <T> T uri(FtmlKey key, UriReader<T> reader) {
        return parseUri(key, string(key), reader);
    }

    public <T> T takeUri(FtmlKey key, UriReader<T> reader) {
        String v = takeOptional(key).orElseThrow(() -> FtmlExtractionException.missingKey(key));
        return parseUri(key, v, reader);
    }

    public <T> Optional<T> optionalUri(FtmlKey key, UriReader<T> reader) {
        return optional(key).map(v -> parseUri(key, v, reader));
    }

    public <T> Optional<T> takeOptionalUri(FtmlKey key, UriReader<T> reader) {
        return takeOptional(key).map(v -> parseUri(key, v, reader));
    }

    public DocumentUri documentUri(FtmlKey key) {
        return uri(key, DocumentUri::parse);
    }

    public ModuleUri moduleUri(FtmlKey key) {
        return uri(key, ModuleUri::parse);
    }

    public ModuleUri takeModuleUri(FtmlKey key) {
        return takeUri(key, ModuleUri::parse);
    }

    public SymbolUri symbolUri(FtmlKey key) {
        return uri(key, SymbolUri::parse);
    }

    public SymbolUri takeSymbolUri(FtmlKey key) {
        return takeUri(key, SymbolUri::parse);
    }

    /** Accepts a module or a symbol uri; a symbol names the module it stands for. */
    public ModuleUri takeSymbolOrModuleUri(FtmlKey key) {
        FtmlUri uri = takeUri(key, UriParser::parse);
        if (uri instanceof ModuleUri m) {
            return m;
        }
        if (uri instanceof SymbolUri s) {
            return s.asModule();
        }
        throw FtmlExtractionException.invalidValue(key);
    }

    /** A module named relative to the enclosing module, or to the document at the top level. */
    public ModuleUri takeNewModuleUri(FtmlKey key) {
        String v = takeOptional(key).orElseThrow(() -> FtmlExtractionException.missingKey(key));
        return parseUri(key, v, state::newModuleUri);
    }

    public SymbolUri newSymbolUri(FtmlKey key, FtmlKey inElement) {
        String v = string(key);
        ModuleUri module = state.domainModule(inElement);
        return parseUri(key, v, module::symbol);
    }

    public SymbolUri takeNewSymbolUri(FtmlKey key, FtmlKey inElement) {
        String v = takeOptional(key).orElseThrow(() -> FtmlExtractionException.missingKey(key));
        ModuleUri module = state.domainModule(inElement);
        return parseUri(key, v, module::symbol);
    }

    /** The element's explicit id, or a fresh one, placed under the current narrative uri. */
    public DocumentElementUri elementUriFromId(String prefix) {
        String id;
        Optional<String> explicit = optional(FtmlKey.ID);
        if (explicit.isPresent()) {
            id = explicit.get();
            if (!UriNames.isId(id)) {
                throw FtmlExtractionException.invalidValue(FtmlKey.ID);
            }
        } else {
            id = state.newId(prefix);
        }
        return state.narrativeUri().element(id);
    }

    /**
     * A head reference: full uris name symbols (or variables, for element uris); plain names are
     * resolved against the variables in scope.
     */
    public VarOrSym symbolOrVar(FtmlKey key) {
        String head = string(key);
        if (head.contains("?")) {
            FtmlUri uri = parseUri(key, head, UriParser::parse);
            if (uri instanceof SymbolUri s) {
                return new VarOrSym.Sym(s);
            }
            if (uri instanceof ModuleUri m) {
                return new VarOrSym.Sym(m.asSymbol().orElseThrow(() -> FtmlExtractionException.invalidValue(key)));
            }
            if (uri instanceof DocumentElementUri e) {
                return new VarOrSym.Var(new Variable.Ref(e, null));
            }
            throw FtmlExtractionException.invalidValue(key);
        }
        if (!UriNames.isName(head)) {
            throw FtmlExtractionException.invalidValue(key);
        }
        return new VarOrSym.Var(state.resolveVariableName(head));
    }
}
