package work.lcod.ftml.uri;

import java.util.Objects;
import java.util.Optional;

/**
 * A module; nested modules use a {@code /}-separated name.
 */
public record ModuleUri(PathUri path, String name) implements FtmlUri {
    public ModuleUri {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
    }

    public static ModuleUri parse(String value) throws UriParseException {
        if (UriParser.parse(value) instanceof ModuleUri uri) {
            return uri;
        }
        throw new UriParseException("not a module uri: " + value);
    }

    public boolean isTop() {
        return name.indexOf('/') < 0;
    }

    public String lastName() {
        return UriNames.lastSegment(name);
    }

    public ModuleUri child(String childName) throws UriParseException {
        return new ModuleUri(path, name + "/" + UriNames.requireName(childName, "module"));
    }

    public SymbolUri symbol(String symbolName) throws UriParseException {
        return new SymbolUri(this, UriNames.requireName(symbolName, "symbol"));
    }

    /** The symbol naming a nested module inside its parent; empty for top-level modules. */
    public Optional<SymbolUri> asSymbol() {
        int idx = name.lastIndexOf('/');
        if (idx < 0) {
            return Optional.empty();
        }
        return Optional.of(new SymbolUri(new ModuleUri(path, name.substring(0, idx)), name.substring(idx + 1)));
    }

    @Override
    public String toString() {
        return path + "&m=" + name;
    }
}
