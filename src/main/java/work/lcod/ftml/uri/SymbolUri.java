package work.lcod.ftml.uri;

import java.util.Objects;

public record SymbolUri(ModuleUri module, String name) implements FtmlUri {
    public SymbolUri {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(name, "name");
    }

    public static SymbolUri parse(String value) throws UriParseException {
        if (UriParser.parse(value) instanceof SymbolUri uri) {
            return uri;
        }
        throw new UriParseException("not a symbol uri: " + value);
    }

    /** The module a structure or nested module symbol stands for. */
    public ModuleUri asModule() {
        return new ModuleUri(module.path(), module.name() + "/" + name);
    }

    public String lastName() {
        return UriNames.lastSegment(name);
    }

    @Override
    public String toString() {
        return module + "&s=" + name;
    }
}
