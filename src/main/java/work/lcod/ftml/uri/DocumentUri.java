package work.lcod.ftml.uri;

import java.util.Objects;

public record DocumentUri(PathUri path, String name, String language) implements NarrativeUri {
    public DocumentUri {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(language, "language");
    }

    public static DocumentUri parse(String value) throws UriParseException {
        if (UriParser.parse(value) instanceof DocumentUri uri) {
            return uri;
        }
        throw new UriParseException("not a document uri: " + value);
    }

    @Override
    public DocumentUri document() {
        return this;
    }

    @Override
    public DocumentElementUri element(String elementName) {
        return new DocumentElementUri(this, elementName);
    }

    /** A module declared at the top level of this document, living next to it in the archive. */
    public ModuleUri module(String moduleName) throws UriParseException {
        return new ModuleUri(path, UriNames.requireName(moduleName, "module"));
    }

    @Override
    public String toString() {
        return path + "&d=" + name + "&l=" + language;
    }
}
