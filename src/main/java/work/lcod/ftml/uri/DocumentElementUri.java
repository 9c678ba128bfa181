package work.lcod.ftml.uri;

import java.util.Objects;

public record DocumentElementUri(DocumentUri document, String name) implements NarrativeUri {
    public DocumentElementUri {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(name, "name");
    }

    public static DocumentElementUri parse(String value) throws UriParseException {
        if (UriParser.parse(value) instanceof DocumentElementUri uri) {
            return uri;
        }
        throw new UriParseException("not a document element uri: " + value);
    }

    @Override
    public DocumentElementUri element(String child) {
        return new DocumentElementUri(document, name + "/" + child);
    }

    public String lastName() {
        return UriNames.lastSegment(name);
    }

    @Override
    public String toString() {
        return document + "&e=" + name;
    }
}
