package work.lcod.ftml.uri;

/**
 * A document or an element inside one; new element uris are derived from either.
 */
public sealed interface NarrativeUri extends FtmlUri permits DocumentUri, DocumentElementUri {
    DocumentUri document();

    DocumentElementUri element(String name);
}
