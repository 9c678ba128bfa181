package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.ftml.uri.DocumentUri;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Document(
    DocumentUri uri,
    String title,
    DocumentKind kind,
    SectionLevel topSectionLevel,
    DocumentStyles styles,
    List<DocumentElement> elements
) {
    public Document {
        elements = List.copyOf(elements);
    }
}
