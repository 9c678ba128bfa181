package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.ftml.node.SourceRange;
import work.lcod.ftml.uri.DocumentElementUri;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogicalParagraph(
    ParagraphKind kind,
    DocumentElementUri uri,
    ParagraphFormatting formatting,
    SourceRange range,
    String title,
    List<String> styles,
    List<DocumentElement> children,
    List<ForEntry> fors,
    SourceRange source
) {
    public LogicalParagraph {
        styles = List.copyOf(styles);
        children = List.copyOf(children);
        fors = List.copyOf(fors);
    }
}
