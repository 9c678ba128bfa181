package work.lcod.ftml.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.ftml.node.SourceRange;
import work.lcod.ftml.uri.ModuleUri;

/**
 * A top-level module with its declarations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModuleData(
    ModuleUri uri,
    ModuleUri meta,
    String signature,
    List<Declaration> declarations,
    SourceRange source
) {
    public ModuleData {
        declarations = List.copyOf(declarations);
    }
}
