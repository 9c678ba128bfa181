package work.lcod.ftml.model.narrative;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import work.lcod.ftml.model.DataRef;
import work.lcod.ftml.model.problem.ProblemData;
import work.lcod.ftml.node.SourceRange;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;

/**
 * A finished element of the document tree.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "type")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface DocumentElement {
    record UseModule(ModuleUri uri, SourceRange source) implements DocumentElement {}

    record Module(SourceRange range, ModuleUri module, List<DocumentElement> children) implements DocumentElement {
        public Module {
            children = List.copyOf(children);
        }
    }

    record MathStructure(SourceRange range, SymbolUri structure, List<DocumentElement> children)
        implements DocumentElement {
        public MathStructure {
            children = List.copyOf(children);
        }
    }

    record Extension(SourceRange range, SymbolUri extension, SymbolUri target, List<DocumentElement> children)
        implements DocumentElement {
        public Extension {
            children = List.copyOf(children);
        }
    }

    record Morphism(SourceRange range, SymbolUri morphism, List<DocumentElement> children) implements DocumentElement {
        public Morphism {
            children = List.copyOf(children);
        }
    }

    record SymbolDeclaration(SymbolUri uri) implements DocumentElement {}

    record ImportModule(ModuleUri uri) implements DocumentElement {}

    record Section(DocumentElementUri uri, SourceRange range, String title, List<DocumentElement> children)
        implements DocumentElement {
        public Section {
            children = List.copyOf(children);
        }
    }

    record SkipSection(List<DocumentElement> children) implements DocumentElement {
        public SkipSection {
            children = List.copyOf(children);
        }
    }

    record Paragraph(LogicalParagraph paragraph) implements DocumentElement {}

    record Problem(DocumentElementUri uri, SourceRange range, List<DocumentElement> children, ProblemData data)
        implements DocumentElement {
        public Problem {
            children = List.copyOf(children);
        }
    }

    record Slide(SourceRange range, DocumentElementUri uri, String title, List<DocumentElement> children)
        implements DocumentElement {
        public Slide {
            children = List.copyOf(children);
        }
    }

    record DocumentReference(DocumentElementUri uri, DocumentUri target, SourceRange source) implements DocumentElement {}

    record Notation(SymbolUri symbol, DocumentElementUri uri, DataRef notation) implements DocumentElement {}

    record VariableDeclaration(DocumentElementUri uri, VariableData data) implements DocumentElement {}

    record VariableNotation(DocumentElementUri variable, DocumentElementUri uri, DataRef notation)
        implements DocumentElement {}

    record Definiendum(SourceRange range, SymbolUri uri) implements DocumentElement {}

    record SymbolReference(SourceRange range, SymbolUri uri, String notation, SourceRange source)
        implements DocumentElement {}

    record VariableReference(SourceRange range, DocumentElementUri uri, String notation, SourceRange source)
        implements DocumentElement {}

    record Term(DocumentElementUri uri, work.lcod.ftml.model.term.Term term, SourceRange source)
        implements DocumentElement {}

    /** The children of container elements; empty for leaves. */
    default List<DocumentElement> children() {
        return List.of();
    }
}
