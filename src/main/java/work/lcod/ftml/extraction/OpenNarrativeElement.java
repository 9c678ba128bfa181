package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.List;
import work.lcod.ftml.model.DataRef;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.narrative.ForEntry;
import work.lcod.ftml.model.narrative.ParagraphFormatting;
import work.lcod.ftml.model.narrative.ParagraphKind;
import work.lcod.ftml.model.notation.NotationComponent;
import work.lcod.ftml.model.problem.AnswerKind;
import work.lcod.ftml.model.problem.Choice;
import work.lcod.ftml.model.problem.ChoiceBlockStyle;
import work.lcod.ftml.model.problem.DimensionedSymbol;
import work.lcod.ftml.model.problem.FillInSolOption;
import work.lcod.ftml.model.problem.SolutionData;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.VarOrSym;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;

/**
 * Frames of the narrative stack: document structure, notations and problem parts.
 */
public sealed interface OpenNarrativeElement {

    /** Frames that receive finished document elements. */
    interface Container {
        List<DocumentElement> children();
    }

    /** Frames that take at most one title. */
    interface Titled {
        String title();

        void title(String title);
    }

    /** Frames that collect notation components by path below their own node. */
    interface ComponentCollector {
        List<PathedComponent> components();

        FtmlNode node();
    }

    record Module(ModuleUri uri, List<DocumentElement> children) implements OpenNarrativeElement, Container {
        public Module(ModuleUri uri) {
            this(uri, new ArrayList<>());
        }
    }

    record MathStructure(SymbolUri uri, List<DocumentElement> children) implements OpenNarrativeElement, Container {
        public MathStructure(SymbolUri uri) {
            this(uri, new ArrayList<>());
        }
    }

    record Morphism(SymbolUri uri, List<DocumentElement> children) implements OpenNarrativeElement, Container {
        public Morphism(SymbolUri uri) {
            this(uri, new ArrayList<>());
        }
    }

    record VariableDeclaration(DocumentElementUri uri, OpenSymbolData data, boolean bind, boolean isSeq)
        implements OpenNarrativeElement {}

    final class Section implements OpenNarrativeElement, Container, Titled {
        private final DocumentElementUri uri;
        private final List<DocumentElement> children = new ArrayList<>();
        private String title;

        public Section(DocumentElementUri uri) {
            this.uri = uri;
        }

        public DocumentElementUri uri() {
            return uri;
        }

        @Override
        public List<DocumentElement> children() {
            return children;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public void title(String value) {
            this.title = value;
        }
    }

    record SkipSection(List<DocumentElement> children) implements OpenNarrativeElement, Container {
        public SkipSection() {
            this(new ArrayList<>());
        }
    }

    final class Notation implements OpenNarrativeElement {
        private final DocumentElementUri uri;
        private final String id;
        private final VarOrSym head;
        private final long precedence;
        private final List<Long> argumentPrecedences;
        private NotationComponent component;
        private NotationComponent.Node op;

        public Notation(DocumentElementUri uri, String id, VarOrSym head, long precedence, List<Long> argumentPrecedences) {
            this.uri = uri;
            this.id = id;
            this.head = head;
            this.precedence = precedence;
            this.argumentPrecedences = List.copyOf(argumentPrecedences);
        }

        public DocumentElementUri uri() {
            return uri;
        }

        public String id() {
            return id;
        }

        public VarOrSym head() {
            return head;
        }

        public long precedence() {
            return precedence;
        }

        public List<Long> argumentPrecedences() {
            return argumentPrecedences;
        }

        public NotationComponent component() {
            return component;
        }

        public void component(NotationComponent value) {
            this.component = value;
        }

        public NotationComponent.Node op() {
            return op;
        }

        public void op(NotationComponent.Node value) {
            this.op = value;
        }
    }

    record NotationComp(FtmlNode node, List<PathedComponent> components)
        implements OpenNarrativeElement, ComponentCollector {
        public NotationComp(FtmlNode node) {
            this(node, new ArrayList<>());
        }
    }

    record ArgSep(FtmlNode node, List<PathedComponent> components) implements OpenNarrativeElement, ComponentCollector {
        public ArgSep(FtmlNode node) {
            this(node, new ArrayList<>());
        }
    }

    final class Paragraph implements OpenNarrativeElement, Container, Titled {
        private final DocumentElementUri uri;
        private final ParagraphKind kind;
        private final ParagraphFormatting formatting;
        private final List<String> styles;
        private final List<ForEntry> fors;
        private final List<DocumentElement> children = new ArrayList<>();
        private String title;

        public Paragraph(
            DocumentElementUri uri,
            ParagraphKind kind,
            ParagraphFormatting formatting,
            List<String> styles,
            List<ForEntry> fors
        ) {
            this.uri = uri;
            this.kind = kind;
            this.formatting = formatting;
            this.styles = List.copyOf(styles);
            this.fors = new ArrayList<>(fors);
        }

        public DocumentElementUri uri() {
            return uri;
        }

        public ParagraphKind kind() {
            return kind;
        }

        public ParagraphFormatting formatting() {
            return formatting;
        }

        public List<String> styles() {
            return styles;
        }

        /** Mutable; definienda and definientia are added while the paragraph is open. */
        public List<ForEntry> fors() {
            return fors;
        }

        public boolean isDefinitionLike() {
            return kind.isDefinitionLike(styles);
        }

        @Override
        public List<DocumentElement> children() {
            return children;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public void title(String value) {
            this.title = value;
        }
    }

    final class Problem implements OpenNarrativeElement, Container, Titled {
        private final DocumentElementUri uri;
        private final boolean subProblem;
        private final boolean autogradable;
        private final Float points;
        private final Float minutes;
        private final List<String> styles;
        private final List<DocumentElement> children = new ArrayList<>();
        private final List<SolutionData> solutions = new ArrayList<>();
        private final List<DataRef> gradingNotes = new ArrayList<>();
        private final List<DataRef> hints = new ArrayList<>();
        private final List<DataRef> notes = new ArrayList<>();
        private final List<DimensionedSymbol> preconditions = new ArrayList<>();
        private final List<DimensionedSymbol> objectives = new ArrayList<>();
        private String title;

        public Problem(
            DocumentElementUri uri,
            boolean subProblem,
            boolean autogradable,
            Float points,
            Float minutes,
            List<String> styles
        ) {
            this.uri = uri;
            this.subProblem = subProblem;
            this.autogradable = autogradable;
            this.points = points;
            this.minutes = minutes;
            this.styles = List.copyOf(styles);
        }

        public DocumentElementUri uri() {
            return uri;
        }

        public boolean subProblem() {
            return subProblem;
        }

        public boolean autogradable() {
            return autogradable;
        }

        public Float points() {
            return points;
        }

        public Float minutes() {
            return minutes;
        }

        public List<String> styles() {
            return styles;
        }

        @Override
        public List<DocumentElement> children() {
            return children;
        }

        public List<SolutionData> solutions() {
            return solutions;
        }

        public List<DataRef> gradingNotes() {
            return gradingNotes;
        }

        public List<DataRef> hints() {
            return hints;
        }

        public List<DataRef> notes() {
            return notes;
        }

        public List<DimensionedSymbol> preconditions() {
            return preconditions;
        }

        public List<DimensionedSymbol> objectives() {
            return objectives;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public void title(String value) {
            this.title = value;
        }
    }

    /** {@code answerClass} is the answer class the solution belongs to, or null. */
    record Solution(String answerClass) implements OpenNarrativeElement {}

    record NotationArg(ArgumentPosition position) implements OpenNarrativeElement {}

    record Invisible() implements OpenNarrativeElement {}

    record Definiendum(SymbolUri uri) implements OpenNarrativeElement {}

    final class Slide implements OpenNarrativeElement, Container, Titled {
        private final DocumentElementUri uri;
        private final List<DocumentElement> children = new ArrayList<>();
        private String title;

        public Slide(DocumentElementUri uri) {
            this.uri = uri;
        }

        public DocumentElementUri uri() {
            return uri;
        }

        @Override
        public List<DocumentElement> children() {
            return children;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public void title(String value) {
            this.title = value;
        }
    }

    record FillinSol(Float width, List<FillInSolOption> cases, List<FtmlNode> nodes) implements OpenNarrativeElement {
        public FillinSol(Float width) {
            this(width, new ArrayList<>(), new ArrayList<>());
        }
    }

    record ProblemHint() implements OpenNarrativeElement {}

    record ProblemExNote() implements OpenNarrativeElement {}

    record ProblemGradingNote(List<work.lcod.ftml.model.problem.AnswerClass> answerClasses) implements OpenNarrativeElement {
        public ProblemGradingNote() {
            this(new ArrayList<>());
        }
    }

    /** {@code nodes} are the feedback nodes captured while the class is open. */
    record AnswerClass(String id, AnswerKind kind, List<FtmlNode> nodes) implements OpenNarrativeElement {
        public AnswerClass(String id, AnswerKind kind) {
            this(id, kind, new ArrayList<>());
        }
    }

    record ChoiceBlock(List<String> styles, ChoiceBlockStyle style, boolean multiple, List<Choice> choices)
        implements OpenNarrativeElement {
        public ChoiceBlock(List<String> styles, ChoiceBlockStyle style, boolean multiple) {
            this(List.copyOf(styles), style, multiple, new ArrayList<>());
        }
    }

    final class ProblemChoice implements OpenNarrativeElement {
        private final boolean correct;
        private final List<FtmlNode> nodes = new ArrayList<>();
        private String verdict;
        private String feedback = "";

        public ProblemChoice(boolean correct) {
            this.correct = correct;
        }

        public boolean correct() {
            return correct;
        }

        public List<FtmlNode> nodes() {
            return nodes;
        }

        public String verdict() {
            return verdict;
        }

        public void verdict(String value) {
            this.verdict = value;
        }

        public String feedback() {
            return feedback;
        }

        public void feedback(String value) {
            this.feedback = value;
        }
    }

    record ProblemChoiceVerdict() implements OpenNarrativeElement {}

    record ProblemChoiceFeedback() implements OpenNarrativeElement {}

    record FillinSolCase(FillInSolOption option) implements OpenNarrativeElement {}
}
