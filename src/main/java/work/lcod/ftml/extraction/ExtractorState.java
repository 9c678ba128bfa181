package work.lcod.ftml.extraction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.domain.Assignment;
import work.lcod.ftml.model.domain.Declaration;
import work.lcod.ftml.model.domain.ModuleData;
import work.lcod.ftml.model.narrative.Document;
import work.lcod.ftml.model.narrative.DocumentCounter;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.narrative.DocumentKind;
import work.lcod.ftml.model.narrative.DocumentStyle;
import work.lcod.ftml.model.narrative.DocumentStyles;
import work.lcod.ftml.model.narrative.ForEntry;
import work.lcod.ftml.model.narrative.LogicalParagraph;
import work.lcod.ftml.model.narrative.SectionLevel;
import work.lcod.ftml.model.narrative.VariableData;
import work.lcod.ftml.model.problem.DimensionedSymbol;
import work.lcod.ftml.model.problem.SolutionData;
import work.lcod.ftml.model.term.Variable;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.node.SourceRange;
import work.lcod.ftml.shared.Diagnostics;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.DocumentUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.NarrativeUri;
import work.lcod.ftml.uri.SymbolUri;
import work.lcod.ftml.uri.UriParseException;

/**
 * Extraction state of one document: the domain and narrative stacks, the accumulated results
 * and the blob buffer. Stacks iterate top first. Not thread-safe; use one instance per document.
 */
public final class ExtractorState {
    private final DocumentUri document;
    private final Diagnostics diagnostics;
    private final Deque<OpenDomainElement> domain = new ArrayDeque<>();
    private final Deque<OpenNarrativeElement> narrative = new ArrayDeque<>();
    private final List<DocumentElement> top = new ArrayList<>();
    private final List<ModuleData> modules = new ArrayList<>();
    private final List<DocumentCounter> counters = new ArrayList<>();
    private final List<DocumentStyle> styles = new ArrayList<>();
    private final List<NotationEntry> notations = new ArrayList<>();
    private final Map<DocumentElementUri, List<SolutionData>> solutions = new LinkedHashMap<>();
    private final DataBuffer buffer = new DataBuffer();
    private final IdCounter ids = new IdCounter();
    private final TermFinalizers terms = new TermFinalizers(this);
    private final NotationFinalizers notationFinalizers = new NotationFinalizers(this);
    private final ProblemFinalizers problems = new ProblemFinalizers(this);
    private DocumentKind kind = DocumentKind.ARTICLE;
    private String title;
    private SectionLevel topSectionLevel;
    private SourceRange currentSourceRange = SourceRange.EMPTY;

    public ExtractorState(DocumentUri document, Diagnostics diagnostics) {
        this.document = Objects.requireNonNull(document, "document");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public DocumentUri document() {
        return document;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    /** Domain frames, top first. */
    public Iterable<OpenDomainElement> domain() {
        return domain;
    }

    /** Narrative frames, top first. */
    public Iterable<OpenNarrativeElement> narrative() {
        return narrative;
    }

    public OpenDomainElement topDomain() {
        return domain.peek();
    }

    public OpenNarrativeElement topNarrative() {
        return narrative.peek();
    }

    public SourceRange currentSourceRange() {
        return currentSourceRange;
    }

    public void currentSourceRange(SourceRange range) {
        this.currentSourceRange = Objects.requireNonNull(range, "range");
    }

    public String newId(String prefix) {
        return ids.newId(prefix);
    }

    /** Overrides the next generated id, e.g. for elements whose uri is known in advance. */
    public void setNextId(String id) {
        ids.forceNext(id);
    }

    DataBuffer buffer() {
        return buffer;
    }

    Deque<OpenDomainElement> domainStack() {
        return domain;
    }

    Deque<OpenNarrativeElement> narrativeStack() {
        return narrative;
    }

    List<ModuleData> modules() {
        return modules;
    }

    void addNotation(NotationEntry entry) {
        notations.add(entry);
    }

    void addSolutions(DocumentElementUri problem, List<SolutionData> list) {
        solutions.put(problem, List.copyOf(list));
    }

    // ---- queries used by key handlers

    /**
     * The module new declarations go into: the top domain frame must be a module, a structure or a morphism.
     */
    public ModuleUri domainModule(FtmlKey inElement) {
        OpenDomainElement frame = domain.peek();
        if (frame instanceof OpenDomainElement.Module m) {
            return m.uri();
        }
        if (frame instanceof OpenDomainElement.MathStructure s) {
            return s.uri().asModule();
        }
        if (frame instanceof OpenDomainElement.Morphism m) {
            return m.uri().asModule();
        }
        throw FtmlExtractionException.notIn(inElement, "a module (or inside a declaration)");
    }

    /** Nested under the enclosing module or structure when there is one, otherwise next to the document. */
    public ModuleUri newModuleUri(String name) throws UriParseException {
        OpenDomainElement frame = domain.peek();
        if (frame instanceof OpenDomainElement.Module m) {
            return m.uri().child(name);
        }
        if (frame instanceof OpenDomainElement.MathStructure s) {
            return s.uri().asModule().child(name);
        }
        if (frame instanceof OpenDomainElement.Morphism m) {
            return m.uri().asModule().child(name);
        }
        return document.module(name);
    }

    /** The uri new document elements are placed under. */
    public NarrativeUri narrativeUri() {
        for (OpenDomainElement frame : domain) {
            if (frame instanceof OpenDomainElement.Application a && a.uri() != null) {
                return a.uri();
            }
            if (frame instanceof OpenDomainElement.Binding b && b.uri() != null) {
                return b.uri();
            }
        }
        for (OpenNarrativeElement frame : narrative) {
            if (frame instanceof OpenNarrativeElement.Section s) {
                return s.uri();
            }
            if (frame instanceof OpenNarrativeElement.Paragraph p) {
                return p.uri();
            }
            if (frame instanceof OpenNarrativeElement.Slide s) {
                return s.uri();
            }
            if (frame instanceof OpenNarrativeElement.Problem p) {
                return p.uri();
            }
        }
        return document;
    }

    public boolean inNotation() {
        for (OpenNarrativeElement frame : narrative) {
            if (frame instanceof OpenNarrativeElement.Notation
                || frame instanceof OpenNarrativeElement.NotationComp
                || frame instanceof OpenNarrativeElement.ArgSep) {
                return true;
            }
        }
        return false;
    }

    /** Whether the top domain frame is an open term or one of its argument slots. */
    public boolean inTerm() {
        if (inNotation()) {
            return false;
        }
        OpenDomainElement frame = domain.peek();
        return frame instanceof OpenDomainElement.SymbolReference
            || frame instanceof OpenDomainElement.VariableReference
            || frame instanceof OpenDomainElement.Application
            || frame instanceof OpenDomainElement.Binding
            || frame instanceof OpenDomainElement.ComplexTerm
            || frame instanceof OpenDomainElement.Argument
            || frame instanceof OpenDomainElement.HeadTerm;
    }

    /**
     * Whether a new term is a sub-term of another one, i.e. sits directly in an argument or head slot.
     *
     * @throws FtmlExtractionException if the top frame is a notation component of a term
     */
    public boolean isSubTerm() {
        if (inNotation()) {
            return false;
        }
        OpenDomainElement frame = domain.peek();
        if (frame instanceof OpenDomainElement.Argument || frame instanceof OpenDomainElement.HeadTerm) {
            return true;
        }
        if (frame instanceof OpenDomainElement.Comp || frame instanceof OpenDomainElement.DefComp) {
            throw FtmlExtractionException.invalidIn(FtmlKey.TERM, "notation components");
        }
        return false;
    }

    /**
     * Resolves a variable name against the declarations already closed in the enclosing containers,
     * latest first. Unresolved names stay free.
     */
    public Variable resolveVariableName(String name) {
        String[] wanted = name.split("/");
        for (OpenNarrativeElement frame : narrative) {
            if (!(frame instanceof OpenNarrativeElement.Container container)) {
                continue;
            }
            List<DocumentElement> children = container.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i) instanceof DocumentElement.VariableDeclaration v && endsWith(v.uri().name(), wanted)) {
                    return new Variable.Ref(v.uri(), v.data().isSeq());
                }
            }
        }
        return new Variable.Name(name);
    }

    private static boolean endsWith(String declared, String[] wanted) {
        String[] steps = declared.split("/");
        if (wanted.length > steps.length) {
            return false;
        }
        for (int i = 1; i <= wanted.length; i++) {
            if (!steps[steps.length - i].equals(wanted[wanted.length - i])) {
                return false;
            }
        }
        return true;
    }

    // ---- open

    /** Applies a handler's open directive: meta data immediately, frames pushed onto their stacks. */
    public void add(AnyOpen open, FtmlNode node) {
        if (open instanceof AnyOpen.Meta meta) {
            doMeta(meta.datum(), node);
        } else if (open instanceof AnyOpen.Open frames) {
            if (frames.domain() != null) {
                domain.push(frames.domain());
            }
            if (frames.narrative() != null) {
                narrative.push(frames.narrative());
            }
        }
    }

    private void doMeta(MetaDatum datum, FtmlNode node) {
        if (datum instanceof MetaDatum.Kind k) {
            kind = k.kind();
        } else if (datum instanceof MetaDatum.Style s) {
            styles.add(s.style());
        } else if (datum instanceof MetaDatum.Counter c) {
            counters.add(c.counter());
        } else if (datum instanceof MetaDatum.InputRef ref) {
            pushElem(new DocumentElement.DocumentReference(ref.uri(), ref.target(), currentSourceRange));
        } else if (datum instanceof MetaDatum.SetSectionLevel level) {
            topSectionLevel = level.level();
        } else if (datum instanceof MetaDatum.UseModule use) {
            pushElem(new DocumentElement.UseModule(use.uri(), currentSourceRange));
        } else if (datum instanceof MetaDatum.ImportModule imp) {
            pushDomain(new Declaration.Import(imp.uri(), currentSourceRange));
            pushElem(new DocumentElement.ImportModule(imp.uri()));
        } else if (datum instanceof MetaDatum.Rename rename) {
            rename(rename);
        } else if (datum instanceof MetaDatum.Precondition pre) {
            if (!(narrative.peek() instanceof OpenNarrativeElement.Problem problem)) {
                throw FtmlExtractionException.invalidIn(FtmlKey.PRECONDITION_SYMBOL, "outside of (sub)problems");
            }
            problem.preconditions().add(new DimensionedSymbol(pre.dimension(), pre.symbol()));
        } else if (datum instanceof MetaDatum.Objective obj) {
            if (!(narrative.peek() instanceof OpenNarrativeElement.Problem problem)) {
                throw FtmlExtractionException.invalidIn(FtmlKey.OBJECTIVE_SYMBOL, "outside of (sub)problems");
            }
            problem.objectives().add(new DimensionedSymbol(obj.dimension(), obj.symbol()));
        } else if (datum instanceof MetaDatum.AnswerClassFeedback) {
            problems.answerClassFeedback(node);
        } else if (datum instanceof MetaDatum.Uri declared) {
            if (!declared.uri().equals(document)) {
                diagnostics.warn("document declares uri %s, extracting as %s", declared.uri(), document);
            }
        } else {
            diagnostics.debug("ignoring %s", datum);
        }
    }

    private void rename(MetaDatum.Rename rename) {
        if (!(domain.peek() instanceof OpenDomainElement.Morphism morphism)) {
            throw FtmlExtractionException.invalidIn(FtmlKey.RENAME, "outside of morphisms");
        }
        List<Assignment> children = morphism.children();
        for (int i = 0; i < children.size(); i++) {
            Assignment a = children.get(i);
            if (a.original().equals(rename.source())) {
                children.set(i, a.renamed(rename.name(), rename.macroname()));
                return;
            }
        }
        children.add(new Assignment(
            rename.source(), morphism.uri(), null, null, rename.name(), rename.macroname(), currentSourceRange));
    }

    // ---- close

    /**
     * Runs the finalizer for {@code element} on leaving {@code node}. The frame it pops must be of
     * the expected kind.
     */
    public void close(CloseFtmlElement element, FtmlNode node) {
        switch (element) {
            case MODULE:
                closeModule(popDomain(OpenDomainElement.Module.class, FtmlKey.MODULE), node);
                break;
            case MATH_STRUCTURE:
                closeStructure(popDomain(OpenDomainElement.MathStructure.class, FtmlKey.MATH_STRUCTURE), node);
                break;
            case MORPHISM:
                closeMorphism(popDomain(OpenDomainElement.Morphism.class, FtmlKey.MORPHISM), node);
                break;
            case RULE: {
                OpenDomainElement.InferenceRule rule = popDomain(OpenDomainElement.InferenceRule.class, FtmlKey.INFERENCE_RULE);
                pushDomain(new Declaration.Rule(rule.rule(), rule.parameters(), currentSourceRange));
                break;
            }
            case COMP:
                popDomain(OpenDomainElement.Comp.class, FtmlKey.COMP);
                break;
            case DEF_COMP:
                popDomain(OpenDomainElement.DefComp.class, FtmlKey.DEF_COMP);
                break;
            case SYMBOL_DECLARATION: {
                OpenDomainElement.SymbolDeclaration decl = popDomain(OpenDomainElement.SymbolDeclaration.class, FtmlKey.SYMDECL);
                diagnostics.debug("new symbol %s", decl.uri());
                pushDomain(new Declaration.Symbol(decl.uri(), decl.data().toSymbolData()));
                pushElem(new DocumentElement.SymbolDeclaration(decl.uri()));
                break;
            }
            case VARIABLE_DECLARATION: {
                OpenNarrativeElement.VariableDeclaration decl =
                    popNarrative(OpenNarrativeElement.VariableDeclaration.class, FtmlKey.VARDEF);
                VariableData data = decl.data().toVariableData(decl.bind(), decl.isSeq());
                pushElem(new DocumentElement.VariableDeclaration(decl.uri(), data));
                break;
            }
            case DEFINIENDUM:
                closeDefiniendum(popNarrative(OpenNarrativeElement.Definiendum.class, FtmlKey.DEFINIENDUM).uri(), node);
                break;
            case SECTION: {
                OpenNarrativeElement.Section s = popNarrative(OpenNarrativeElement.Section.class, FtmlKey.SECTION);
                pushElem(new DocumentElement.Section(s.uri(), node.range(), s.title(), s.children()));
                break;
            }
            case PARAGRAPH:
                closeParagraph(popNarrative(OpenNarrativeElement.Paragraph.class, FtmlKey.PARAGRAPH), node);
                break;
            case SLIDE: {
                OpenNarrativeElement.Slide s = popNarrative(OpenNarrativeElement.Slide.class, FtmlKey.SLIDE);
                pushElem(new DocumentElement.Slide(node.range(), s.uri(), s.title(), s.children()));
                break;
            }
            case ASSIGN:
                closeAssignment(popDomain(OpenDomainElement.Assign.class, FtmlKey.ASSIGN));
                break;
            case SKIP_SECTION:
                pushElem(new DocumentElement.SkipSection(
                    popNarrative(OpenNarrativeElement.SkipSection.class, FtmlKey.SKIP_SECTION).children()));
                break;
            case NOTATION:
                notationFinalizers.closeNotation(popNarrative(OpenNarrativeElement.Notation.class, FtmlKey.NOTATION));
                break;
            case NOTATION_COMP:
                notationFinalizers.closeNotationComp(
                    popNarrative(OpenNarrativeElement.NotationComp.class, FtmlKey.NOTATION_COMP));
                break;
            case ARG_SEP:
                notationFinalizers.closeArgSep(popNarrative(OpenNarrativeElement.ArgSep.class, FtmlKey.ARG_SEP), node);
                break;
            case NOTATION_ARG:
                notationFinalizers.closeNotationArg(
                    popNarrative(OpenNarrativeElement.NotationArg.class, FtmlKey.ARG).position(), node);
                break;
            case NOTATION_OP_COMP:
                notationFinalizers.closeNotationOp(node);
                break;
            case COMP_IN_NOTATION:
                notationFinalizers.closeCompInNotation(node, false);
                break;
            case MAIN_COMP_IN_NOTATION:
                notationFinalizers.closeCompInNotation(node, true);
                break;
            case SYMBOL_REFERENCE:
                terms.closeSymbolReference(popDomain(OpenDomainElement.SymbolReference.class, FtmlKey.TERM), node);
                break;
            case VARIABLE_REFERENCE:
                terms.closeVariableReference(popDomain(OpenDomainElement.VariableReference.class, FtmlKey.TERM), node);
                break;
            case APPLICATION:
                terms.closeApplication(popDomain(OpenDomainElement.Application.class, FtmlKey.TERM), node);
                break;
            case BINDING:
                terms.closeBinding(popDomain(OpenDomainElement.Binding.class, FtmlKey.TERM), node);
                break;
            case LABEL:
                terms.closeLabel(popDomain(OpenDomainElement.Label.class, FtmlKey.TERM), node);
                break;
            case COMPLEX_TERM:
                terms.closeComplex(popDomain(OpenDomainElement.ComplexTerm.class, FtmlKey.TERM), node);
                break;
            case ARGUMENT:
                terms.closeArgument(popDomain(OpenDomainElement.Argument.class, FtmlKey.ARG), node);
                break;
            case HEAD_TERM:
                terms.closeHeadTerm(popDomain(OpenDomainElement.HeadTerm.class, FtmlKey.HEAD_TERM), node);
                break;
            case TYPE:
                terms.closeType(popDomain(OpenDomainElement.Type.class, FtmlKey.TYPE), node);
                break;
            case ARG_TYPES:
                terms.closeArgTypes(popDomain(OpenDomainElement.ArgTypes.class, FtmlKey.TYPE));
                break;
            case RETURN_TYPE:
                terms.closeReturnType(popDomain(OpenDomainElement.ReturnType.class, FtmlKey.TYPE), node);
                break;
            case DEFINIENS:
                terms.closeDefiniens(popDomain(OpenDomainElement.Definiens.class, FtmlKey.DEFINIENS), node);
                break;
            case PROBLEM:
                problems.closeProblem(popNarrative(OpenNarrativeElement.Problem.class, FtmlKey.PROBLEM), node);
                break;
            case FILLIN_SOL:
                problems.closeFillinSol(
                    popNarrative(OpenNarrativeElement.FillinSol.class, FtmlKey.PROBLEM_FILLINSOL), node);
                break;
            case FILLIN_SOL_CASE:
                problems.closeFillinSolCase(
                    popNarrative(OpenNarrativeElement.FillinSolCase.class, FtmlKey.PROBLEM_FILLINSOL_CASE), node);
                break;
            case SOLUTION:
                problems.closeSolution(
                    popNarrative(OpenNarrativeElement.Solution.class, FtmlKey.PROBLEM_SOLUTION), node);
                break;
            case PROBLEM_HINT:
                popNarrative(OpenNarrativeElement.ProblemHint.class, FtmlKey.PROBLEM_HINT);
                problems.closeHint(node);
                break;
            case PROBLEM_EX_NOTE:
                popNarrative(OpenNarrativeElement.ProblemExNote.class, FtmlKey.PROBLEM_NOTE);
                problems.closeExNote(node);
                break;
            case PROBLEM_GRADING_NOTE:
                problems.closeGradingNote(
                    popNarrative(OpenNarrativeElement.ProblemGradingNote.class, FtmlKey.PROBLEM_GRADING_NOTE), node);
                break;
            case ANSWER_CLASS:
                problems.closeAnswerClass(
                    popNarrative(OpenNarrativeElement.AnswerClass.class, FtmlKey.ANSWER_CLASS), node);
                break;
            case CHOICE_BLOCK:
                problems.closeChoiceBlock(
                    popNarrative(OpenNarrativeElement.ChoiceBlock.class, FtmlKey.PROBLEM_MULTIPLE_CHOICE_BLOCK), node);
                break;
            case PROBLEM_CHOICE:
                problems.closeChoice(popNarrative(OpenNarrativeElement.ProblemChoice.class, FtmlKey.PROBLEM_CHOICE));
                break;
            case PROBLEM_CHOICE_VERDICT:
                popNarrative(OpenNarrativeElement.ProblemChoiceVerdict.class, FtmlKey.PROBLEM_CHOICE_VERDICT);
                problems.closeChoiceVerdict(node);
                break;
            case PROBLEM_CHOICE_FEEDBACK:
                popNarrative(OpenNarrativeElement.ProblemChoiceFeedback.class, FtmlKey.PROBLEM_CHOICE_FEEDBACK);
                problems.closeChoiceFeedback(node);
                break;
            case SECTION_TITLE:
                closeTitle(OpenNarrativeElement.Section.class, node);
                break;
            case PARAGRAPH_TITLE:
                closeTitle(OpenNarrativeElement.Paragraph.class, node);
                break;
            case SLIDE_TITLE:
                closeTitle(OpenNarrativeElement.Slide.class, node);
                break;
            case PROBLEM_TITLE:
                closeTitle(OpenNarrativeElement.Problem.class, node);
                break;
            case DOC_TITLE:
                title = node.innerString();
                break;
            case INVISIBLE:
                closeInvisible(node);
                break;
            default:
                throw new IllegalStateException("unhandled close " + element);
        }
    }

    <T extends OpenDomainElement> T popDomain(Class<T> type, FtmlKey key) {
        OpenDomainElement frame = domain.poll();
        if (!type.isInstance(frame)) {
            diagnostics.debug("expected %s on the domain stack, found %s", type.getSimpleName(), frame);
            throw FtmlExtractionException.unexpectedEndOf(key);
        }
        return type.cast(frame);
    }

    <T extends OpenNarrativeElement> T popNarrative(Class<T> type, FtmlKey key) {
        OpenNarrativeElement frame = narrative.poll();
        if (!type.isInstance(frame)) {
            diagnostics.debug("expected %s on the narrative stack, found %s", type.getSimpleName(), frame);
            throw FtmlExtractionException.unexpectedEndOf(key);
        }
        return type.cast(frame);
    }

    /**
     * Adds a declaration to the nearest enclosing module or structure.
     */
    void pushDomain(Declaration declaration) {
        for (OpenDomainElement frame : domain) {
            if (frame instanceof OpenDomainElement.Module m) {
                m.children().add(declaration);
                return;
            }
            if (frame instanceof OpenDomainElement.MathStructure s) {
                if (!declaration.allowedInStructure()) {
                    if (declaration instanceof Declaration.NestedModule) {
                        throw FtmlExtractionException.invalidIn(FtmlKey.MODULE, "structures");
                    }
                    throw FtmlExtractionException.invalidIn(FtmlKey.MATH_STRUCTURE, "other structures");
                }
                s.children().add(declaration);
                return;
            }
        }
        throw FtmlExtractionException.notIn(FtmlKey.SYMDECL, "a module or structure (or inside of a declaration)");
    }

    /** Adds a finished element to the nearest open container, or to the document's top level. */
    void pushElem(DocumentElement element) {
        for (OpenNarrativeElement frame : narrative) {
            if (frame instanceof OpenNarrativeElement.Container c) {
                c.children().add(element);
                return;
            }
        }
        top.add(element);
    }

    private void closeModule(OpenDomainElement.Module module, FtmlNode node) {
        if (module.uri().isTop()) {
            if (!domain.isEmpty()) {
                throw FtmlExtractionException.unexpectedEndOf(FtmlKey.MODULE);
            }
            diagnostics.debug("new module %s", module.uri());
            modules.add(new ModuleData(module.uri(), module.meta(), module.signature(), module.children(), currentSourceRange));
        } else {
            pushDomain(new Declaration.NestedModule(module.uri(), module.children(), currentSourceRange));
        }
        OpenNarrativeElement.Module narr = popNarrative(OpenNarrativeElement.Module.class, FtmlKey.MODULE);
        pushElem(new DocumentElement.Module(node.range(), narr.uri(), narr.children()));
    }

    private void closeStructure(OpenDomainElement.MathStructure structure, FtmlNode node) {
        if (structure.uri().lastName().startsWith(IdCounter.EXTENSION_PREFIX)) {
            closeExtension(structure, node);
            return;
        }
        pushDomain(new Declaration.MathStructure(
            structure.uri(), structure.macroname(), structure.children(), currentSourceRange));
        OpenNarrativeElement.MathStructure narr =
            popNarrative(OpenNarrativeElement.MathStructure.class, FtmlKey.MATH_STRUCTURE);
        pushElem(new DocumentElement.MathStructure(node.range(), narr.uri(), narr.children()));
    }

    /** Anonymous structures extend the structure named by their first import that is not itself an extension. */
    private void closeExtension(OpenDomainElement.MathStructure structure, FtmlNode node) {
        List<Declaration> children = new ArrayList<>(structure.children());
        Declaration.Import target = null;
        for (Declaration d : children) {
            if (d instanceof Declaration.Import imp && !imp.uri().lastName().startsWith(IdCounter.EXTENSION_PREFIX)) {
                target = imp;
                break;
            }
        }
        if (target == null) {
            throw FtmlExtractionException.missingArgument(1);
        }
        children.remove(target);
        SymbolUri targetSymbol = target.uri().asSymbol()
            .orElseThrow(() -> FtmlExtractionException.invalidValue(FtmlKey.IMPORT_MODULE));
        Declaration.Extension extension = new Declaration.Extension(structure.uri(), targetSymbol, children, currentSourceRange);
        OpenNarrativeElement.MathStructure narr =
            popNarrative(OpenNarrativeElement.MathStructure.class, FtmlKey.MATH_STRUCTURE);
        pushElem(new DocumentElement.Extension(node.range(), structure.uri(), targetSymbol, narr.children()));
        pushDomain(extension);
    }

    private void closeMorphism(OpenDomainElement.Morphism morphism, FtmlNode node) {
        pushDomain(new Declaration.Morphism(
            morphism.uri(), morphism.domain(), morphism.total(), morphism.children(), currentSourceRange));
        OpenNarrativeElement.Morphism narr = popNarrative(OpenNarrativeElement.Morphism.class, FtmlKey.MORPHISM);
        pushElem(new DocumentElement.Morphism(node.range(), narr.uri(), narr.children()));
    }

    private void closeAssignment(OpenDomainElement.Assign assign) {
        for (OpenDomainElement frame : domain) {
            if (!(frame instanceof OpenDomainElement.Morphism morphism)) {
                continue;
            }
            List<Assignment> children = morphism.children();
            for (int i = 0; i < children.size(); i++) {
                Assignment a = children.get(i);
                if (a.original().equals(assign.source())) {
                    if (assign.definiens() != null) {
                        a = a.withDefiniens(assign.definiens());
                    }
                    if (assign.refinedType() != null) {
                        a = a.withRefinedType(assign.refinedType());
                    }
                    children.set(i, a);
                    return;
                }
            }
            children.add(new Assignment(assign.source(), morphism.uri(), assign.definiens(), assign.refinedType(),
                null, null, currentSourceRange));
            return;
        }
        throw FtmlExtractionException.invalidIn(FtmlKey.ASSIGN, "outside of morphisms");
    }

    private void closeDefiniendum(SymbolUri uri, FtmlNode node) {
        for (OpenNarrativeElement frame : narrative) {
            if (frame instanceof OpenNarrativeElement.Paragraph p) {
                if (p.fors().stream().noneMatch(f -> f.symbol().equals(uri))) {
                    p.fors().add(new ForEntry(uri, null));
                }
                pushElem(new DocumentElement.Definiendum(node.range(), uri));
                return;
            }
        }
        throw FtmlExtractionException.unexpectedEndOf(FtmlKey.DEFINIENDUM);
    }

    private void closeParagraph(OpenNarrativeElement.Paragraph p, FtmlNode node) {
        for (OpenNarrativeElement frame : narrative) {
            if (frame instanceof OpenNarrativeElement.Solution) {
                diagnostics.info("skipping paragraph %s in solution block", p.uri());
                return;
            }
        }
        pushElem(new DocumentElement.Paragraph(new LogicalParagraph(
            p.kind(), p.uri(), p.formatting(), node.range(), p.title(), p.styles(), p.children(), p.fors(),
            currentSourceRange)));
    }

    /**
     * Sets the title of the nearest frame of type {@code target}; structural domain mirrors and
     * invisible frames in between are skipped.
     */
    private void closeTitle(Class<? extends OpenNarrativeElement.Titled> target, FtmlNode node) {
        for (OpenNarrativeElement frame : narrative) {
            if (target.isInstance(frame)) {
                OpenNarrativeElement.Titled titled = target.cast(frame);
                if (titled.title() != null) {
                    throw FtmlExtractionException.duplicateValue(FtmlKey.TITLE);
                }
                String text = node.innerString();
                if (!text.isEmpty()) {
                    titled.title(text);
                }
                return;
            }
            if (!(frame instanceof OpenNarrativeElement.Module
                || frame instanceof OpenNarrativeElement.MathStructure
                || frame instanceof OpenNarrativeElement.Morphism
                || frame instanceof OpenNarrativeElement.Invisible)) {
                break;
            }
        }
        throw FtmlExtractionException.unexpectedEndOf(FtmlKey.TITLE);
    }

    /** Invisible markup is dropped unless it belongs to a notation or sits inside a term. */
    private void closeInvisible(FtmlNode node) {
        popNarrative(OpenNarrativeElement.Invisible.class, FtmlKey.INVISIBLE);
        for (OpenNarrativeElement frame : narrative) {
            if (frame instanceof OpenNarrativeElement.Notation) {
                return;
            }
        }
        for (OpenDomainElement frame : domain) {
            if (frame instanceof OpenDomainElement.Application || frame instanceof OpenDomainElement.Binding) {
                return;
            }
        }
        node.delete();
    }

    // ---- finish

    /** Builds the result; the state must not be used afterwards. */
    public ExtractionResult finish() {
        if (!domain.isEmpty() || !narrative.isEmpty()) {
            diagnostics.warn("finishing %s with open frames: domain=%s narrative=%s", document, domain, narrative);
        }
        Document doc = new Document(
            document,
            title,
            kind,
            topSectionLevel == null ? SectionLevel.SECTION : topSectionLevel,
            new DocumentStyles(counters, styles),
            top);
        return new ExtractionResult(doc, modules, buffer.toByteArray(), notations, solutions);
    }
}
