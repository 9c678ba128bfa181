package work.lcod.ftml.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.ftml.support.FtmlTestSupport.ARITH;
import static work.lcod.ftml.support.FtmlTestSupport.DOCUMENT;
import static work.lcod.ftml.support.FtmlTestSupport.attr;
import static work.lcod.ftml.support.FtmlTestSupport.extract;
import static work.lcod.ftml.support.FtmlTestSupport.symbol;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.ftml.api.LogLevel;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.domain.Declaration;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.narrative.ForEntry;
import work.lcod.ftml.model.term.Argument;
import work.lcod.ftml.model.term.BoundArgument;
import work.lcod.ftml.model.term.ComponentVar;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.model.term.Variable;
import work.lcod.ftml.node.HtmlSource;
import work.lcod.ftml.shared.Diagnostics;

class HtmlExtractorTest {
    private static final String PLUS = attr(symbol("plus"));
    private static final String ZERO = attr(symbol("zero"));
    private static final String ONE = attr(symbol("one"));
    private static final String TWO = attr(symbol("two"));

    private static String oms(String head, String text) {
        return "<span data-ftml-term=\"OMID\" data-ftml-head=\"" + head + "\">" + text + "</span>";
    }

    @Test
    void extractsTopLevelApplication() {
        var result = extract(
            "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\">"
                + "<span data-ftml-arg=\"1\">" + oms(ONE, "1") + "</span>+"
                + "<span data-ftml-arg=\"2\">" + oms(TWO, "2") + "</span>"
                + "</span>");

        List<DocumentElement> elements = result.document().elements();
        assertEquals(1, elements.size());
        var term = assertInstanceOf(DocumentElement.Term.class, elements.get(0));
        assertEquals(DOCUMENT.element("term"), term.uri());
        assertEquals(new Term.Application(
            new Term.Symbol(symbol("plus")),
            List.of(new Argument.Simple(new Term.Symbol(symbol("one"))), new Argument.Simple(new Term.Symbol(symbol("two")))),
            null), term.term());
    }

    @Test
    void secondTopLevelTermGetsNextId() {
        var result = extract(
            "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\"><span data-ftml-arg=\"1\">" + oms(ONE, "1") + "</span></span>"
                + "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\"><span data-ftml-arg=\"1\">" + oms(TWO, "2") + "</span></span>");

        var second = assertInstanceOf(DocumentElement.Term.class, result.document().elements().get(1));
        assertEquals(DOCUMENT.element("term_1"), second.uri());
    }

    @Test
    void gapInArgumentsIsMissingArgument() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(
            "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\">"
                + "<span data-ftml-arg=\"2\">" + oms(TWO, "2") + "</span></span>"));
        assertEquals(FtmlErrorKind.MISSING_ARGUMENT, ex.kind());
        assertEquals("missing argument 1 for application term", ex.getMessage());
    }

    @Test
    void conflictingArgumentsAreMismatched() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(
            "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\">"
                + "<span data-ftml-arg=\"1\">" + oms(ONE, "1") + "</span>"
                + "<span data-ftml-arg=\"1\">" + oms(TWO, "2") + "</span></span>"));
        assertEquals(FtmlErrorKind.MISMATCHED_ARGUMENT, ex.kind());
    }

    @Test
    void sequenceArgumentCollectsItsElements() {
        var result = extract(
            "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\">"
                + "<span data-ftml-arg=\"11\" data-ftml-argmode=\"a\">" + oms(ZERO, "0") + "</span>,"
                + "<span data-ftml-arg=\"12\" data-ftml-argmode=\"a\">" + oms(ONE, "1") + "</span></span>");

        var term = (Term.Application) ((DocumentElement.Term) result.document().elements().get(0)).term();
        assertEquals(List.of(new Argument.Sequence(List.of(new Term.Symbol(symbol("zero")), new Term.Symbol(symbol("one"))))),
            term.arguments());
    }

    @Test
    void gapInSequenceIsMissingArgument() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(
            "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\">"
                + "<span data-ftml-arg=\"11\" data-ftml-argmode=\"a\">" + oms(ZERO, "0") + "</span>"
                + "<span data-ftml-arg=\"13\" data-ftml-argmode=\"a\">" + oms(TWO, "2") + "</span></span>"));
        assertEquals(FtmlErrorKind.MISSING_ARGUMENT, ex.kind());
        assertEquals("missing argument 1 for application term", ex.getMessage());
    }

    @Test
    void bindingTurnsBoundSlotsIntoVariables() {
        var result = extract(
            "<span data-ftml-term=\"OMBIND\" data-ftml-head=\"" + PLUS + "\">"
                + "<span data-ftml-arg=\"1\" data-ftml-argmode=\"b\"><span data-ftml-term=\"OMV\" data-ftml-head=\"x\">x</span></span>"
                + "<span data-ftml-arg=\"2\">" + oms(ZERO, "0") + "</span></span>");

        var term = assertInstanceOf(DocumentElement.Term.class, result.document().elements().get(0));
        assertEquals(new Term.Bound(
            new Term.Symbol(symbol("plus")),
            List.of(
                new BoundArgument.Bound(ComponentVar.of(new Variable.Name("x"))),
                new BoundArgument.Simple(new Term.Symbol(symbol("zero")))),
            null), term.term());
    }

    @Test
    void conflictingBoundArgumentsAreMismatched() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(
            "<span data-ftml-term=\"OMBIND\" data-ftml-head=\"" + PLUS + "\">"
                + "<span data-ftml-arg=\"1\" data-ftml-argmode=\"b\"><span data-ftml-term=\"OMV\" data-ftml-head=\"x\">x</span></span>"
                + "<span data-ftml-arg=\"1\" data-ftml-argmode=\"b\"><span data-ftml-term=\"OMV\" data-ftml-head=\"y\">y</span></span>"
                + "</span>"));
        assertEquals(FtmlErrorKind.MISMATCHED_BOUND_ARGUMENT, ex.kind());
    }

    @Test
    void argumentOutsideOfTermIsRejected() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract("<span data-ftml-arg=\"1\">x</span>"));
        assertEquals(FtmlErrorKind.NOT_IN, ex.kind());
        assertEquals(FtmlKey.ARG, ex.key());
    }

    @Test
    void unknownTermKindIsInvalid() {
        var ex = assertThrows(FtmlExtractionException.class,
            () -> extract("<span data-ftml-term=\"OMX\" data-ftml-head=\"" + ONE + "\">1</span>"));
        assertEquals(FtmlErrorKind.INVALID_VALUE, ex.kind());
    }

    @Test
    void titleNeedsASection() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract("<h1 data-ftml-title=\"\">Numbers</h1>"));
        assertEquals(FtmlErrorKind.NOT_IN, ex.kind());
        assertEquals(FtmlKey.TITLE, ex.key());
    }

    @Test
    void sectionTakesItsTitle() {
        var result = extract("<section data-ftml-section=\"\"><h2 data-ftml-title=\"\">Intro</h2><p>text</p></section>");

        var section = assertInstanceOf(DocumentElement.Section.class, result.document().elements().get(0));
        assertEquals("Intro", section.title());
        assertEquals(DOCUMENT.element("section"), section.uri());
    }

    @Test
    void secondTitleIsADuplicate() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(
            "<section data-ftml-section=\"\"><h2 data-ftml-title=\"\">A</h2><h2 data-ftml-title=\"\">B</h2></section>"));
        assertEquals(FtmlErrorKind.DUPLICATE_VALUE, ex.kind());
    }

    @Test
    void definiensInsideDeclaration() {
        var result = extract(
            "<div data-ftml-module=\"arith\">"
                + "<span data-ftml-symdecl=\"zero\"></span>"
                + "<span data-ftml-symdecl=\"one\"><span data-ftml-definiens=\"\">" + oms(ZERO, "0") + "</span></span>"
                + "</div>");

        assertEquals(1, result.modules().size());
        var module = result.modules().get(0);
        assertEquals(ARITH, module.uri());
        assertEquals(2, module.declarations().size());
        var one = assertInstanceOf(Declaration.Symbol.class, module.declarations().get(1));
        assertEquals(symbol("one"), one.uri());
        assertEquals(new Term.Symbol(symbol("zero")), one.data().df());
        assertNull(((Declaration.Symbol) module.declarations().get(0)).data().df());

        var narrative = assertInstanceOf(DocumentElement.Module.class, result.document().elements().get(0));
        assertEquals(2, narrative.children().size());
    }

    @Test
    void definitionDefinesItsFirstSubject() {
        var result = extract(
            "<div data-ftml-module=\"arith\"><span data-ftml-symdecl=\"zero\"></span><span data-ftml-symdecl=\"one\"></span></div>"
                + "<div data-ftml-definition=\"\" data-ftml-fors=\"" + ONE + "\">"
                + "<span data-ftml-definiens=\"\">" + oms(ZERO, "0") + "</span></div>");

        var one = (Declaration.Symbol) result.modules().get(0).declarations().get(1);
        assertEquals(new Term.Symbol(symbol("zero")), one.data().df());

        var paragraph = assertInstanceOf(DocumentElement.Paragraph.class, result.document().elements().get(1)).paragraph();
        assertEquals(List.of(new ForEntry(symbol("one"), new Term.Symbol(symbol("zero")))), paragraph.fors());
        assertEquals(DOCUMENT.element("definition"), paragraph.uri());
    }

    @Test
    void declarationOutsideModuleIsRejected() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract("<span data-ftml-symdecl=\"zero\"></span>"));
        assertEquals(FtmlErrorKind.NOT_IN, ex.kind());
        assertEquals(FtmlKey.SYMDECL, ex.key());
    }

    @Test
    void variablesResolveToTheirDeclaration() {
        var html = HtmlSource.parse("<div data-ftml-paragraph=\"\"><span data-ftml-vardef=\"x\"></span>"
            + "<span data-ftml-term=\"OMV\" data-ftml-head=\"x\">x</span></div>");
        var result = new HtmlExtractor().extract(html, DOCUMENT, Diagnostics.silent(LogLevel.WARN));

        var paragraph = ((DocumentElement.Paragraph) result.document().elements().get(0)).paragraph();
        var declared = assertInstanceOf(DocumentElement.VariableDeclaration.class, paragraph.children().get(0));
        var reference = assertInstanceOf(DocumentElement.VariableReference.class, paragraph.children().get(1));
        assertEquals(declared.uri(), reference.uri());
        assertEquals(declared.uri().toString(), html.select("span[data-ftml-term]").attr("data-ftml-head"));
    }

    @Test
    void freeVariablesStayNames() {
        var result = extract("<span data-ftml-term=\"OMA\" data-ftml-head=\"" + PLUS + "\">"
            + "<span data-ftml-arg=\"1\"><span data-ftml-term=\"OMV\" data-ftml-head=\"y\">y</span></span></span>");
        var term = (Term.Application) ((DocumentElement.Term) result.document().elements().get(0)).term();
        assertEquals(new Argument.Simple(new Term.Var(new Variable.Name("y"))), term.arguments().get(0));
    }

    @Test
    void invisibleMarkupIsRemoved() {
        var html = HtmlSource.parse("<p>shown<span data-ftml-invisible=\"true\">hidden</span></p>");
        new HtmlExtractor().extract(html, DOCUMENT, Diagnostics.silent(LogLevel.WARN));
        assertFalse(html.body().html().contains("hidden"));
        assertTrue(html.body().html().contains("shown"));
    }

    @Test
    void documentMetadata() {
        var result = extract(
            "<div data-ftml-sectionlevel=\"2\"></div>"
                + "<h1 data-ftml-doctitle=\"\">Natural <b>numbers</b></h1>"
                + "<div data-ftml-inputref=\"https://mathhub.info?a=test/arith&amp;d=intro&amp;l=en\"></div>");

        assertEquals("Natural <b>numbers</b>", result.document().title());
        var ref = assertInstanceOf(DocumentElement.DocumentReference.class, result.document().elements().get(0));
        assertEquals(DOCUMENT.element("intro"), ref.uri());
        assertEquals("intro", ref.target().name());
    }
}
