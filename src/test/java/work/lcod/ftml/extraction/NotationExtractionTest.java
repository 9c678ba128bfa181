package work.lcod.ftml.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.ftml.support.FtmlTestSupport.DOCUMENT;
import static work.lcod.ftml.support.FtmlTestSupport.attr;
import static work.lcod.ftml.support.FtmlTestSupport.extract;
import static work.lcod.ftml.support.FtmlTestSupport.symbol;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.notation.NotationComponent;
import work.lcod.ftml.model.term.ArgumentMode;

class NotationExtractionTest {
    private static final String PLUS = attr(symbol("plus"));

    @Test
    void recordsComponentsAtTheirPaths() throws Exception {
        var result = extract(
            "<span data-ftml-notation=\"" + PLUS + "\" data-ftml-notationfragment=\"infix\""
                + " data-ftml-precedence=\"5\" data-ftml-argprecs=\"3,4\">"
                + "<span data-ftml-notationcomp=\"\">"
                + "<b><span data-ftml-argnum=\"1\"></span></b>"
                + "<span data-ftml-comp=\"\">+</span>"
                + "<span data-ftml-argnum=\"2\"></span>"
                + "</span></span>");

        assertEquals(1, result.notations().size());
        var entry = result.notations().get(0);
        assertEquals(symbol("plus"), entry.leaf());
        assertEquals(DOCUMENT.element("infix"), entry.uri());

        var notation = entry.notation();
        assertEquals("infix", notation.id());
        assertEquals(5L, notation.precedence());
        assertEquals(List.of(3L, 4L), notation.argumentPrecedences());
        assertNull(notation.op());
        assertEquals(new NotationComponent.Node("span", Map.of(), List.of(
            new NotationComponent.Node("b", Map.of(), List.of(new NotationComponent.Argument(1, ArgumentMode.SIMPLE))),
            new NotationComponent.Comp(new NotationComponent.Node("span", Map.of(), List.of(new NotationComponent.Text("+")))),
            new NotationComponent.Argument(2, ArgumentMode.SIMPLE))), notation.component());

        var element = assertInstanceOf(DocumentElement.Notation.class, result.document().elements().get(0));
        var stored = DataBuffer.read(result.data(), element.notation());
        assertEquals("infix", stored.get("id").asText());
        assertEquals(5, stored.get("precedence").asInt());
    }

    @Test
    void sequenceSeparators() {
        var result = extract(
            "<span data-ftml-notation=\"" + PLUS + "\">"
                + "<span data-ftml-notationcomp=\"\">"
                + "<span data-ftml-maincomp=\"\">sum</span>"
                + "<span data-ftml-argsep=\"\"><span data-ftml-arg=\"1\" data-ftml-argmode=\"a\"></span><i>,</i></span>"
                + "</span></span>");

        var notation = result.notations().get(0).notation();
        assertEquals(DOCUMENT.element("notation"), result.notations().get(0).uri());
        assertNull(notation.id());
        var sum = new NotationComponent.Node("span", Map.of(), List.of(new NotationComponent.Text("sum")));
        assertEquals(sum, notation.op());
        assertEquals(new NotationComponent.Node("span", Map.of(), List.of(
            new NotationComponent.MainComp(sum),
            new NotationComponent.ArgSep(1, ArgumentMode.SEQUENCE, List.of(
                new NotationComponent.Node("i", Map.of(), List.of(new NotationComponent.Text(","))))))),
            notation.component());
    }

    @Test
    void notationForADeclaredVariable() {
        var result = extract(
            "<div data-ftml-paragraph=\"\"><span data-ftml-vardef=\"f\"></span>"
                + "<span data-ftml-notation=\"f\"><span data-ftml-notationcomp=\"\">f</span></span></div>");

        var paragraph = ((DocumentElement.Paragraph) result.document().elements().get(0)).paragraph();
        var declared = assertInstanceOf(DocumentElement.VariableDeclaration.class, paragraph.children().get(0));
        var notation = assertInstanceOf(DocumentElement.VariableNotation.class, paragraph.children().get(1));
        assertEquals(declared.uri(), notation.variable());
        assertTrue(notation.uri().toString().endsWith("notation"));

        assertEquals(1, result.notations().size());
        assertEquals(declared.uri(), result.notations().get(0).leaf());
        assertEquals(notation.uri(), result.notations().get(0).uri());
    }

    @Test
    void notationForAFreeNameIsInvalid() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(
            "<span data-ftml-notation=\"g\"><span data-ftml-notationcomp=\"\">g</span></span>"));
        assertEquals(FtmlErrorKind.INVALID_VALUE, ex.kind());
        assertEquals(FtmlKey.NOTATION, ex.key());
    }

    @Test
    void notationWithoutComponent() {
        var ex = assertThrows(FtmlExtractionException.class,
            () -> extract("<span data-ftml-notation=\"" + PLUS + "\">+</span>"));
        assertEquals(FtmlErrorKind.UNEXPECTED_END_OF, ex.kind());
    }

    @Test
    void componentOutsideNotation() {
        var ex = assertThrows(FtmlExtractionException.class,
            () -> extract("<span data-ftml-notationcomp=\"\">+</span>"));
        assertEquals(FtmlErrorKind.INVALID_IN, ex.kind());
    }

    @Test
    void argumentMarkerOutsideNotation() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract("<span data-ftml-argnum=\"1\"></span>"));
        assertEquals(FtmlErrorKind.NOT_IN, ex.kind());
    }
}
