package work.lcod.ftml.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.ftml.support.FtmlTestSupport.ARCHIVE;
import static work.lcod.ftml.support.FtmlTestSupport.DOCUMENT;
import static work.lcod.ftml.support.FtmlTestSupport.attr;
import static work.lcod.ftml.support.FtmlTestSupport.extract;
import static work.lcod.ftml.support.FtmlTestSupport.symbol;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.domain.Assignment;
import work.lcod.ftml.model.domain.Declaration;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.term.Argument;
import work.lcod.ftml.model.term.ArgumentMode;
import work.lcod.ftml.model.term.ArgumentSpec;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;

class DomainExtractionTest {
    private static final String NAT = attr(symbol("nat"));
    private static final String ZERO = attr(symbol("zero"));
    private static final String ONE = attr(symbol("one"));

    private static String oms(String head) {
        return "<span data-ftml-term=\"OMID\" data-ftml-head=\"" + head + "\">x</span>";
    }

    private static String inArith(String body) {
        return "<div data-ftml-module=\"arith\">" + body + "</div>";
    }

    private static Declaration only(ExtractionResult result) {
        List<Declaration> declarations = result.modules().get(0).declarations();
        assertEquals(1, declarations.size());
        return declarations.get(0);
    }

    @Test
    void declarationCollectsItsTypeSlots() {
        var result = extract(inArith(
            "<span data-ftml-symdecl=\"succ\" data-ftml-args=\"1\">"
                + "<span data-ftml-argtypes=\"\"><span data-ftml-type=\"\">" + oms(NAT) + "</span></span>"
                + "<span data-ftml-type=\"\">" + oms(NAT) + "</span>"
                + "<span data-ftml-returntype=\"\">" + oms(NAT) + "</span>"
                + "</span>"));

        var succ = assertInstanceOf(Declaration.Symbol.class, only(result));
        var nat = new Term.Symbol(symbol("nat"));
        assertEquals(nat, succ.data().tp());
        assertEquals(nat, succ.data().returnType());
        assertEquals(List.of(nat), succ.data().argumentTypes());
        assertEquals(new ArgumentSpec(List.of(ArgumentMode.SIMPLE)), succ.data().arity());
    }

    @Test
    void attributeOrderDoesNotMatter() {
        var first = assertInstanceOf(Declaration.Symbol.class, only(extract(inArith(
            "<span data-ftml-symdecl=\"f\" data-ftml-args=\"2\" data-ftml-macroname=\"eff\"></span>"))));
        var second = assertInstanceOf(Declaration.Symbol.class, only(extract(inArith(
            "<span data-ftml-macroname=\"eff\" data-ftml-args=\"2\" data-ftml-symdecl=\"f\"></span>"))));

        assertEquals(first.uri(), second.uri());
        assertEquals(first.data().arity(), second.data().arity());
        assertEquals("eff", second.data().macroname());
        assertEquals(first.data().macroname(), second.data().macroname());
    }

    @Test
    void secondTypeIsADuplicate() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(inArith(
            "<span data-ftml-symdecl=\"f\">"
                + "<span data-ftml-type=\"\">" + oms(NAT) + "</span>"
                + "<span data-ftml-type=\"\">" + oms(NAT) + "</span></span>")));
        assertEquals(FtmlErrorKind.DUPLICATE_VALUE, ex.kind());
        assertEquals(FtmlKey.TYPE, ex.key());
    }

    @Test
    void secondDefiniensIsADuplicate() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(inArith(
            "<span data-ftml-symdecl=\"f\">"
                + "<span data-ftml-definiens=\"\">" + oms(ZERO) + "</span>"
                + "<span data-ftml-definiens=\"\">" + oms(ONE) + "</span></span>")));
        assertEquals(FtmlErrorKind.DUPLICATE_VALUE, ex.kind());
        assertEquals(FtmlKey.DEFINIENS, ex.key());
    }

    @Test
    void secondReturnTypeIsADuplicate() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(inArith(
            "<span data-ftml-symdecl=\"f\">"
                + "<span data-ftml-returntype=\"\">" + oms(NAT) + "</span>"
                + "<span data-ftml-returntype=\"\">" + oms(NAT) + "</span></span>")));
        assertEquals(FtmlErrorKind.DUPLICATE_VALUE, ex.kind());
        assertEquals(FtmlKey.RETURN_TYPE, ex.key());
    }

    @Test
    void structureHoldsItsDeclarations() {
        var result = extract(inArith(
            "<div data-ftml-feature-structure=\"monoid\"><span data-ftml-symdecl=\"op\"></span></div>"));

        var structure = assertInstanceOf(Declaration.MathStructure.class, only(result));
        assertEquals(symbol("monoid"), structure.uri());
        var op = assertInstanceOf(Declaration.Symbol.class, structure.elements().get(0));
        assertEquals(new SymbolUri(new ModuleUri(ARCHIVE, "arith/monoid"), "op"), op.uri());

        var module = (DocumentElement.Module) result.document().elements().get(0);
        assertInstanceOf(DocumentElement.MathStructure.class, module.children().get(0));
    }

    @Test
    void extensionTargetsItsFirstImport() {
        var monoid = new ModuleUri(ARCHIVE, "arith/monoid");
        var result = extract(inArith(
            "<div data-ftml-feature-structure=\"EXTSTRUCT_1\">"
                + "<span data-ftml-import=\"" + monoid.toString().replace("&", "&amp;") + "\"></span>"
                + "<span data-ftml-symdecl=\"unit\"></span></div>"));

        var extension = assertInstanceOf(Declaration.Extension.class, only(result));
        assertEquals(symbol("monoid"), extension.target());
        assertEquals(1, extension.elements().size());
        assertInstanceOf(Declaration.Symbol.class, extension.elements().get(0));

        var module = (DocumentElement.Module) result.document().elements().get(0);
        var narrative = assertInstanceOf(DocumentElement.Extension.class, module.children().get(0));
        assertEquals(symbol("monoid"), narrative.target());
    }

    @Test
    void extensionWithoutImportIsMissingItsTarget() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(inArith(
            "<div data-ftml-feature-structure=\"EXTSTRUCT_1\"><span data-ftml-symdecl=\"unit\"></span></div>")));
        assertEquals(FtmlErrorKind.MISSING_ARGUMENT, ex.kind());
    }

    @Test
    void morphismCollectsAssignmentsAndRenames() {
        var base = new ModuleUri(ARCHIVE, "base");
        var baseZero = new SymbolUri(base, "zero");
        var baseOne = new SymbolUri(base, "one");
        var result = extract(inArith(
            "<div data-ftml-feature-morphism=\"embed\" data-ftml-domain=\"" + base.toString().replace("&", "&amp;")
                + "\" data-ftml-total=\"true\">"
                + "<span data-ftml-assign=\"" + attr(baseZero) + "\">"
                + "<span data-ftml-type=\"\">" + oms(NAT) + "</span>"
                + "<span data-ftml-definiens=\"\">" + oms(ZERO) + "</span></span>"
                + "<span data-ftml-rename=\"" + attr(baseOne) + "\" data-ftml-to=\"uno\" data-ftml-macroname=\"uno\"></span>"
                + "</div>"));

        var morphism = assertInstanceOf(Declaration.Morphism.class, only(result));
        assertEquals(symbol("embed"), morphism.uri());
        assertEquals(base, morphism.domain());
        assertTrue(morphism.total());
        assertEquals(2, morphism.elements().size());

        Assignment assigned = morphism.elements().get(0);
        assertEquals(baseZero, assigned.original());
        assertEquals(new Term.Symbol(symbol("zero")), assigned.definiens());
        assertEquals(new Term.Symbol(symbol("nat")), assigned.refinedType());

        Assignment renamed = morphism.elements().get(1);
        assertEquals(baseOne, renamed.original());
        assertEquals("uno", renamed.newName());
        assertEquals("uno", renamed.macroname());
    }

    @Test
    void renameOutsideMorphismIsRejected() {
        var ex = assertThrows(FtmlExtractionException.class, () -> extract(inArith(
            "<span data-ftml-rename=\"" + ONE + "\" data-ftml-to=\"uno\"></span>")));
        assertEquals(FtmlErrorKind.INVALID_IN, ex.kind());
        assertEquals(FtmlKey.RENAME, ex.key());
    }

    @Test
    void inferenceRuleCollectsParameters() {
        var result = extract(inArith(
            "<div data-ftml-inferencerule=\"induction\">"
                + "<span data-ftml-arg=\"1\">" + oms(ZERO) + "</span>"
                + "<span data-ftml-arg=\"2\">" + oms(ONE) + "</span></div>"));

        var rule = assertInstanceOf(Declaration.Rule.class, only(result));
        assertEquals("induction", rule.id());
        assertEquals(List.of(new Term.Symbol(symbol("zero")), new Term.Symbol(symbol("one"))), rule.parameters());
    }

    @Test
    void endToEndModuleAndApplication() {
        var m = new ModuleUri(ARCHIVE, "m");
        var f = new SymbolUri(m, "f");
        var result = extract(
            "<div data-ftml-module=\"m\"><span data-ftml-symdecl=\"f\" data-ftml-args=\"2\"></span></div>"
                + "<span data-ftml-term=\"OMA\" data-ftml-head=\"" + attr(f) + "\" data-ftml-id=\"fzo\">"
                + "<span data-ftml-arg=\"1\">" + oms(ZERO) + "</span>"
                + "<span data-ftml-arg=\"2\">" + oms(ONE) + "</span></span>");

        assertEquals(1, result.modules().size());
        assertEquals(m, result.modules().get(0).uri());
        var decl = assertInstanceOf(Declaration.Symbol.class, only(result));
        assertEquals(f, decl.uri());
        assertEquals(new ArgumentSpec(List.of(ArgumentMode.SIMPLE, ArgumentMode.SIMPLE)), decl.data().arity());

        var term = assertInstanceOf(DocumentElement.Term.class, result.document().elements().get(1));
        assertEquals(DOCUMENT.element("fzo"), term.uri());
        var application = assertInstanceOf(Term.Application.class, term.term());
        assertEquals(new Term.Symbol(f), application.head());
        assertEquals(List.of(
            new Argument.Simple(new Term.Symbol(symbol("zero"))),
            new Argument.Simple(new Term.Symbol(symbol("one")))), application.arguments());
    }
}
