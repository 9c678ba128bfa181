package work.lcod.ftml.keys;

import java.util.Optional;
import work.lcod.ftml.extraction.CloseFtmlElement;
import work.lcod.ftml.extraction.ExtractorState;
import work.lcod.ftml.extraction.FtmlExtractionException;
import work.lcod.ftml.extraction.OpenDomainElement;
import work.lcod.ftml.extraction.OpenNarrativeElement;
import work.lcod.ftml.model.term.ArgumentMode;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.VarOrSym;
import work.lcod.ftml.model.term.Variable;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.UriNames;

/**
 * Terms and their argument slots.
 */
final class TermRules {
    private TermRules() {}

    static void register(KeyRules.Builder rules) {
        rules.on(FtmlKey.TERM, TermRules::term)
            .on(FtmlKey.ARG, TermRules::arg)
            .on(FtmlKey.HEAD_TERM, (state, attrs, keys, node) ->
                KeyResult.domain(new OpenDomainElement.HeadTerm(node), CloseFtmlElement.HEAD_TERM))
            .on(FtmlKey.DEF_COMP, TermRules::defComp);
    }

    /**
     * Opens a term of kind {@code OMID}/{@code OMMOD}/{@code OMV} (references), {@code OMA},
     * {@code OMBIND}, {@code OML} or {@code complex}. Terms inside notation templates are only
     * presentation and are stripped of their term attributes.
     */
    private static KeyResult term(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        keys.remove(FtmlKey.NOTATION_ID, FtmlKey.HEAD, FtmlKey.ID);
        if (state.inNotation()) {
            attrs.take(FtmlKey.NOTATION_ID);
            attrs.take(FtmlKey.HEAD);
            attrs.take(FtmlKey.TERM);
            return KeyResult.NOTHING;
        }
        VarOrSym head = attrs.symbolOrVar(FtmlKey.HEAD);
        String kind = attrs.string(FtmlKey.TERM);
        String notation = attrs.optionalTyped(FtmlKey.NOTATION_ID,
            v -> UriNames.isId(v) ? Optional.of(v) : Optional.empty()).orElse(null);

        if (head instanceof VarOrSym.Var v && v.variable() instanceof Variable.Ref ref) {
            attrs.set(FtmlKey.HEAD, ref.declaration().toString());
        }

        switch (kind) {
            case "OMID":
            case "OMMOD":
            case "OMS":
            case "OMV":
                if (head instanceof VarOrSym.Sym sym) {
                    return KeyResult.domain(
                        new OpenDomainElement.SymbolReference(sym.uri(), notation), CloseFtmlElement.SYMBOL_REFERENCE);
                }
                return KeyResult.domain(
                    new OpenDomainElement.VariableReference(((VarOrSym.Var) head).variable(), notation),
                    CloseFtmlElement.VARIABLE_REFERENCE);
            case "OMA":
                return KeyResult.domain(
                    new OpenDomainElement.Application(head, notation, termUri(state, attrs)), CloseFtmlElement.APPLICATION);
            case "OMBIND":
                return KeyResult.domain(
                    new OpenDomainElement.Binding(head, notation, termUri(state, attrs)), CloseFtmlElement.BINDING);
            case "complex":
                return KeyResult.domain(
                    new OpenDomainElement.ComplexTerm(head, notation, termUri(state, attrs)), CloseFtmlElement.COMPLEX_TERM);
            case "OML":
                if (head instanceof VarOrSym.Var v && v.variable() instanceof Variable.Name name) {
                    return KeyResult.domain(new OpenDomainElement.Label(name.name()), CloseFtmlElement.LABEL);
                }
                if (head instanceof VarOrSym.Var v && v.variable() instanceof Variable.Ref ref) {
                    return KeyResult.domain(new OpenDomainElement.Label(ref.declaration().name()), CloseFtmlElement.LABEL);
                }
                throw FtmlExtractionException.invalidValue(FtmlKey.TERM);
            default:
                throw FtmlExtractionException.invalidValue(FtmlKey.TERM);
        }
    }

    /** Top-level terms get an element uri; nested ones are identified by their position. */
    private static DocumentElementUri termUri(ExtractorState state, Attributes attrs) {
        return state.isSubTerm() ? null : attrs.elementUriFromId("term");
    }

    private static KeyResult arg(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        String value = attrs.value(FtmlKey.ARG).map(String::trim)
            .orElseThrow(() -> FtmlExtractionException.missingKey(FtmlKey.ARG));
        ArgumentMode mode = attrs.optionalTyped(FtmlKey.ARG_MODE, ArgumentMode::parse).orElse(null);
        ArgumentPosition position = ArgumentPosition.parse(value, mode)
            .orElseThrow(() -> FtmlExtractionException.invalidValue(FtmlKey.ARG));
        keys.remove(FtmlKey.ARG, FtmlKey.ARG_MODE);
        if (state.inTerm() || state.topDomain() instanceof OpenDomainElement.InferenceRule) {
            return KeyResult.domain(new OpenDomainElement.Argument(position, node), CloseFtmlElement.ARGUMENT);
        }
        if (state.inNotation()) {
            return KeyResult.narrative(new OpenNarrativeElement.NotationArg(position), CloseFtmlElement.NOTATION_ARG);
        }
        throw FtmlExtractionException.notIn(FtmlKey.ARG, "open term");
    }

    private static KeyResult defComp(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        OpenDomainElement top = state.topDomain();
        if (!(top instanceof OpenDomainElement.SymbolReference
            || top instanceof OpenDomainElement.Application
            || top instanceof OpenDomainElement.Binding
            || top instanceof OpenDomainElement.Label
            || top instanceof OpenDomainElement.ComplexTerm
            || top instanceof OpenDomainElement.VariableReference)) {
            throw FtmlExtractionException.notIn(FtmlKey.DEF_COMP, "a term");
        }
        return KeyResult.domain(new OpenDomainElement.DefComp(), CloseFtmlElement.DEF_COMP);
    }
}
