package work.lcod.ftml.keys;

import java.util.List;
import java.util.Optional;
import work.lcod.ftml.extraction.CloseFtmlElement;
import work.lcod.ftml.extraction.ExtractorState;
import work.lcod.ftml.extraction.FtmlExtractionException;
import work.lcod.ftml.extraction.MetaDatum;
import work.lcod.ftml.extraction.OpenDomainElement;
import work.lcod.ftml.extraction.OpenNarrativeElement;
import work.lcod.ftml.extraction.OpenSymbolData;
import work.lcod.ftml.model.domain.AssocType;
import work.lcod.ftml.model.term.ArgumentSpec;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;
import work.lcod.ftml.uri.UriNames;

/**
 * Modules, structures, morphisms and the declarations inside them.
 */
final class DomainRules {
    private DomainRules() {}

    static void register(KeyRules.Builder rules) {
        rules.on(FtmlKey.MODULE, DomainRules::module)
            .on(FtmlKey.MATH_STRUCTURE, DomainRules::mathStructure)
            .on(FtmlKey.IMPORT_MODULE, (state, attrs, keys, node) ->
                KeyResult.meta(new MetaDatum.ImportModule(attrs.takeSymbolOrModuleUri(FtmlKey.IMPORT_MODULE))))
            .on(FtmlKey.MORPHISM, DomainRules::morphism)
            .on(FtmlKey.SYMDECL, DomainRules::symdecl)
            .on(FtmlKey.VARDEF, variable(FtmlKey.VARDEF, false))
            .on(FtmlKey.VARSEQ, variable(FtmlKey.VARSEQ, true))
            .on(FtmlKey.ASSIGN, (state, attrs, keys, node) ->
                KeyResult.domain(new OpenDomainElement.Assign(attrs.takeSymbolUri(FtmlKey.ASSIGN)), CloseFtmlElement.ASSIGN))
            .on(FtmlKey.INFERENCE_RULE, DomainRules::inferenceRule)
            .on(FtmlKey.RENAME, DomainRules::rename)
            .on(FtmlKey.TYPE, (state, attrs, keys, node) ->
                KeyResult.domain(new OpenDomainElement.Type(node), CloseFtmlElement.TYPE))
            .on(FtmlKey.RETURN_TYPE, DomainRules::returnType)
            .on(FtmlKey.ARG_TYPES, DomainRules::argTypes)
            .on(FtmlKey.DEFINIENS, (state, attrs, keys, node) -> KeyResult.domain(
                new OpenDomainElement.Definiens(node, attrs.optionalUri(FtmlKey.DEFINIENS, SymbolUri::parse).orElse(null)),
                CloseFtmlElement.DEFINIENS))
            .on(FtmlKey.DEFINIENDUM, (state, attrs, keys, node) -> KeyResult.narrative(
                new OpenNarrativeElement.Definiendum(attrs.symbolUri(FtmlKey.DEFINIENDUM)), CloseFtmlElement.DEFINIENDUM));
    }

    private static KeyResult module(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        ModuleUri uri = attrs.takeNewModuleUri(FtmlKey.MODULE);
        attrs.take(FtmlKey.LANGUAGE);
        ModuleUri meta = attrs.takeOptionalUri(FtmlKey.METATHEORY, ModuleUri::parse).orElse(null);
        String signature = attrs.takeLanguage(FtmlKey.SIGNATURE).orElse(null);
        keys.remove(FtmlKey.LANGUAGE, FtmlKey.METATHEORY, FtmlKey.SIGNATURE);
        return KeyResult.both(
            new OpenDomainElement.Module(uri, meta, signature),
            new OpenNarrativeElement.Module(uri),
            CloseFtmlElement.MODULE);
    }

    private static KeyResult mathStructure(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        SymbolUri uri = attrs.takeNewSymbolUri(FtmlKey.MATH_STRUCTURE, FtmlKey.MATH_STRUCTURE);
        String macroname = attrs.takeOptional(FtmlKey.MACRONAME).orElse(null);
        keys.remove(FtmlKey.MACRONAME);
        return KeyResult.both(
            new OpenDomainElement.MathStructure(uri, macroname),
            new OpenNarrativeElement.MathStructure(uri),
            CloseFtmlElement.MATH_STRUCTURE);
    }

    private static KeyResult morphism(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        SymbolUri uri = attrs.takeNewSymbolUri(FtmlKey.MORPHISM, FtmlKey.MORPHISM);
        ModuleUri domain = attrs.takeSymbolOrModuleUri(FtmlKey.MORPHISM_DOMAIN);
        boolean total = attrs.takeBool(FtmlKey.MORPHISM_TOTAL);
        keys.remove(FtmlKey.MORPHISM_DOMAIN, FtmlKey.MORPHISM_TOTAL);
        return KeyResult.both(
            new OpenDomainElement.Morphism(uri, domain, total),
            new OpenNarrativeElement.Morphism(uri),
            CloseFtmlElement.MORPHISM);
    }

    /** Reads the shared declaration attributes of symbols and variables and consumes their keys. */
    private static OpenSymbolData symbolData(ExtractorState state, Attributes attrs, KeyList keys) {
        List<String> role = attrs.typedList(FtmlKey.ROLE, v -> UriNames.isId(v) ? Optional.of(v) : Optional.empty());
        AssocType assoctype = attrs.optionalTyped(FtmlKey.ASSOC_TYPE, AssocType::parse).orElse(null);
        ArgumentSpec arity = attrs.optionalTyped(FtmlKey.ARGS, ArgumentSpec::parse).orElse(ArgumentSpec.NONE);
        String reordering = attrs.optional(FtmlKey.ARGUMENT_REORDERING).orElse(null);
        String macroname = attrs.optional(FtmlKey.MACRONAME).orElse(null);
        keys.remove(FtmlKey.ROLE, FtmlKey.ASSOC_TYPE, FtmlKey.ARGS, FtmlKey.ARGUMENT_REORDERING, FtmlKey.MACRONAME);
        return new OpenSymbolData(arity, macroname, role, assoctype, reordering, state.currentSourceRange());
    }

    private static KeyResult symdecl(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        SymbolUri uri = attrs.newSymbolUri(FtmlKey.SYMDECL, FtmlKey.SYMDECL);
        OpenSymbolData data = symbolData(state, attrs, keys);
        return KeyResult.domain(new OpenDomainElement.SymbolDeclaration(uri, data), CloseFtmlElement.SYMBOL_DECLARATION);
    }

    private static KeyHandler variable(FtmlKey key, boolean isSeq) {
        return (state, attrs, keys, node) -> {
            String name = attrs.string(key);
            if (!UriNames.isName(name)) {
                throw FtmlExtractionException.invalidValue(key);
            }
            DocumentElementUri uri = state.narrativeUri().element(name);
            OpenSymbolData data = symbolData(state, attrs, keys);
            boolean bind = attrs.bool(FtmlKey.BIND);
            keys.remove(FtmlKey.BIND);
            return KeyResult.narrative(
                new OpenNarrativeElement.VariableDeclaration(uri, data, bind, isSeq),
                CloseFtmlElement.VARIABLE_DECLARATION);
        };
    }

    private static KeyResult inferenceRule(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        String id = attrs.string(FtmlKey.INFERENCE_RULE);
        if (!UriNames.isId(id)) {
            throw FtmlExtractionException.invalidValue(FtmlKey.INFERENCE_RULE);
        }
        return KeyResult.domain(new OpenDomainElement.InferenceRule(id), CloseFtmlElement.RULE);
    }

    private static KeyResult rename(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        SymbolUri source = attrs.takeSymbolUri(FtmlKey.RENAME);
        String name = attrs.takeTyped(FtmlKey.RENAME_TO,
            v -> UriNames.isId(v) ? Optional.of(v) : Optional.empty()).orElse(null);
        String macroname = attrs.takeOptional(FtmlKey.MACRONAME).orElse(null);
        keys.remove(FtmlKey.RENAME_TO, FtmlKey.MACRONAME);
        return KeyResult.meta(new MetaDatum.Rename(source, name, macroname));
    }

    private static KeyResult returnType(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        if (state.inTerm()) {
            throw FtmlExtractionException.invalidIn(FtmlKey.RETURN_TYPE, "terms");
        }
        return KeyResult.domain(new OpenDomainElement.ReturnType(node), CloseFtmlElement.RETURN_TYPE);
    }

    private static KeyResult argTypes(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        if (state.inTerm()) {
            throw FtmlExtractionException.invalidIn(FtmlKey.RETURN_TYPE, "terms");
        }
        return KeyResult.domain(new OpenDomainElement.ArgTypes(), CloseFtmlElement.ARG_TYPES);
    }
}
