package work.lcod.ftml.keys;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.ftml.extraction.AnyOpen;
import work.lcod.ftml.extraction.CloseFtmlElement;
import work.lcod.ftml.extraction.ExtractorState;
import work.lcod.ftml.extraction.FtmlExtractionException;
import work.lcod.ftml.extraction.OpenDomainElement;
import work.lcod.ftml.extraction.OpenNarrativeElement;
import work.lcod.ftml.model.term.ArgumentMode;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.VarOrSym;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.UriNames;

/**
 * Notation templates and the head components that mark a symbol's presentation.
 */
final class NotationRules {
    private static final FtmlKey[] COMPONENT_KEYS = {
        FtmlKey.TERM, FtmlKey.HEAD, FtmlKey.NOTATION_ID, FtmlKey.INVISIBLE
    };

    private NotationRules() {}

    static void register(KeyRules.Builder rules) {
        rules.on(FtmlKey.NOTATION, NotationRules::notation)
            .on(FtmlKey.NOTATION_COMP, NotationRules::notationComp)
            .on(FtmlKey.NOTATION_OP_COMP, NotationRules::notationOpComp)
            .on(FtmlKey.ARG_SEP, NotationRules::argSep)
            .on(FtmlKey.ARG_NUM, NotationRules::argNum)
            .on(FtmlKey.COMP, comp(false))
            .on(FtmlKey.VAR_COMP, comp(false))
            .on(FtmlKey.MAIN_COMP, comp(true));
    }

    private static KeyResult notation(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        VarOrSym head = attrs.symbolOrVar(FtmlKey.NOTATION);
        String id = attrs.optionalTyped(FtmlKey.NOTATION_FRAGMENT,
            v -> UriNames.isId(v) ? Optional.of(v) : Optional.empty()).orElse(null);
        DocumentElementUri uri = state.narrativeUri().element(id != null ? id : state.newId("notation"));
        long precedence = attrs.optionalTyped(FtmlKey.PRECEDENCE, KeyRules::parseLong).orElse(0L);
        List<Long> argprecs = new ArrayList<>(attrs.typedList(FtmlKey.ARGPRECS, KeyRules::parseLong));
        keys.remove(FtmlKey.NOTATION_FRAGMENT, FtmlKey.PRECEDENCE, FtmlKey.ARGPRECS);
        return KeyResult.narrative(
            new OpenNarrativeElement.Notation(uri, id, head, precedence, argprecs), CloseFtmlElement.NOTATION);
    }

    /** Removes the term markup a component carries; inside a template it only shows presentation. */
    private static void stripComponent(Attributes attrs, KeyList keys, FtmlKey own) {
        keys.remove(own);
        keys.remove(COMPONENT_KEYS);
        attrs.take(own);
        for (FtmlKey key : COMPONENT_KEYS) {
            attrs.take(key);
        }
    }

    private static KeyResult notationComp(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        if (!state.inNotation()) {
            throw FtmlExtractionException.invalidIn(FtmlKey.NOTATION_COMP, "outside of a notation");
        }
        stripComponent(attrs, keys, FtmlKey.NOTATION_COMP);
        return KeyResult.narrative(new OpenNarrativeElement.NotationComp(node), CloseFtmlElement.NOTATION_COMP);
    }

    private static KeyResult notationOpComp(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        stripComponent(attrs, keys, FtmlKey.NOTATION_OP_COMP);
        return KeyResult.closeOnly(CloseFtmlElement.NOTATION_OP_COMP);
    }

    private static KeyResult argSep(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        stripComponent(attrs, keys, FtmlKey.ARG_SEP);
        return KeyResult.narrative(new OpenNarrativeElement.ArgSep(node), CloseFtmlElement.ARG_SEP);
    }

    /** An argument marker; redundant when it repeats the argument that is already open. */
    private static KeyResult argNum(ExtractorState state, Attributes attrs, KeyList keys, FtmlNode node) {
        int index = attrs.typed(FtmlKey.ARG_NUM,
            v -> KeyRules.parseInt(v).filter(i -> i >= 1 && i <= 255));
        ArgumentPosition position = new ArgumentPosition.Simple(index, ArgumentMode.SIMPLE);
        if (state.topNarrative() instanceof OpenNarrativeElement.NotationArg open
            && open.position().index() == position.index()) {
            return KeyResult.NOTHING;
        }
        if (state.inNotation()) {
            return KeyResult.narrative(new OpenNarrativeElement.NotationArg(position), CloseFtmlElement.NOTATION_ARG);
        }
        throw FtmlExtractionException.notIn(FtmlKey.ARG_NUM, "notations");
    }

    private static KeyHandler comp(boolean main) {
        return (state, attrs, keys, node) -> {
            if (state.inNotation()) {
                keys.remove(FtmlKey.COMP, FtmlKey.VAR_COMP, FtmlKey.MAIN_COMP);
                keys.remove(COMPONENT_KEYS);
                for (FtmlKey key : new FtmlKey[] {FtmlKey.COMP, FtmlKey.VAR_COMP, FtmlKey.MAIN_COMP}) {
                    attrs.take(key);
                }
                for (FtmlKey key : COMPONENT_KEYS) {
                    attrs.take(key);
                }
                return new KeyResult(AnyOpen.NOTHING,
                    main ? CloseFtmlElement.MAIN_COMP_IN_NOTATION : CloseFtmlElement.COMP_IN_NOTATION);
            }
            return KeyResult.domain(new OpenDomainElement.Comp(), CloseFtmlElement.COMP);
        };
    }
}
