package work.lcod.ftml.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.DataRef;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.notation.Notation;
import work.lcod.ftml.model.notation.NotationComponent;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.VarOrSym;
import work.lcod.ftml.model.term.Variable;
import work.lcod.ftml.node.FtmlNode;

/**
 * Finalizers that assemble notation templates from their components.
 */
final class NotationFinalizers {
    private final ExtractorState state;

    NotationFinalizers(ExtractorState state) {
        this.state = state;
    }

    void closeNotation(OpenNarrativeElement.Notation open) {
        if (open.component() == null) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.NOTATION);
        }
        Notation notation = new Notation(
            open.id(), open.precedence(), open.argumentPrecedences(), open.component(), open.op());
        DataRef ref;
        try {
            ref = state.buffer().push(notation);
        } catch (JsonProcessingException ex) {
            throw FtmlExtractionException.encodingError(FtmlKey.NOTATION, ex.getOriginalMessage());
        }
        VarOrSym head = open.head();
        if (head instanceof VarOrSym.Sym sym) {
            state.addNotation(new NotationEntry(sym.uri(), open.uri(), notation));
            state.pushElem(new DocumentElement.Notation(sym.uri(), open.uri(), ref));
        } else if (((VarOrSym.Var) head).variable() instanceof Variable.Ref var) {
            state.addNotation(new NotationEntry(var.declaration(), open.uri(), notation));
            state.pushElem(new DocumentElement.VariableNotation(var.declaration(), open.uri(), ref));
        } else {
            throw FtmlExtractionException.invalidValue(FtmlKey.NOTATION);
        }
    }

    void closeNotationComp(OpenNarrativeElement.NotationComp comp) {
        NotationComponent component = NodeConversions.asNotation(comp.node(), comp.components());
        if (!(state.topNarrative() instanceof OpenNarrativeElement.Notation notation)) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.NOTATION_COMP);
        }
        notation.component(component);
    }

    /** Argument placeholders record the 1-based argument number. */
    void closeNotationArg(ArgumentPosition position, FtmlNode node) {
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.ComponentCollector collector) {
                collector.components().add(new PathedComponent(
                    new NotationComponent.Argument(position.argumentNumber(), position.mode()),
                    node.pathFrom(collector.node())));
                return;
            }
        }
        throw FtmlExtractionException.unexpectedEndOf(FtmlKey.ARG);
    }

    /**
     * A separator's first child is the sequence argument it separates; the remaining children form
     * the separator itself.
     */
    void closeArgSep(OpenNarrativeElement.ArgSep sep, FtmlNode node) {
        NotationComponent component = NodeConversions.asNotation(node, sep.components());
        if (!(component instanceof NotationComponent.Node n)
            || n.children().isEmpty()
            || !(n.children().get(0) instanceof NotationComponent.Argument arg)) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.ARG_SEP);
        }
        List<NotationComponent> separator = n.children().subList(1, n.children().size());
        if (!(state.topNarrative() instanceof OpenNarrativeElement.ComponentCollector collector)) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.NOTATION_COMP);
        }
        collector.components().add(new PathedComponent(
            new NotationComponent.ArgSep(arg.index(), arg.mode(), separator), node.pathFrom(collector.node())));
    }

    void closeNotationOp(FtmlNode node) {
        if (!(state.topNarrative() instanceof OpenNarrativeElement.Notation notation)) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.NOTATION_OP_COMP);
        }
        notation.op(NodeConversions.asComponent(node));
    }

    /** A head presentation inside a notation. The main one doubles as the notation's operator form. */
    void closeCompInNotation(FtmlNode node, boolean main) {
        NotationComponent.Node component = NodeConversions.asComponent(node);
        if (main) {
            for (OpenNarrativeElement frame : state.narrative()) {
                if (frame instanceof OpenNarrativeElement.Notation notation) {
                    notation.op(component);
                    break;
                }
                if (!(frame instanceof OpenNarrativeElement.Invisible
                    || frame instanceof OpenNarrativeElement.NotationComp
                    || frame instanceof OpenNarrativeElement.ArgSep)) {
                    throw FtmlExtractionException.unexpectedEndOf(FtmlKey.COMP);
                }
            }
        }
        OpenNarrativeElement top = state.topNarrative();
        if (top instanceof OpenNarrativeElement.ComponentCollector collector) {
            NotationComponent wrapped = main ? new NotationComponent.MainComp(component) : new NotationComponent.Comp(component);
            collector.components().add(new PathedComponent(wrapped, node.pathFrom(collector.node())));
        } else if (!(main && top instanceof OpenNarrativeElement.Notation)) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.COMP);
        }
    }
}
