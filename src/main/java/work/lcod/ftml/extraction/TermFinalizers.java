package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import work.lcod.ftml.keys.FtmlKey;
import work.lcod.ftml.model.domain.Declaration;
import work.lcod.ftml.model.domain.ModuleData;
import work.lcod.ftml.model.narrative.DocumentElement;
import work.lcod.ftml.model.narrative.ForEntry;
import work.lcod.ftml.model.term.Argument;
import work.lcod.ftml.model.term.BoundArgument;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.model.term.VarOrSym;
import work.lcod.ftml.model.term.Variable;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.SymbolUri;

/**
 * Finalizers for terms and the term-valued components of declarations.
 */
final class TermFinalizers {
    private final ExtractorState state;

    TermFinalizers(ExtractorState state) {
        this.state = state;
    }

    void closeSymbolReference(OpenDomainElement.SymbolReference ref, FtmlNode node) {
        closeTerm(new Term.Symbol(ref.uri()), node, () -> state.pushElem(new DocumentElement.SymbolReference(
            node.range(), ref.uri(), ref.notation(), state.currentSourceRange())));
    }

    void closeVariableReference(OpenDomainElement.VariableReference ref, FtmlNode node) {
        closeTerm(new Term.Var(ref.variable()), node, () -> {
            if (ref.variable() instanceof Variable.Ref r) {
                state.pushElem(new DocumentElement.VariableReference(
                    node.range(), r.declaration(), ref.notation(), state.currentSourceRange()));
            }
        });
    }

    void closeApplication(OpenDomainElement.Application app, FtmlNode node) {
        List<Argument> arguments = new ArrayList<>(app.arguments().size());
        for (int i = 0; i < app.arguments().size(); i++) {
            OpenArgument open = app.arguments().get(i);
            Argument closed = open == null ? null : open.close();
            if (closed == null) {
                throw FtmlExtractionException.missingArgument(i + 1);
            }
            arguments.add(closed);
        }
        Term term = (app.headTerm() != null
            ? new Term.Application(app.headTerm(), arguments, app.head())
            : new Term.Application(app.head().toTerm(), arguments, null)).simplify();
        closeTerm(term, node, () -> topLevelTerm(app.uri(), term));
    }

    void closeBinding(OpenDomainElement.Binding binding, FtmlNode node) {
        List<BoundArgument> arguments = new ArrayList<>(binding.arguments().size());
        for (int i = 0; i < binding.arguments().size(); i++) {
            OpenBoundArgument open = binding.arguments().get(i);
            BoundArgument closed = open == null ? null : open.close();
            if (closed == null) {
                throw FtmlExtractionException.missingArgument(i + 1);
            }
            arguments.add(closed);
        }
        Term term = binding.headTerm() != null
            ? new Term.Bound(binding.headTerm(), arguments, binding.head())
            : new Term.Bound(binding.head().toTerm(), arguments, null);
        closeTerm(term, node, () -> topLevelTerm(binding.uri(), term));
    }

    void closeComplex(OpenDomainElement.ComplexTerm complex, FtmlNode node) {
        Term head = complex.headTerm();
        if (head == null) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.TERM);
        }
        Term term = withPresentation(head, complex.head());
        closeTerm(term, node, () -> topLevelTerm(complex.uri(), term));
    }

    void closeLabel(OpenDomainElement.Label label, FtmlNode node) {
        closeTerm(new Term.Label(label.name(), label.df(), label.tp()), node,
            () -> {
                throw FtmlExtractionException.unexpectedEndOf(FtmlKey.TERM);
            });
    }

    private static Term withPresentation(Term head, VarOrSym presentation) {
        if (head instanceof Term.Application a) {
            return new Term.Application(a.head(), a.arguments(), presentation);
        }
        if (head instanceof Term.Bound b) {
            return new Term.Bound(b.head(), b.arguments(), presentation);
        }
        return head;
    }

    private void topLevelTerm(DocumentElementUri uri, Term term) {
        if (uri == null) {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.TERM);
        }
        state.pushElem(new DocumentElement.Term(uri, term, state.currentSourceRange()));
    }

    /**
     * Hands a finished term to the collector on top of the domain stack. Notation components absorb
     * it; with no collector the term stands on its own and {@code standalone} runs.
     */
    private void closeTerm(Term term, FtmlNode node, Runnable standalone) {
        OpenDomainElement top = state.topDomain();
        if (top instanceof OpenDomainElement.TermCollector collector) {
            collector.terms().add(new PathedTerm(term, node.pathFrom(collector.node())));
            return;
        }
        if (top instanceof OpenDomainElement.ComplexTerm
            || top instanceof OpenDomainElement.Comp
            || top instanceof OpenDomainElement.DefComp) {
            return;
        }
        standalone.run();
    }

    void closeArgument(OpenDomainElement.Argument arg, FtmlNode node) {
        Term term = NodeConversions.asTerm(node, arg.terms()).simplify();
        OpenDomainElement top = state.topDomain();
        if (top instanceof OpenDomainElement.Application app) {
            OpenArgument.set(app.arguments(), arg.position(), term);
        } else if (top instanceof OpenDomainElement.Binding binding) {
            OpenBoundArgument.set(binding.arguments(), arg.position(), term);
        } else if (top instanceof OpenDomainElement.InferenceRule rule) {
            rule.parameters().add(term);
        } else {
            throw FtmlExtractionException.unexpectedEndOf(FtmlKey.ARG);
        }
    }

    void closeHeadTerm(OpenDomainElement.HeadTerm head, FtmlNode node) {
        Term term = NodeConversions.asTerm(node, head.terms()).simplify();
        if (state.topDomain() instanceof OpenDomainElement.HeadedTerm headed && headed.headTerm() == null) {
            headed.headTerm(term);
            return;
        }
        throw FtmlExtractionException.unexpectedEndOf(FtmlKey.HEAD_TERM);
    }

    void closeArgTypes(OpenDomainElement.ArgTypes types) {
        if (state.topDomain() instanceof OpenDomainElement.SymbolDeclaration decl && decl.data().tp() == null) {
            decl.data().argumentTypes(types.terms());
            return;
        }
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.VariableDeclaration v && v.data().tp() == null) {
                v.data().argumentTypes(types.terms());
                return;
            }
        }
        throw FtmlExtractionException.unexpectedEndOf(FtmlKey.ARG_TYPES);
    }

    void closeType(OpenDomainElement.Type type, FtmlNode node) {
        Term term = NodeConversions.asTerm(node, type.terms()).simplify();
        OpenDomainElement top = state.topDomain();
        if (top instanceof OpenDomainElement.SymbolDeclaration decl) {
            requireUnset(decl.data().tp(), FtmlKey.TYPE);
            decl.data().tp(term);
        } else if (top instanceof OpenDomainElement.Label label) {
            requireUnset(label.tp(), FtmlKey.TYPE);
            label.tp(term);
        } else if (top instanceof OpenDomainElement.Assign assign) {
            requireUnset(assign.refinedType(), FtmlKey.TYPE);
            assign.refinedType(term);
        } else if (top instanceof OpenDomainElement.ArgTypes types) {
            types.terms().add(term);
        } else {
            setOnVariable(FtmlKey.TYPE, v -> v.data().tp() == null, v -> v.data().tp(term));
        }
    }

    void closeReturnType(OpenDomainElement.ReturnType type, FtmlNode node) {
        Term term = NodeConversions.asTerm(node, type.terms()).simplify();
        if (state.topDomain() instanceof OpenDomainElement.SymbolDeclaration decl) {
            requireUnset(decl.data().returnType(), FtmlKey.RETURN_TYPE);
            decl.data().returnType(term);
            return;
        }
        setOnVariable(FtmlKey.RETURN_TYPE, v -> v.data().returnType() == null, v -> v.data().returnType(term));
    }

    private static void requireUnset(Object slot, FtmlKey key) {
        if (slot != null) {
            throw FtmlExtractionException.duplicateValue(key);
        }
    }

    private void setOnVariable(
        FtmlKey key,
        Predicate<OpenNarrativeElement.VariableDeclaration> free,
        Consumer<OpenNarrativeElement.VariableDeclaration> setter
    ) {
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.VariableDeclaration v && free.test(v)) {
                setter.accept(v);
                return;
            }
            if (!(frame instanceof OpenNarrativeElement.Invisible)) {
                break;
            }
        }
        throw FtmlExtractionException.unexpectedEndOf(key);
    }

    void closeDefiniens(OpenDomainElement.Definiens definiens, FtmlNode node) {
        Term term = NodeConversions.asTerm(node, definiens.terms()).simplify();
        OpenDomainElement top = state.topDomain();
        if (top instanceof OpenDomainElement.SymbolDeclaration decl) {
            requireUnset(decl.data().df(), FtmlKey.DEFINIENS);
            decl.data().df(term);
            return;
        }
        if (top instanceof OpenDomainElement.Label label) {
            requireUnset(label.df(), FtmlKey.DEFINIENS);
            label.df(term);
            return;
        }
        if (top instanceof OpenDomainElement.Assign assign) {
            requireUnset(assign.definiens(), FtmlKey.DEFINIENS);
            assign.definiens(term);
            return;
        }
        for (OpenNarrativeElement frame : state.narrative()) {
            if (frame instanceof OpenNarrativeElement.VariableDeclaration v && v.data().df() == null) {
                v.data().df(term);
                return;
            }
            if (frame instanceof OpenNarrativeElement.Paragraph p && p.isDefinitionLike()) {
                defineInParagraph(p, definiens.of(), term);
                return;
            }
            if (!(frame instanceof OpenNarrativeElement.Invisible)) {
                break;
            }
        }
        throw FtmlExtractionException.unexpectedEndOf(FtmlKey.DEFINIENS);
    }

    /** A definiens inside a definition defines the named symbol, or the paragraph's first subject. */
    private void defineInParagraph(OpenNarrativeElement.Paragraph paragraph, SymbolUri of, Term term) {
        List<ForEntry> fors = paragraph.fors();
        SymbolUri symbol = of;
        if (symbol == null) {
            if (fors.isEmpty()) {
                throw FtmlExtractionException.duplicateValue(FtmlKey.DEFINIENS);
            }
            symbol = fors.get(0).symbol();
        }
        if (!setSymbolDefiniens(symbol, term)) {
            state.diagnostics().debug("definiens for %s outside of its declaration", symbol);
        }
        for (int i = 0; i < fors.size(); i++) {
            if (fors.get(i).symbol().equals(symbol)) {
                fors.set(i, new ForEntry(symbol, term));
                return;
            }
        }
        fors.add(new ForEntry(symbol, term));
    }

    /**
     * Fills in the definiens of a symbol declared in this document, if it has none yet.
     *
     * @return whether the symbol was found
     */
    boolean setSymbolDefiniens(SymbolUri uri, Term df) {
        for (OpenDomainElement frame : state.domain()) {
            if (frame instanceof OpenDomainElement.SymbolDeclaration decl && decl.uri().equals(uri)) {
                if (decl.data().df() == null) {
                    decl.data().df(df);
                }
                return true;
            }
            if (frame instanceof OpenDomainElement.Module m && replaceIn(m.children(), uri, df)) {
                return true;
            }
            if (frame instanceof OpenDomainElement.MathStructure s && replaceIn(s.children(), uri, df)) {
                return true;
            }
        }
        List<ModuleData> modules = state.modules();
        for (int i = 0; i < modules.size(); i++) {
            ModuleData m = modules.get(i);
            List<Declaration> declarations = new ArrayList<>(m.declarations());
            if (replaceIn(declarations, uri, df)) {
                modules.set(i, new ModuleData(m.uri(), m.meta(), m.signature(), declarations, m.source()));
                return true;
            }
        }
        return false;
    }

    /** Replaces the matching declaration inside the mutable list {@code declarations}, descending into nested ones. */
    private static boolean replaceIn(List<Declaration> declarations, SymbolUri uri, Term df) {
        for (int i = 0; i < declarations.size(); i++) {
            Declaration d = declarations.get(i);
            if (d instanceof Declaration.Symbol s && s.uri().equals(uri)) {
                if (s.data().df() == null) {
                    declarations.set(i, new Declaration.Symbol(s.uri(), s.data().withDefiniens(df)));
                }
                return true;
            }
            if (d instanceof Declaration.NestedModule n) {
                List<Declaration> inner = new ArrayList<>(n.declarations());
                if (replaceIn(inner, uri, df)) {
                    declarations.set(i, new Declaration.NestedModule(n.uri(), inner, n.source()));
                    return true;
                }
            } else if (d instanceof Declaration.MathStructure s) {
                List<Declaration> inner = new ArrayList<>(s.elements());
                if (replaceIn(inner, uri, df)) {
                    declarations.set(i, new Declaration.MathStructure(s.uri(), s.macroname(), inner, s.source()));
                    return true;
                }
            } else if (d instanceof Declaration.Extension e) {
                List<Declaration> inner = new ArrayList<>(e.elements());
                if (replaceIn(inner, uri, df)) {
                    declarations.set(i, new Declaration.Extension(e.uri(), e.target(), inner, e.source()));
                    return true;
                }
            }
        }
        return false;
    }
}
