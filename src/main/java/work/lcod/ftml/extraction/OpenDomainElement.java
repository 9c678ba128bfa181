package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.List;
import work.lcod.ftml.model.domain.Assignment;
import work.lcod.ftml.model.domain.Declaration;
import work.lcod.ftml.model.term.ArgumentPosition;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.model.term.VarOrSym;
import work.lcod.ftml.model.term.Variable;
import work.lcod.ftml.node.FtmlNode;
import work.lcod.ftml.uri.DocumentElementUri;
import work.lcod.ftml.uri.ModuleUri;
import work.lcod.ftml.uri.SymbolUri;

/**
 * Frames of the domain stack: declarations and the terms being assembled inside them.
 */
public sealed interface OpenDomainElement {

    /** Frames that collect candidate sub-terms by path below their own node. */
    interface TermCollector {
        List<PathedTerm> terms();

        FtmlNode node();
    }

    /** Term frames that accept an explicit head term replacing their head. */
    interface HeadedTerm {
        VarOrSym head();

        Term headTerm();

        void headTerm(Term term);
    }

    record Module(ModuleUri uri, ModuleUri meta, String signature, List<Declaration> children)
        implements OpenDomainElement {
        public Module(ModuleUri uri, ModuleUri meta, String signature) {
            this(uri, meta, signature, new ArrayList<>());
        }
    }

    record Morphism(SymbolUri uri, ModuleUri domain, boolean total, List<Assignment> children)
        implements OpenDomainElement {
        public Morphism(SymbolUri uri, ModuleUri domain, boolean total) {
            this(uri, domain, total, new ArrayList<>());
        }
    }

    record MathStructure(SymbolUri uri, String macroname, List<Declaration> children) implements OpenDomainElement {
        public MathStructure(SymbolUri uri, String macroname) {
            this(uri, macroname, new ArrayList<>());
        }
    }

    record SymbolDeclaration(SymbolUri uri, OpenSymbolData data) implements OpenDomainElement {}

    record SymbolReference(SymbolUri uri, String notation) implements OpenDomainElement {}

    record VariableReference(Variable variable, String notation) implements OpenDomainElement {}

    /** An application term ({@code OMA}); {@code uri} is null for terms nested in other terms. */
    final class Application implements OpenDomainElement, HeadedTerm {
        private final VarOrSym head;
        private final String notation;
        private final DocumentElementUri uri;
        private final List<OpenArgument> arguments = new ArrayList<>();
        private Term headTerm;

        public Application(VarOrSym head, String notation, DocumentElementUri uri) {
            this.head = head;
            this.notation = notation;
            this.uri = uri;
        }

        @Override
        public VarOrSym head() {
            return head;
        }

        public String notation() {
            return notation;
        }

        public DocumentElementUri uri() {
            return uri;
        }

        public List<OpenArgument> arguments() {
            return arguments;
        }

        @Override
        public Term headTerm() {
            return headTerm;
        }

        @Override
        public void headTerm(Term term) {
            this.headTerm = term;
        }
    }

    /** A binding term ({@code OMBIND}). */
    final class Binding implements OpenDomainElement, HeadedTerm {
        private final VarOrSym head;
        private final String notation;
        private final DocumentElementUri uri;
        private final List<OpenBoundArgument> arguments = new ArrayList<>();
        private Term headTerm;

        public Binding(VarOrSym head, String notation, DocumentElementUri uri) {
            this.head = head;
            this.notation = notation;
            this.uri = uri;
        }

        @Override
        public VarOrSym head() {
            return head;
        }

        public String notation() {
            return notation;
        }

        public DocumentElementUri uri() {
            return uri;
        }

        public List<OpenBoundArgument> arguments() {
            return arguments;
        }

        @Override
        public Term headTerm() {
            return headTerm;
        }

        @Override
        public void headTerm(Term term) {
            this.headTerm = term;
        }
    }

    /** A label term ({@code OML}) with optional type and definiens. */
    final class Label implements OpenDomainElement {
        private final String name;
        private Term tp;
        private Term df;

        public Label(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public Term tp() {
            return tp;
        }

        public void tp(Term type) {
            this.tp = type;
        }

        public Term df() {
            return df;
        }

        public void df(Term definiens) {
            this.df = definiens;
        }
    }

    record InferenceRule(String rule, List<Term> parameters) implements OpenDomainElement {
        public InferenceRule(String rule) {
            this(rule, new ArrayList<>());
        }
    }

    final class ComplexTerm implements OpenDomainElement, HeadedTerm {
        private final VarOrSym head;
        private final String notation;
        private final DocumentElementUri uri;
        private Term headTerm;

        public ComplexTerm(VarOrSym head, String notation, DocumentElementUri uri) {
            this.head = head;
            this.notation = notation;
            this.uri = uri;
        }

        @Override
        public VarOrSym head() {
            return head;
        }

        public String notation() {
            return notation;
        }

        public DocumentElementUri uri() {
            return uri;
        }

        @Override
        public Term headTerm() {
            return headTerm;
        }

        @Override
        public void headTerm(Term term) {
            this.headTerm = term;
        }
    }

    record Argument(ArgumentPosition position, List<PathedTerm> terms, FtmlNode node)
        implements OpenDomainElement, TermCollector {
        public Argument(ArgumentPosition position, FtmlNode node) {
            this(position, new ArrayList<>(), node);
        }
    }

    record HeadTerm(List<PathedTerm> terms, FtmlNode node) implements OpenDomainElement, TermCollector {
        public HeadTerm(FtmlNode node) {
            this(new ArrayList<>(), node);
        }
    }

    record Type(List<PathedTerm> terms, FtmlNode node) implements OpenDomainElement, TermCollector {
        public Type(FtmlNode node) {
            this(new ArrayList<>(), node);
        }
    }

    record ReturnType(List<PathedTerm> terms, FtmlNode node) implements OpenDomainElement, TermCollector {
        public ReturnType(FtmlNode node) {
            this(new ArrayList<>(), node);
        }
    }

    record ArgTypes(List<Term> terms) implements OpenDomainElement {
        public ArgTypes() {
            this(new ArrayList<>());
        }
    }

    /** {@code of} names the symbol being defined, when given explicitly. */
    record Definiens(List<PathedTerm> terms, FtmlNode node, SymbolUri of) implements OpenDomainElement, TermCollector {
        public Definiens(FtmlNode node, SymbolUri of) {
            this(new ArrayList<>(), node, of);
        }
    }

    record Comp() implements OpenDomainElement {}

    record DefComp() implements OpenDomainElement {}

    final class Assign implements OpenDomainElement {
        private final SymbolUri source;
        private Term refinedType;
        private Term definiens;

        public Assign(SymbolUri source) {
            this.source = source;
        }

        public SymbolUri source() {
            return source;
        }

        public Term refinedType() {
            return refinedType;
        }

        public void refinedType(Term type) {
            this.refinedType = type;
        }

        public Term definiens() {
            return definiens;
        }

        public void definiens(Term df) {
            this.definiens = df;
        }
    }
}
