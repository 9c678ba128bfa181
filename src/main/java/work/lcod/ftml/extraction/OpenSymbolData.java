package work.lcod.ftml.extraction;

import java.util.ArrayList;
import java.util.List;
import work.lcod.ftml.model.domain.AssocType;
import work.lcod.ftml.model.domain.SymbolData;
import work.lcod.ftml.model.narrative.VariableData;
import work.lcod.ftml.model.term.ArgumentSpec;
import work.lcod.ftml.model.term.Term;
import work.lcod.ftml.node.SourceRange;

/**
 * Mutable properties of a symbol or variable declaration while its element is open.
 * Type, definiens and return type are filled by nested components.
 */
public final class OpenSymbolData {
    private final ArgumentSpec arity;
    private final String macroname;
    private final List<String> role;
    private final AssocType assoctype;
    private final String reordering;
    private final SourceRange source;
    private Term tp;
    private Term df;
    private Term returnType;
    private List<Term> argumentTypes = new ArrayList<>();

    public OpenSymbolData(
        ArgumentSpec arity,
        String macroname,
        List<String> role,
        AssocType assoctype,
        String reordering,
        SourceRange source
    ) {
        this.arity = arity == null ? ArgumentSpec.NONE : arity;
        this.macroname = macroname;
        this.role = role == null ? List.of() : List.copyOf(role);
        this.assoctype = assoctype;
        this.reordering = reordering;
        this.source = source;
    }

    public ArgumentSpec arity() {
        return arity;
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

    public Term returnType() {
        return returnType;
    }

    public void returnType(Term type) {
        this.returnType = type;
    }

    public void argumentTypes(List<Term> types) {
        this.argumentTypes = new ArrayList<>(types);
    }

    public SymbolData toSymbolData() {
        return new SymbolData(arity, macroname, role, tp, df, returnType, argumentTypes, assoctype, reordering, source);
    }

    public VariableData toVariableData(boolean bind, boolean isSeq) {
        return new VariableData(
            arity, macroname, role, tp, df, returnType, argumentTypes, assoctype, reordering, bind, isSeq, source);
    }
}
