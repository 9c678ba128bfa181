package work.lcod.ftml.model.term;

/**
 * A variable bound by a binder, with its optional type and definiens.
 */
public record ComponentVar(Variable variable, Term tp, Term df) {
    public static ComponentVar of(Variable variable) {
        return new ComponentVar(variable, null, null);
    }
}
