package work.lcod.ftml.extraction;

/**
 * Scheduled close directives; each selects the finalizer run when the node that opened it is left.
 */
public enum CloseFtmlElement {
    MODULE,
    SYMBOL_DECLARATION,
    VARIABLE_DECLARATION,
    INVISIBLE,
    SECTION,
    SECTION_TITLE,
    PARAGRAPH_TITLE,
    SLIDE_TITLE,
    PROBLEM_TITLE,
    SKIP_SECTION,
    SYMBOL_REFERENCE,
    VARIABLE_REFERENCE,
    APPLICATION,
    BINDING,
    ARGUMENT,
    NOTATION_ARG,
    TYPE,
    RETURN_TYPE,
    DEFINIENS,
    NOTATION,
    COMP_IN_NOTATION,
    MAIN_COMP_IN_NOTATION,
    NOTATION_COMP,
    NOTATION_OP_COMP,
    ARG_SEP,
    DOC_TITLE,
    COMP,
    DEF_COMP,
    PARAGRAPH,
    DEFINIENDUM,
    MATH_STRUCTURE,
    COMPLEX_TERM,
    HEAD_TERM,
    LABEL,
    MORPHISM,
    ASSIGN,
    SLIDE,
    PROBLEM,
    SOLUTION,
    FILLIN_SOL,
    PROBLEM_HINT,
    PROBLEM_EX_NOTE,
    PROBLEM_GRADING_NOTE,
    ANSWER_CLASS,
    CHOICE_BLOCK,
    PROBLEM_CHOICE,
    PROBLEM_CHOICE_VERDICT,
    PROBLEM_CHOICE_FEEDBACK,
    ARG_TYPES,
    FILLIN_SOL_CASE,
    RULE
}
