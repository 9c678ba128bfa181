package work.lcod.ftml.keys;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed vocabulary of ftml attributes. Declaration order is processing priority:
 * on one node, keys are handled lowest ordinal first.
 */
public enum FtmlKey {
    DOC_URI("document-uri"),
    DOC_TITLE("doctitle"),
    DOC_KIND("document-kind"),
    DOC_KIND_DATE("document-kind-date"),
    DOC_KIND_NUM("document-kind-num"),
    DOC_KIND_RETAKE("document-kind-retake"),
    DOC_KIND_COURSE("document-kind-course"),
    DOC_KIND_TERM("document-kind-term"),
    STYLE("style"),
    COUNTER("counter"),
    COUNTER_PARENT("counter-parent"),
    INPUT_REF("inputref"),
    IF_INPUTREF("ifinputref"),
    USE_MODULE("usemodule"),
    SECTION("section"),
    SKIP_SECTION("skipsection"),
    SET_SECTION_LEVEL("sectionlevel"),
    CURRENT_SECTION_LEVEL("currentsectionlevel"),
    CAPITALIZE("capitalize"),
    DEFINITION("definition"),
    ASSERTION("assertion"),
    EXAMPLE("example"),
    PROOF("proof"),
    SUB_PROOF("subproof"),
    PARAGRAPH("paragraph"),
    INLINE("inline"),
    FORS("fors"),
    PROOF_HIDE("proofhide"),
    PROOF_BODY("proofbody"),
    PROOF_METHOD("proofmethod"),
    PROOF_SKETCH("proofsketch"),
    PROOF_TERM("proofterm"),
    PROOF_ASSUMPTION("spfassumption"),
    PROOF_STEP("spfstep"),
    PROOF_STEP_NAME("stepname"),
    PROOF_EQ_STEP("spfeqstep"),
    PROOF_PREMISE("premise"),
    PROOF_CONCLUSION("spfconclusion"),
    PROBLEM("problem"),
    SUB_PROBLEM("subproblem"),
    PROBLEM_POINTS("problempoints"),
    PROBLEM_MINUTES("problemminutes"),
    AUTOGRADABLE("autogradable"),
    PRECONDITION_SYMBOL("preconditionsymbol"),
    PRECONDITION_DIMENSION("preconditiondimension"),
    OBJECTIVE_SYMBOL("objectivesymbol"),
    OBJECTIVE_DIMENSION("objectivedimension"),
    PROBLEM_SOLUTION("solution"),
    PROBLEM_HINT("problemhint"),
    PROBLEM_NOTE("problemnote"),
    PROBLEM_GRADING_NOTE("problemgnote"),
    ANSWER_CLASS("answerclass"),
    ANSWER_CLASS_PTS("answerclass-pts"),
    ANSWER_CLASS_FEEDBACK("answerclass-feedback"),
    PROBLEM_SINGLE_CHOICE_BLOCK("single-choice-block"),
    PROBLEM_MULTIPLE_CHOICE_BLOCK("multiple-choice-block"),
    PROBLEM_CHOICE("problem-choice"),
    PROBLEM_CHOICE_VERDICT("problem-choice-verdict"),
    PROBLEM_CHOICE_FEEDBACK("problem-choice-feedback"),
    PROBLEM_FILLINSOL("fillinsol"),
    PROBLEM_FILLINSOL_WIDTH("fillinsol-width"),
    PROBLEM_FILLINSOL_CASE("fillin-case"),
    PROBLEM_FILLINSOL_CASE_VALUE("fillin-case-value"),
    PROBLEM_FILLINSOL_CASE_VERDICT("fillin-case-verdict"),
    TITLE("title"),
    SLIDE("slide"),
    SLIDE_NUMBER("slide-number"),
    STYLES("styles"),
    MODULE("module"),
    METATHEORY("metatheory"),
    SIGNATURE("signature"),
    MATH_STRUCTURE("feature-structure"),
    IMPORT_MODULE("import"),
    MORPHISM("feature-morphism"),
    MORPHISM_DOMAIN("domain"),
    MORPHISM_TOTAL("total"),
    SYMDECL("symdecl"),
    VARDEF("vardef"),
    VARSEQ("varseq"),
    ASSIGN("assign"),
    INFERENCE_RULE("inferencerule"),
    RENAME("rename"),
    RENAME_TO("to"),
    ASSIGN_MORPHISM_FROM("assignmorphismfrom"),
    ASSIGN_MORPHISM_TO("assignmorphismto"),
    MACRONAME("macroname"),
    ASSOC_TYPE("assoctype"),
    ROLE("role"),
    ARGS("args"),
    ARGUMENT_REORDERING("reorderargs"),
    BIND("bind"),
    TYPE("type"),
    RETURN_TYPE("returntype"),
    ARG_TYPES("argtypes"),
    DEFINIENS("definiens"),
    CONCLUSION("conclusion"),
    TERM("term"),
    NOTATION_ID("notationid"),
    HEAD("head"),
    ARG("arg"),
    ARG_MODE("argmode"),
    HEAD_TERM("headterm"),
    NOTATION("notation"),
    NOTATION_COMP("notationcomp"),
    NOTATION_OP_COMP("notationopcomp"),
    ARG_SEP("argsep"),
    ARG_NUM("argnum"),
    ARG_MAP("argmap"),
    ARG_MAP_SEP("argmap-sep"),
    NOTATION_FRAGMENT("notationfragment"),
    PRECEDENCE("precedence"),
    ARGPRECS("argprecs"),
    COMP("comp"),
    VAR_COMP("varcomp"),
    MAIN_COMP("maincomp"),
    DEF_COMP("defcomp"),
    DEFINIENDUM("definiendum"),
    RULE("rule"),
    SREF("sref"),
    SREF_IN("srefin"),
    SLIDESHOW("slideshow"),
    SLIDESHOW_SLIDE("slideshow-slide"),
    LANGUAGE("language"),
    ID("id"),
    INVISIBLE("invisible");

    public static final String PREFIX = "data-ftml-";
    public static final int NUM_KEYS = 125;

    private static final Map<String, FtmlKey> BY_ATTRIBUTE = new HashMap<>();

    static {
        for (FtmlKey key : values()) {
            BY_ATTRIBUTE.put(key.attributeName, key);
        }
    }

    private final String keyName;
    private final String attributeName;

    FtmlKey(String keyName) {
        this.keyName = keyName;
        this.attributeName = PREFIX + keyName;
    }

    /** The name without prefix, e.g. {@code symdecl}. */
    public String keyName() {
        return keyName;
    }

    /** The full attribute name, e.g. {@code data-ftml-symdecl}. */
    public String attributeName() {
        return attributeName;
    }

    public static Optional<FtmlKey> fromAttribute(String attribute) {
        return Optional.ofNullable(BY_ATTRIBUTE.get(attribute));
    }

    public static boolean isFtmlAttribute(String attribute) {
        return attribute.startsWith(PREFIX);
    }

    @Override
    public String toString() {
        return keyName;
    }
}
