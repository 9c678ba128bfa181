package work.lcod.ftml.model.problem;

import java.util.List;

public enum ChoiceBlockStyle {
    BLOCK,
    INLINE,
    DROPDOWN;

    /** {@code inline} or {@code dropdown} among the block's styles select that style. */
    public static ChoiceBlockStyle fromStyles(List<String> styles) {
        for (String style : styles) {
            if (style.equals("inline")) {
                return INLINE;
            }
            if (style.equals("dropdown")) {
                return DROPDOWN;
            }
        }
        return BLOCK;
    }
}
