package work.lcod.ftml.model.narrative;

public enum ParagraphFormatting {
    BLOCK,
    INLINE,
    COLLAPSED
}
