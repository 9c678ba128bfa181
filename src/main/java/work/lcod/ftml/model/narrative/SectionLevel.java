package work.lcod.ftml.model.narrative;

import java.util.Optional;

public enum SectionLevel {
    PART,
    CHAPTER,
    SECTION,
    SUBSECTION,
    SUBSUBSECTION,
    PARAGRAPH,
    SUBPARAGRAPH;

    public static Optional<SectionLevel> fromNumber(int value) {
        SectionLevel[] levels = values();
        if (value < 0 || value >= levels.length) {
            return Optional.empty();
        }
        return Optional.of(levels[value]);
    }
}
