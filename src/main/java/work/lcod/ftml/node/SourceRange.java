package work.lcod.ftml.node;

/**
 * Character offsets into the source markup, end exclusive.
 */
public record SourceRange(int start, int end) {
    public static final SourceRange EMPTY = new SourceRange(0, 0);

    public SourceRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range " + start + ".." + end);
        }
    }
}
