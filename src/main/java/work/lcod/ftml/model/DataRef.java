package work.lcod.ftml.model;

/**
 * Handle to a value serialized into the blob buffer of an extraction result.
 */
public record DataRef(int start, int end) {
    public DataRef {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid data ref " + start + ".." + end);
        }
    }

    public int length() {
        return end - start;
    }
}
