package work.lcod.ftml.extraction;

import java.util.HashMap;
import java.util.Map;

/**
 * Generates document-unique ids per prefix: {@code p}, {@code p_1}, {@code p_2}, ...
 */
public final class IdCounter {
    /** Prefix of the anonymous structures that mark structure extensions. */
    public static final String EXTENSION_PREFIX = "EXTSTRUCT";

    private final Map<String, Integer> counts = new HashMap<>();
    private String forced;

    public IdCounter() {
        counts.put(EXTENSION_PREFIX, 0);
    }

    public String newId(String prefix) {
        if (forced != null) {
            String id = forced;
            forced = null;
            return id;
        }
        Integer previous = counts.get(prefix);
        if (previous == null) {
            counts.put(prefix, 0);
            return prefix;
        }
        int next = previous + 1;
        counts.put(prefix, next);
        return prefix + "_" + next;
    }

    /** The next call to {@link #newId} returns {@code id} regardless of its prefix. */
    public void forceNext(String id) {
        this.forced = id;
    }
}
