package work.lcod.ftml.keys;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The FTML keys found on one node that still await their handler. Keys are handled in
 * declaration order; a handler removes the auxiliary keys it consumed.
 */
public final class KeyList {
    private final EnumSet<FtmlKey> keys = EnumSet.noneOf(FtmlKey.class);

    public KeyList() {}

    public KeyList(Set<FtmlKey> initial) {
        keys.addAll(initial);
    }

    public void add(FtmlKey key) {
        keys.add(key);
    }

    public void remove(FtmlKey... consumed) {
        for (FtmlKey key : consumed) {
            keys.remove(key);
        }
    }

    public boolean contains(FtmlKey key) {
        return keys.contains(key);
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public int size() {
        return keys.size();
    }

    /** Removes and returns the pending key with the lowest ordinal. */
    public Optional<FtmlKey> pop() {
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        FtmlKey first = keys.iterator().next();
        keys.remove(first);
        return Optional.of(first);
    }

    @Override
    public String toString() {
        return keys.toString();
    }
}
