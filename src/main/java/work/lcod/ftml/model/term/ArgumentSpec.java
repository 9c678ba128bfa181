package work.lcod.ftml.model.term;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Arity of a symbol: the mode of each argument position.
 */
public record ArgumentSpec(List<ArgumentMode> modes) {
    public static final ArgumentSpec NONE = new ArgumentSpec(List.of());

    public ArgumentSpec {
        modes = List.copyOf(modes);
    }

    public int arity() {
        return modes.size();
    }

    /** Either a plain count of simple arguments or a string of mode codes such as {@code iaB}. */
    public static Optional<ArgumentSpec> parse(String value) {
        String v = value.trim();
        if (v.isEmpty()) {
            return Optional.of(NONE);
        }
        if (v.chars().allMatch(Character::isDigit)) {
            try {
                int n = Integer.parseInt(v);
                if (n > 255) {
                    return Optional.empty();
                }
                return Optional.of(new ArgumentSpec(Collections.nCopies(n, ArgumentMode.SIMPLE)));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        List<ArgumentMode> modes = new ArrayList<>();
        for (char c : v.toCharArray()) {
            Optional<ArgumentMode> mode = ArgumentMode.fromCode(c);
            if (mode.isEmpty()) {
                return Optional.empty();
            }
            modes.add(mode.get());
        }
        return Optional.of(new ArgumentSpec(modes));
    }

    @JsonValue
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(modes.size());
        modes.forEach(m -> sb.append(m.code()));
        return sb.toString();
    }
}
