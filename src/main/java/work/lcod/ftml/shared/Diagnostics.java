package work.lcod.ftml.shared;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import work.lcod.ftml.api.LogLevel;

/**
 * Level-filtered diagnostics sink shared by one extraction run.
 */
public final class Diagnostics {
    private final LogLevel threshold;
    private final PrintStream out;
    private final List<String> emitted = new ArrayList<>();

    public Diagnostics(LogLevel threshold, PrintStream out) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.out = out;
    }

    public static Diagnostics stderr(LogLevel threshold) {
        return new Diagnostics(threshold, System.err);
    }

    /** Collects messages without printing them. */
    public static Diagnostics silent(LogLevel threshold) {
        return new Diagnostics(threshold, null);
    }

    public void log(LogLevel level, String format, Object... args) {
        if (!threshold.allows(level)) {
            return;
        }
        String line = "[" + level.name().toLowerCase(Locale.ROOT) + "] " + String.format(format, args);
        emitted.add(line);
        if (out != null) {
            out.println(line);
        }
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    public void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    public LogLevel threshold() {
        return threshold;
    }

    public List<String> emitted() {
        return Collections.unmodifiableList(emitted);
    }
}
