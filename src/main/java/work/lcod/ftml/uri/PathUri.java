package work.lcod.ftml.uri;

import java.util.Objects;

/**
 * An archive, optionally narrowed to a path inside it: {@code base?a=archive[&p=path]}.
 */
public record PathUri(String base, String archive, String path) implements FtmlUri {
    public PathUri {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(archive, "archive");
        if (path != null && path.isEmpty()) {
            path = null;
        }
    }

    public static PathUri of(String base, String archive) {
        return new PathUri(base, archive, null);
    }

    public PathUri withPath(String newPath) {
        return new PathUri(base, archive, newPath);
    }

    @Override
    public String toString() {
        return path == null ? base + "?a=" + archive : base + "?a=" + archive + "&p=" + path;
    }
}
