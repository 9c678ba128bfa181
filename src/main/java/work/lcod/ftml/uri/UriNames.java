package work.lcod.ftml.uri;

/**
 * Validation of the name and id segments that make up uris.
 */
public final class UriNames {
    private UriNames() {}

    /** A single segment: non-empty, no separators. */
    public static boolean isId(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '/' || c == '?' || c == '&' || c == '=' || c == '\\' || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }

    /** One or more ids joined by {@code /}. */
    public static boolean isName(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (String segment : value.split("/", -1)) {
            if (!isId(segment)) {
                return false;
            }
        }
        return true;
    }

    static String requireName(String value, String what) throws UriParseException {
        if (!isName(value)) {
            throw new UriParseException("invalid " + what + " name: " + value);
        }
        return value;
    }

    static String requireId(String value, String what) throws UriParseException {
        if (!isId(value)) {
            throw new UriParseException("invalid " + what + " id: " + value);
        }
        return value;
    }

    static String lastSegment(String name) {
        int idx = name.lastIndexOf('/');
        return idx < 0 ? name : name.substring(idx + 1);
    }
}
