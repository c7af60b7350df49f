package tuftrust.model;

import java.util.Collection;

/**
 * Prefix path patterns.
 */
public final class Paths {

    private Paths() {}

    public static boolean matches(String pattern, String name) {
        return name.startsWith(pattern);
    }

    public static boolean matchesAny(Collection<String> patterns, String name) {
        for (String p : patterns) {
            if (matches(p, name)) {
                return true;
            }
        }
        return false;
    }

    /** A child pattern is covered when some parent pattern is a prefix of it. */
    public static boolean isCovered(String child, Collection<String> parentPatterns) {
        return matchesAny(parentPatterns, child);
    }
}
