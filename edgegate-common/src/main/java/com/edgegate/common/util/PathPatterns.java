package com.edgegate.common.util;

/**
 * Gateway path pattern matching.
 *
 * Supported forms:
 * - {@code /prefix/**} matches the prefix itself and anything below it
 * - {@code /prefix/*} matches exactly one segment below the prefix
 * - anything else matches the path exactly
 */
public final class PathPatterns {

    private PathPatterns() {
    }

    public static boolean matches(String path, String pattern) {
        if (path == null || pattern == null) {
            return false;
        }
        pattern = pattern.trim();

        if (pattern.endsWith("/**")) {
            String prefix = pattern.substring(0, pattern.length() - 3);
            return path.equals(prefix) || path.startsWith(prefix + "/");
        } else if (pattern.endsWith("/*")) {
            String prefix = pattern.substring(0, pattern.length() - 2);
            if (!path.startsWith(prefix + "/")) {
                return false;
            }
            String rest = path.substring(prefix.length() + 1);
            return !rest.isEmpty() && !rest.contains("/");
        } else {
            return path.equals(pattern);
        }
    }

    /**
     * Remove a version prefix such as {@code /api/v1} from the front of a path.
     * Paths that do not start with the prefix are returned unchanged.
     */
    public static String stripPrefix(String path, String prefix) {
        if (prefix == null || prefix.isEmpty() || path == null) {
            return path;
        }
        String normalized = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        if (path.equals(normalized)) {
            return "/";
        }
        if (path.startsWith(normalized + "/")) {
            return path.substring(normalized.length());
        }
        return path;
    }
}
