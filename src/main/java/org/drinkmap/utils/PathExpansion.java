package org.drinkmap.utils;

/**
 * Expands {@code ${VAR}} references in configured paths.
 * <p>
 * A reference is looked up as a Java system property first and as an environment variable
 * second, so {@code -Dkey=value} overrides the environment:
 * <pre>
 * expand("${java.io.tmpdir}/drinkmap-storage") -&gt; "/tmp/drinkmap-storage"
 * expand("${HOME}/blobs")                       -&gt; "/home/app/blobs"
 * expand("/srv/blobs")                          -&gt; "/srv/blobs"
 * </pre>
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * @param path A path that may contain {@code ${VAR}} references, or null.
     * @return The path with every reference replaced; null if the input was null.
     * @throws IllegalArgumentException if a reference is unclosed or names an undefined variable.
     */
    public static String expand(final String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        final StringBuilder result = new StringBuilder(path.length());
        int pos = 0;
        while (pos < path.length()) {
            final int start = path.indexOf("${", pos);
            if (start == -1) {
                result.append(path, pos, path.length());
                break;
            }
            result.append(path, pos, start);

            final int end = path.indexOf('}', start + 2);
            if (end == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }
            final String name = path.substring(start + 2, end);
            final String value = lookup(name);
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + name + "}' in path: " + path);
            }
            result.append(value);
            pos = end + 1;
        }
        return result.toString();
    }

    private static String lookup(final String name) {
        final String property = System.getProperty(name);
        return property != null ? property : System.getenv(name);
    }
}
