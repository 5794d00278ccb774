package com.questrail.dbus.handler;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * PathPattern
 * =============================================================================
 * Shell-style glob over object paths, compiled once.
 *
 * <ul>
 *   <li>{@code *} matches any run of characters, including {@code /};</li>
 *   <li>{@code ?} matches exactly one character;</li>
 *   <li>{@code [abc]} / {@code [a-z]} match one character from the set,
 *       {@code [!abc]} one character outside it.</li>
 * </ul>
 * The whole path must match. A pattern without wildcards matches only the
 * identical path, so {@code /foo/*} matches {@code /foo/bar} but neither
 * {@code /foo} nor {@code /other/bar}.
 */
public final class PathPattern
{
    private final String glob;
    private final Pattern regex;
    private final boolean literal;

    private PathPattern(String glob) {
        this.glob = glob;
        this.literal = glob.chars().noneMatch(c -> c == '*' || c == '?' || c == '[');
        this.regex = literal ? null : Pattern.compile(translate(glob));
    }

    public static PathPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        if (glob.isEmpty()) {
            throw new IllegalArgumentException("path pattern must not be empty");
        }
        return new PathPattern(glob);
    }

    public boolean matches(String path) {
        if (path == null) {
            return false;
        }
        return literal ? glob.equals(path) : regex.matcher(path).matches();
    }

    public String glob() {
        return glob;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern && ((PathPattern) o).glob.equals(glob);
    }

    @Override
    public int hashCode() {
        return glob.hashCode();
    }

    @Override
    public String toString() {
        return glob;
    }

    private static String translate(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    // Unterminated class: a literal '['.
                    sb.append("\\[");
                    continue;
                }
                String body = glob.substring(i, j)
                        .replace("\\", "\\\\")
                        .replace("[", "\\[")
                        .replace("]", "\\]")
                        .replace("&", "\\&");
                i = j + 1;
                if (body.startsWith("!")) {
                    body = "^" + body.substring(1);
                } else if (body.startsWith("^")) {
                    body = "\\" + body;
                }
                sb.append('[').append(body).append(']');
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }
}
