package com.github.dimitryivaniuta.temporalcache.policy;

import java.util.regex.Pattern;

/**
 * Shell-style glob matched against the whole key.
 *
 * <p>{@code *} matches any run of characters including {@code /}, {@code ?} one character,
 * {@code [abc]}, {@code [a-z]} and {@code [!abc]} a character class. A {@code [} without a
 * closing bracket is a literal.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern pattern;

    private GlobPattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobPattern compile(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new CacheConfigurationException("Glob pattern must not be empty");
        }
        return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    public boolean matches(String key) {
        return pattern.matcher(key).matches();
    }

    public String glob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int n = glob.length();
        int i = 0;
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                while (i < n && glob.charAt(i) == '*') i++;
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') j++;
                if (j < n && glob.charAt(j) == ']') j++;
                while (j < n && glob.charAt(j) != ']') j++;
                if (j >= n) {
                    sb.append("\\[");
                } else {
                    appendClass(sb, glob.substring(i, j));
                    i = j + 1;
                }
            } else {
                appendLiteral(sb, c);
            }
        }
        return sb.toString();
    }

    private static void appendClass(StringBuilder sb, String body) {
        sb.append('[');
        int start = 0;
        if (body.startsWith("!")) {
            sb.append('^');
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '-' || Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        sb.append(']');
    }

    private static void appendLiteral(StringBuilder sb, char c) {
        if ("\\.[]{}()<>*+-=!?^$|&".indexOf(c) >= 0) {
            sb.append('\\');
        }
        sb.append(c);
    }

    @Override
    public String toString() {
        return glob;
    }
}
