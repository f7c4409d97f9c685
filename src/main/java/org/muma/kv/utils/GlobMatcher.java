package org.muma.kv.utils;

import java.util.regex.Pattern;

/**
 * Redis style glob, compiled once to a regex.
 * <ul>
 *     <li>{@code *} any run of characters, {@code ?} exactly one character</li>
 *     <li>{@code [abc]}, {@code [a-z]}, {@code [^abc]} character classes</li>
 *     <li>{@code \x} matches x literally</li>
 * </ul>
 * A {@code [} without a closing {@code ]} is taken literally.
 */
public final class GlobMatcher {

    private static final GlobMatcher MATCH_ALL = new GlobMatcher("*", null);

    private final String glob;
    // null means match everything
    private final Pattern regex;

    private GlobMatcher(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobMatcher compile(String glob) {
        if ("*".equals(glob)) {
            return MATCH_ALL;
        }
        return new GlobMatcher(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    public boolean matches(String input) {
        return regex == null || regex.matcher(input).matches();
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> {
                    // collapse runs of '*'
                    while (i + 1 < n && glob.charAt(i + 1) == '*') i++;
                    sb.append(".*");
                }
                case '?' -> sb.append('.');
                case '[' -> {
                    int close = findClassEnd(glob, i + 1);
                    if (close < 0) {
                        appendLiteral(sb, c);
                    } else {
                        appendClass(sb, glob.substring(i + 1, close));
                        i = close;
                    }
                }
                case '\\' -> {
                    if (i + 1 < n) {
                        appendLiteral(sb, glob.charAt(++i));
                    } else {
                        appendLiteral(sb, c);
                    }
                }
                default -> appendLiteral(sb, c);
            }
            i++;
        }
        return sb.toString();
    }

    // index of the ']' closing a class whose body starts at from, or -1
    private static int findClassEnd(String glob, int from) {
        int i = from;
        if (i < glob.length() && glob.charAt(i) == '^') i++;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                i += 2;
                continue;
            }
            if (c == ']') return i;
            i++;
        }
        return -1;
    }

    private static void appendClass(StringBuilder sb, String body) {
        boolean negate = body.startsWith("^");
        if (negate) body = body.substring(1);

        StringBuilder items = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                c = body.charAt(++i);
            }
            if (i + 2 < body.length() && body.charAt(i + 1) == '-') {
                char end = body.charAt(i + 2);
                if (end == '\\' && i + 3 < body.length()) {
                    end = body.charAt(i + 3);
                    i++;
                }
                char lo = (char) Math.min(c, end);
                char hi = (char) Math.max(c, end);
                appendClassChar(items, lo);
                items.append('-');
                appendClassChar(items, hi);
                i += 3;
                continue;
            }
            appendClassChar(items, c);
            i++;
        }

        if (items.length() == 0) {
            sb.append(negate ? "." : "(?!)");
            return;
        }
        sb.append('[');
        if (negate) sb.append('^');
        sb.append(items).append(']');
    }

    private static void appendClassChar(StringBuilder sb, char c) {
        if (!Character.isLetterOrDigit(c)) sb.append('\\');
        sb.append(c);
    }

    private static void appendLiteral(StringBuilder sb, char c) {
        if (!Character.isLetterOrDigit(c) && c != ' ' && c != '_') sb.append('\\');
        sb.append(c);
    }

    @Override
    public String toString() {
        return "GlobMatcher{" + glob + "}";
    }
}
