package net.wizeops.tiercache.utils;

import java.util.regex.Pattern;

/**
 * Glob matching with the remote store's semantics: {@code *} matches any run of
 * characters, {@code ?} a single character, {@code [...]} a character class and
 * {@code \} escapes the next character.
 */
public final class GlobPattern {
    private static final String KEY_SEPARATORS = ":|=._-/";

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    public static GlobPattern compile(String glob) {
        return new GlobPattern(glob);
    }

    public boolean matches(String key) {
        return regex.matcher(key).matches();
    }

    public String getGlob() {
        return glob;
    }

    /**
     * True when the pattern contains nothing but wildcards, i.e. it would match every key.
     */
    public static boolean isWildcardOnly(String glob) {
        return !glob.isEmpty() && glob.chars().allMatch(c -> c == '*' || c == '?');
    }

    /**
     * True when the pattern is wildcards only, or a {@code *} pattern whose remaining
     * characters are key separators such as {@code *:*}. Such patterns match every
     * generated key.
     */
    public static boolean isEffectivelyMatchAll(String glob) {
        if (isWildcardOnly(glob)) {
            return true;
        }
        return glob.indexOf('*') >= 0
                && glob.chars().allMatch(c -> c == '*' || c == '?' || KEY_SEPARATORS.indexOf(c) >= 0);
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
            } else if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '^' && glob.charAt(i - 1) == '[') {
                    regex.append('^');
                } else if (c == '-') {
                    regex.append('-');
                } else {
                    regex.append(Character.isLetterOrDigit(c) ? String.valueOf(c) : "\\" + c);
                }
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[' && glob.indexOf(']', i + 1) > i + 1) {
                inClass = true;
                regex.append('[');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
