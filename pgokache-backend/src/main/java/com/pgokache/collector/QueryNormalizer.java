package com.pgokache.collector;

import java.util.regex.Pattern;

/**
 * Lexical SQL text normalizer for pg_stat_statements query text.
 *
 * <p>This is not a parser. It collapses whitespace and replaces quoted string literals and
 * standalone integers with {@code ?}. Malformed or truncated SQL passes through untouched
 * wherever nothing matches. Normalizing already-normalized text is a no-op.
 *
 * <p>String literals are found by a single forward scan rather than a regex, so literal bodies
 * of any size and escape count are handled without recursion.
 */
public final class QueryNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern INTEGER_LITERAL = Pattern.compile("\\b\\d+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private QueryNormalizer() {
    }

    /**
     * Normalizes query text.
     *
     * @param query raw query text, may be null
     * @return normalized text, empty for null input
     */
    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String compact = WHITESPACE.matcher(query).replaceAll(" ").strip();
        compact = replaceStringLiterals(compact);
        return INTEGER_LITERAL.matcher(compact).replaceAll("?");
    }

    static String replaceStringLiterals(String text) {
        if (text.indexOf('\'') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int end = c == '\'' ? literalEnd(text, i) : -1;
            if (end < 0) {
                out.append(c);
                i++;
            } else {
                out.append('?');
                i = end + 1;
            }
        }
        return out.toString();
    }

    /**
     * Index of the quote closing the literal opened at {@code start}, or -1 if it is never closed.
     *
     * <p>{@code ''} inside a literal is an escaped quote. When no single closing quote follows,
     * the literal ends at the first quote of the last {@code ''} pair, if any.
     */
    private static int literalEnd(String text, int start) {
        int lastPairStart = -1;
        int j = start + 1;
        while (j < text.length()) {
            if (text.charAt(j) != '\'') {
                j++;
            } else if (j + 1 < text.length() && text.charAt(j + 1) == '\'') {
                lastPairStart = j;
                j += 2;
            } else {
                return j;
            }
        }
        return lastPairStart;
    }

    /**
     * Whether the (normalized) text is a SELECT statement, ignoring leading whitespace and case.
     *
     * @param queryNorm query text, may be null
     * @return true for SELECT statements
     */
    public static boolean isSelect(String queryNorm) {
        if (queryNorm == null || queryNorm.isEmpty()) {
            return false;
        }
        return queryNorm.stripLeading().regionMatches(true, 0, "select", 0, 6);
    }
}
