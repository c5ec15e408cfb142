package com.querygate.safety;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass lexer that separates string literals and comments from executable SQL text.
 *
 * <p>Produces two views of the input, both with the same length as the original so offsets line
 * up:
 * <ul>
 *   <li>{@link Scan#withoutLiterals()}: literals blanked, comments kept</li>
 *   <li>{@link Scan#code()}: literals and comments blanked</li>
 * </ul>
 * Unterminated literals and comments are left in place so that whatever follows an unmatched
 * quote is still inspected.
 *
 * <p>Engines disagree on backslashes inside quotes: BigQuery treats them as escapes, standard SQL
 * strings (PostgreSQL and most JDBC targets) do not. Callers that must not miss a statement boundary
 * scan with both settings.
 */
public final class SqlTextScanner {

    private SqlTextScanner() {
    }

    /**
     * Result of scanning a query.
     *
     * @param withoutLiterals text with literals replaced by spaces
     * @param code text with literals and comments replaced by spaces
     * @param comments raw text of every terminated comment
     */
    public record Scan(String withoutLiterals, String code, List<String> comments) {
    }

    public static Scan scan(String sql) {
        return scan(sql, true);
    }

    /**
     * Scan with an explicit literal escape mode.
     *
     * @param sql query text
     * @param backslashEscapes whether a backslash escapes the next character inside a literal;
     *                         triple-quoted literals are only recognized in this mode
     * @return scan result
     */
    public static Scan scan(String sql, boolean backslashEscapes) {
        if (sql == null) {
            return new Scan("", "", List.of());
        }

        int n = sql.length();
        StringBuilder withoutLiterals = new StringBuilder(sql);
        StringBuilder code = new StringBuilder(sql);
        List<String> comments = new ArrayList<>();

        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);

            if (c == '\'' || c == '"') {
                int end = findLiteralEnd(sql, i, c, backslashEscapes);
                if (end < 0) {
                    // Unterminated: leave the remainder visible.
                    break;
                }
                blank(withoutLiterals, i, end);
                blank(code, i, end);
                i = end;
                continue;
            }

            if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = lineEnd(sql, i);
                comments.add(sql.substring(i, end));
                blank(code, i, end);
                i = end;
                continue;
            }

            if (c == '#') {
                int end = lineEnd(sql, i);
                comments.add(sql.substring(i, end));
                blank(code, i, end);
                i = end;
                continue;
            }

            if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                if (close < 0) {
                    break;
                }
                int end = close + 2;
                comments.add(sql.substring(i, end));
                blank(code, i, end);
                i = end;
                continue;
            }

            if (c == '`') {
                // Quoted identifier: skip over it so quotes inside do not open a literal.
                int close = sql.indexOf('`', i + 1);
                if (close < 0) {
                    break;
                }
                i = close + 1;
                continue;
            }

            i++;
        }

        return new Scan(withoutLiterals.toString(), code.toString(), List.copyOf(comments));
    }

    /**
     * Find the exclusive end offset of a literal opening at {@code start}, or -1 if unterminated.
     */
    private static int findLiteralEnd(String sql, int start, char quote, boolean backslashEscapes) {
        int n = sql.length();
        boolean triple = backslashEscapes && start + 2 < n && sql.charAt(start + 1) == quote && sql.charAt(start + 2) == quote;
        if (triple) {
            String delimiter = String.valueOf(quote).repeat(3);
            int i = start + 3;
            while (i < n) {
                char c = sql.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (sql.startsWith(delimiter, i)) {
                    return i + 3;
                }
                i++;
            }
            return -1;
        }

        int i = start + 1;
        while (i < n) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < n && sql.charAt(i + 1) == quote) {
                    // Doubled quote escape.
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    private static int lineEnd(String sql, int from) {
        int nl = sql.indexOf('\n', from);
        return nl < 0 ? sql.length() : nl;
    }

    private static void blank(StringBuilder sb, int from, int to) {
        for (int i = from; i < to; i++) {
            if (sb.charAt(i) != '\n') {
                sb.setCharAt(i, ' ');
            }
        }
    }
}
