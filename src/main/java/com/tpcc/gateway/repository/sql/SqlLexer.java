package com.tpcc.gateway.repository.sql;

/**
 * Lexical helpers shared by the placeholder scanners.
 *
 * Scanning is purely textual. Copied verbatim, never scanned for markers:
 * - quoted literals ('...') and quoted identifiers ("..."), doubled quotes being escapes
 * - line comments ({@code -- ...} up to the end of the line)
 * - block comments ({@code /* ... *}{@code /}), not nested
 */
final class SqlLexer {

    private SqlLexer() {
    }

    static boolean isQuote(char ch) {
        return ch == '\'' || ch == '"';
    }

    /**
     * Copies the quoted run starting at {@code start} into {@code out}.
     *
     * @return index of the closing quote, or the last index if unterminated
     */
    static int copyQuoted(String sql, int start, StringBuilder out) {
        char quote = sql.charAt(start);
        out.append(quote);
        int i = start + 1;
        while (i < sql.length()) {
            char ch = sql.charAt(i);
            out.append(ch);
            if (ch == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    out.append(quote);
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return sql.length() - 1;
    }

    static boolean isCommentStart(String sql, int i) {
        if (i + 1 >= sql.length()) {
            return false;
        }
        char ch = sql.charAt(i);
        char next = sql.charAt(i + 1);
        return (ch == '-' && next == '-') || (ch == '/' && next == '*');
    }

    /**
     * Copies the comment starting at {@code start} into {@code out}. A line
     * comment stops before its newline.
     *
     * @return index of the comment's last character, or the last index if unterminated
     */
    static int copyComment(String sql, int start, StringBuilder out) {
        if (sql.charAt(start) == '-') {
            int end = sql.indexOf('\n', start);
            end = end < 0 ? sql.length() : end;
            out.append(sql, start, end);
            return end - 1;
        }
        int close = sql.indexOf("*/", start + 2);
        int end = close < 0 ? sql.length() : close + 2;
        out.append(sql, start, end);
        return end - 1;
    }

    static boolean isIdentStart(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || ch == '_';
    }

    static boolean isIdentPart(char ch) {
        return isIdentStart(ch) || (ch >= '0' && ch <= '9');
    }

    static int identEnd(String sql, int start) {
        int end = start;
        while (end < sql.length() && isIdentPart(sql.charAt(end))) {
            end++;
        }
        return end;
    }

    static int digitsEnd(String sql, int start) {
        int end = start;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) {
            end++;
        }
        return end;
    }
}
