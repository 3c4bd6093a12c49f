package com.tpcc.gateway.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Best-effort recovery of column names from a SELECT list.
 *
 * Only used when the driver's result metadata leaves a column unnamed. The
 * parse understands nesting and quoting well enough for the projections this
 * gateway issues ({@code expr AS alias}, {@code t.column}, {@code column});
 * anything else falls back to {@code column_<n>}.
 */
public final class ProjectionColumnInference {

    private ProjectionColumnInference() {
    }

    /**
     * Fills blank entries of {@code metadataNames} from the SQL projection.
     */
    public static List<String> resolve(String sql, List<String> metadataNames) {
        List<String> inferred = null;
        List<String> names = new ArrayList<>(metadataNames.size());
        for (int i = 0; i < metadataNames.size(); i++) {
            String name = metadataNames.get(i);
            if (name == null || name.isBlank()) {
                if (inferred == null) {
                    inferred = infer(sql);
                }
                name = i < inferred.size() ? inferred.get(i) : fallbackName(i);
            }
            names.add(name);
        }
        return names;
    }

    /**
     * Names of the top-level projection items, in order.
     */
    public static List<String> infer(String sql) {
        List<String> items = projectionItems(sql);
        List<String> names = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            names.add(nameOf(items.get(i), i));
        }
        return names;
    }

    static String fallbackName(int index) {
        return "column_" + (index + 1);
    }

    private static List<String> projectionItems(String sql) {
        List<String> items = new ArrayList<>();
        String lower = sql.toLowerCase(Locale.ROOT);
        int start = indexOfKeyword(lower, "select", 0);
        if (start < 0) {
            return items;
        }
        int pos = start + "select".length();
        int distinct = skipWhitespace(lower, pos);
        if (lower.startsWith("distinct", distinct) && isBoundary(lower, distinct + "distinct".length())) {
            pos = distinct + "distinct".length();
        }

        int depth = 0;
        int itemStart = pos;
        for (int i = pos; i < sql.length(); i++) {
            char ch = sql.charAt(i);
            if (ch == '\'' || ch == '"' || ch == '`') {
                i = closingQuote(sql, i);
                continue;
            }
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (depth == 0 && ch == ',') {
                items.add(sql.substring(itemStart, i).trim());
                itemStart = i + 1;
            } else if (depth == 0 && (ch == 'f' || ch == 'F')
                    && lower.startsWith("from", i) && isBoundary(lower, i - 1) && isBoundary(lower, i + 4)) {
                items.add(sql.substring(itemStart, i).trim());
                return items;
            }
        }
        String tail = sql.substring(itemStart).trim();
        if (!tail.isEmpty()) {
            items.add(tail);
        }
        return items;
    }

    private static String nameOf(String item, int index) {
        String lower = item.toLowerCase(Locale.ROOT);
        int as = lower.lastIndexOf(" as ");
        if (as >= 0) {
            String alias = unquote(item.substring(as + 4).trim());
            if (isIdentifier(alias)) {
                return alias;
            }
        }
        String candidate = item;
        int dot = candidate.lastIndexOf('.');
        if (dot >= 0) {
            candidate = candidate.substring(dot + 1);
        }
        candidate = unquote(candidate.trim());
        return isIdentifier(candidate) ? candidate : fallbackName(index);
    }

    private static int indexOfKeyword(String lower, String keyword, int from) {
        int idx = lower.indexOf(keyword, from);
        while (idx >= 0) {
            if (isBoundary(lower, idx - 1) && isBoundary(lower, idx + keyword.length())) {
                return idx;
            }
            idx = lower.indexOf(keyword, idx + 1);
        }
        return -1;
    }

    private static boolean isBoundary(String text, int index) {
        if (index < 0 || index >= text.length()) {
            return true;
        }
        char ch = text.charAt(index);
        return !Character.isLetterOrDigit(ch) && ch != '_';
    }

    private static int skipWhitespace(String text, int index) {
        int i = index;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int closingQuote(String sql, int open) {
        char quote = sql.charAt(open);
        for (int i = open + 1; i < sql.length(); i++) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i++;
                    continue;
                }
                return i;
            }
        }
        return sql.length() - 1;
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            if ((first == '"' || first == '`') && text.charAt(text.length() - 1) == first) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    private static boolean isIdentifier(String text) {
        if (text.isEmpty() || !(Character.isLetter(text.charAt(0)) || text.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!Character.isLetterOrDigit(ch) && ch != '_') {
                return false;
            }
        }
        return true;
    }
}
