package com.tpcc.gateway.repository.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Adapts {@code $n} markers to what a particular driver accepts.
 *
 * PostgreSQL-dialect Spanner takes {@code $n} as is. GoogleSQL needs
 * {@code @pn}, and JDBC needs one {@code ?} per occurrence with the value
 * repeated wherever a position is reused.
 */
public final class NativePlaceholders {

    private NativePlaceholders() {
    }

    /** SQL with one {@code ?} per marker and the matching bind list. */
    public record Expanded(String sql, List<TypedValue> bindings) {
    }

    public static String toGoogleSql(String sql) {
        StringBuilder out = new StringBuilder(sql.length() + 8);
        for (int i = 0; i < sql.length(); i++) {
            char ch = sql.charAt(i);
            if (SqlLexer.isQuote(ch)) {
                i = SqlLexer.copyQuoted(sql, i, out);
                continue;
            }
            if (SqlLexer.isCommentStart(sql, i)) {
                i = SqlLexer.copyComment(sql, i, out);
                continue;
            }
            if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
                int end = SqlLexer.digitsEnd(sql, i + 1);
                out.append("@p").append(sql, i + 1, end);
                i = end - 1;
                continue;
            }
            out.append(ch);
        }
        return out.toString();
    }

    public static Expanded toJdbc(TranslatedQuery query) {
        String sql = query.sql();
        StringBuilder out = new StringBuilder(sql.length());
        List<TypedValue> bindings = new ArrayList<>();
        for (int i = 0; i < sql.length(); i++) {
            char ch = sql.charAt(i);
            if (SqlLexer.isQuote(ch)) {
                i = SqlLexer.copyQuoted(sql, i, out);
                continue;
            }
            if (SqlLexer.isCommentStart(sql, i)) {
                i = SqlLexer.copyComment(sql, i, out);
                continue;
            }
            if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
                int end = SqlLexer.digitsEnd(sql, i + 1);
                int position = Integer.parseInt(sql.substring(i + 1, end));
                bindings.add(query.parameters().get(position));
                out.append('?');
                i = end - 1;
                continue;
            }
            out.append(ch);
        }
        return new Expanded(out.toString(), bindings);
    }
}
