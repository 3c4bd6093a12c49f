package com.tpcc.gateway.repository.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

/**
 * Rewrites {@link Query} templates into {@code $1..$n} positional SQL.
 *
 * Named style ({@code @identifier}):
 * - each distinct name gets one position, assigned at its first appearance
 * - a name used twice binds the same value in both places
 * - {@code @@name} and {@code @{hint}} are left untouched
 * - a placeholder without a value, or a value without a placeholder, is rejected
 *
 * Positional style ({@code %s}):
 * - markers are consumed strictly left to right
 * - {@code %%} is a literal percent sign
 * - marker count must equal value count
 *
 * Text inside single or double quotes, and inside {@code --} or block
 * comments, is never scanned.
 */
@Component
public class ParameterTranslator {

    public TranslatedQuery translate(Query query) {
        QueryParameters parameters = query.parameters();
        switch (parameters.style()) {
            case NAMED:
                return translateNamed(query.sql(), ((QueryParameters.Named) parameters).values());
            case POSITIONAL:
                return translatePositional(query.sql(), ((QueryParameters.Positional) parameters).values());
            default:
                throw new TranslationException("Unsupported parameter style: " + parameters.style());
        }
    }

    private TranslatedQuery translateNamed(String sql, Map<String, Object> values) {
        StringBuilder out = new StringBuilder(sql.length() + 16);
        Map<String, Integer> positions = new LinkedHashMap<>();
        List<TypedValue> bound = new ArrayList<>();

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

            if (ch == '@' && i + 1 < sql.length()) {
                char next = sql.charAt(i + 1);
                if (next == '@') {
                    out.append("@@");
                    i++;
                    continue;
                }
                if (SqlLexer.isIdentStart(next)) {
                    int end = SqlLexer.identEnd(sql, i + 1);
                    String name = sql.substring(i + 1, end);
                    Integer position = positions.get(name);
                    if (position == null) {
                        if (!values.containsKey(name)) {
                            throw new TranslationException("No value supplied for placeholder @" + name);
                        }
                        bound.add(ValueCoercion.coerce(values.get(name)));
                        position = bound.size();
                        positions.put(name, position);
                    }
                    out.append('$').append(position);
                    i = end - 1;
                    continue;
                }
            }

            out.append(ch);
        }

        if (positions.size() != values.size()) {
            Set<String> unused = new LinkedHashSet<>(values.keySet());
            unused.removeAll(positions.keySet());
            throw new TranslationException("Values supplied without a placeholder: " + unused);
        }

        return new TranslatedQuery(out.toString(), new ParameterSet(bound));
    }

    private TranslatedQuery translatePositional(String sql, List<Object> values) {
        StringBuilder out = new StringBuilder(sql.length() + 16);
        List<TypedValue> bound = new ArrayList<>();
        int markers = 0;

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

            if (ch == '%' && i + 1 < sql.length()) {
                char next = sql.charAt(i + 1);
                if (next == '%') {
                    out.append('%');
                    i++;
                    continue;
                }
                if (next == 's') {
                    markers++;
                    if (markers <= values.size()) {
                        bound.add(ValueCoercion.coerce(values.get(markers - 1)));
                    }
                    out.append('$').append(markers);
                    i++;
                    continue;
                }
            }

            out.append(ch);
        }

        if (markers != values.size()) {
            throw new TranslationException(String.format(
                "Query has %d positional markers but %d values were supplied", markers, values.size()));
        }

        return new TranslatedQuery(out.toString(), new ParameterSet(bound));
    }
}
