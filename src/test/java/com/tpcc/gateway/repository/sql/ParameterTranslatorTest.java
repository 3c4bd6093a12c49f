package com.tpcc.gateway.repository.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for placeholder rewriting.
 *
 * Covers both parameter styles, quoting rules and the strict
 * value/placeholder matching.
 */
class ParameterTranslatorTest {

    private final ParameterTranslator translator = new ParameterTranslator();

    // =========================================================================
    // Named placeholders
    // =========================================================================

    @Test
    void translateNamed_ShouldAssignPositionsInOrderOfFirstAppearance() {
        // Given
        Query query = Query.builder("SELECT * FROM customer c WHERE c.c_w_id = @w_id AND c.c_id = @c_id")
            .bind("c_id", 5)
            .bind("w_id", 1)
            .build();

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT * FROM customer c WHERE c.c_w_id = $1 AND c.c_id = $2");
        assertThat(translated.parameters().get(1)).isEqualTo(new TypedValue(1L, ParamType.INT64));
        assertThat(translated.parameters().get(2)).isEqualTo(new TypedValue(5L, ParamType.INT64));
    }

    @Test
    void translateNamed_RepeatedPlaceholder_ShouldShareOnePosition() {
        // Given
        Query query = Query.builder("SELECT * FROM item i WHERE i.i_name LIKE @search OR i.i_data LIKE @search")
            .bind("search", "%gizmo%")
            .build();

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT * FROM item i WHERE i.i_name LIKE $1 OR i.i_data LIKE $1");
        assertThat(translated.parameters().size()).isEqualTo(1);
    }

    @Test
    void translateNamed_ShouldLeaveQuotedTextAndSystemVariablesUntouched() {
        // Given
        Query query = Query.builder("SELECT '@not_a_param', \"@col\", @@version FROM t WHERE x = @x")
            .bind("x", "it's")
            .build();

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT '@not_a_param', \"@col\", @@version FROM t WHERE x = $1");
        assertThat(translated.parameters().get(1).value()).isEqualTo("it's");
    }

    @Test
    void translateNamed_ShouldSkipEscapedQuotesInsideLiterals() {
        // Given
        Query query = Query.builder("SELECT 'O''@Brien' AS n FROM t WHERE id = @id")
            .bind("id", 7)
            .build();

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT 'O''@Brien' AS n FROM t WHERE id = $1");
    }

    @Test
    void translateNamed_NullValue_ShouldBindAsNullString() {
        // Given
        Map<String, Object> values = new HashMap<>();
        values.put("carrier", null);
        Query query = Query.named("UPDATE orders SET o_carrier_id = @carrier", values);

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        TypedValue bound = translated.parameters().get(1);
        assertThat(bound.isNull()).isTrue();
        assertThat(bound.type()).isEqualTo(ParamType.STRING);
    }

    @Test
    void translateNamed_MissingValue_ShouldThrow() {
        // Given
        Query query = Query.builder("SELECT * FROM warehouse w WHERE w.w_id = @w_id").build();

        // When/Then
        assertThatThrownBy(() -> translator.translate(query))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("@w_id");
    }

    @Test
    void translateNamed_UnusedValue_ShouldThrow() {
        // Given
        Query query = Query.builder("SELECT * FROM warehouse w WHERE w.w_id = @w_id")
            .bind("w_id", 1)
            .bind("d_id", 2)
            .build();

        // When/Then
        assertThatThrownBy(() -> translator.translate(query))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("d_id");
    }

    @Test
    void translateNamed_ShouldSkipPlaceholdersInComments() {
        // Given
        Query query = Query.builder("SELECT w.w_name AS w_name FROM warehouse w -- filter by @w_id\n"
                + "WHERE w.w_id = @id /* was @old_id */")
            .bind("id", 1)
            .build();

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT w.w_name AS w_name FROM warehouse w -- filter by @w_id\n"
            + "WHERE w.w_id = $1 /* was @old_id */");
        assertThat(translated.parameters().size()).isEqualTo(1);
    }

    // =========================================================================
    // Positional placeholders
    // =========================================================================

    @Test
    void translatePositional_ShouldNumberMarkersLeftToRight() {
        // Given
        Query query = Query.positional("UPDATE customer SET c_balance = %s WHERE c_id = %s",
            new BigDecimal("12.50"), 3);

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("UPDATE customer SET c_balance = $1 WHERE c_id = $2");
        assertThat(translated.parameters().get(1).type()).isEqualTo(ParamType.NUMERIC);
        assertThat(translated.parameters().get(2).type()).isEqualTo(ParamType.INT64);
    }

    @Test
    void translatePositional_DoublePercent_ShouldBecomeLiteralPercent() {
        // Given
        Query query = Query.positional("SELECT * FROM item WHERE i_data LIKE 'ORIG%%' AND i_id = %s", 1);

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT * FROM item WHERE i_data LIKE 'ORIG%%' AND i_id = $1");
    }

    @Test
    void translatePositional_OutsideQuotes_ShouldCollapseDoublePercent() {
        // Given
        Query query = Query.positional("SELECT 100 %% 7, %s", 1);

        // When
        TranslatedQuery translated = translator.translate(query);

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT 100 % 7, $1");
    }

    @Test
    void translatePositional_ShouldSkipMarkersInComments() {
        // When
        TranslatedQuery translated = translator.translate(Query.positional(
            "SELECT 1 AS ok /* %s */ WHERE 1 = %s -- and %s", 1));

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT 1 AS ok /* %s */ WHERE 1 = $1 -- and %s");
        assertThat(translated.parameters().size()).isEqualTo(1);
    }

    @Test
    void translatePositional_CountMismatch_ShouldThrow() {
        // Given
        Query query = Query.positional("SELECT * FROM t WHERE a = %s AND b = %s", 1);

        // When/Then
        assertThatThrownBy(() -> translator.translate(query))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("2 positional markers but 1 values");
    }

    @Test
    void translate_QueryWithoutParameters_ShouldPassThrough() {
        // When
        TranslatedQuery translated = translator.translate(Query.of("SELECT 1 AS ok"));

        // Then
        assertThat(translated.sql()).isEqualTo("SELECT 1 AS ok");
        assertThat(translated.parameters().isEmpty()).isTrue();
    }
}
