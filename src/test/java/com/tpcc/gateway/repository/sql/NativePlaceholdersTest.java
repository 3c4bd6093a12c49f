package com.tpcc.gateway.repository.sql;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class NativePlaceholdersTest {

    private final ParameterTranslator translator = new ParameterTranslator();

    @Test
    void toGoogleSql_ShouldRenameMarkersOutsideQuotes() {
        String sql = NativePlaceholders.toGoogleSql("SELECT '$1' AS s FROM t WHERE a = $1 AND b = $12");

        assertThat(sql).isEqualTo("SELECT '$1' AS s FROM t WHERE a = @p1 AND b = @p12");
    }

    @Test
    void toJdbc_RepeatedPosition_ShouldRepeatBinding() {
        // Given
        TranslatedQuery translated = translator.translate(Query.builder(
                "SELECT * FROM item i WHERE i.i_name LIKE @search OR i.i_data LIKE @search AND i.i_id > @min")
            .bind("search", "%a%")
            .bind("min", 2)
            .build());

        // When
        NativePlaceholders.Expanded expanded = NativePlaceholders.toJdbc(translated);

        // Then
        assertThat(expanded.sql()).isEqualTo("SELECT * FROM item i WHERE i.i_name LIKE ? OR i.i_data LIKE ? AND i.i_id > ?");
        assertThat(expanded.bindings()).extracting(TypedValue::value).containsExactly("%a%", "%a%", 2L);
    }

    @Test
    void toJdbc_ShouldLeaveMarkersInCommentsUnbound() {
        // Given
        TranslatedQuery translated = new TranslatedQuery("SELECT 1 AS ok -- was $2\nWHERE 1 = $1",
            new ParameterSet(List.of(new TypedValue(1L, ParamType.INT64))));

        // When
        NativePlaceholders.Expanded expanded = NativePlaceholders.toJdbc(translated);

        // Then
        assertThat(expanded.sql()).isEqualTo("SELECT 1 AS ok -- was $2\nWHERE 1 = ?");
        assertThat(expanded.bindings()).extracting(TypedValue::value).containsExactly(1L);
    }
}
