package com.tpcc.gateway.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class ProjectionColumnInferenceTest {

    @Test
    void infer_ShouldUseAliasesQualifiedNamesAndFallbacks() {
        List<String> names = ProjectionColumnInference.infer(
            "SELECT COUNT(*) AS total, c.c_balance, c_last, COALESCE(SUM(x), 0) FROM customer c");

        assertThat(names).containsExactly("total", "c_balance", "c_last", "column_4");
    }

    @Test
    void infer_ShouldIgnoreCommasInsideParenthesesAndQuotes() {
        List<String> names = ProjectionColumnInference.infer(
            "SELECT DISTINCT CONCAT(a, ', ', b) AS full_name, 'x,y' AS lit FROM t");

        assertThat(names).containsExactly("full_name", "lit");
    }

    @Test
    void resolve_ShouldOnlyFillBlankMetadataNames() {
        List<String> resolved = ProjectionColumnInference.resolve(
            "SELECT o.o_id AS o_id, MAX(o.o_entry_d) AS latest FROM orders o",
            Arrays.asList("o_id", ""));

        assertThat(resolved).containsExactly("o_id", "latest");
    }
}
