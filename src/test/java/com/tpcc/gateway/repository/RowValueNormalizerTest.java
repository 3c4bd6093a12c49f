package com.tpcc.gateway.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

class RowValueNormalizerTest {

    @Test
    void normalize_Numbers_ShouldBecomeLongOrDouble() {
        assertThat(RowValueNormalizer.normalize(5)).isEqualTo(5L);
        assertThat(RowValueNormalizer.normalize(new BigDecimal("34.00"))).isEqualTo(34.0);
        assertThat(RowValueNormalizer.normalize(BigInteger.TWO)).isEqualTo(2L);
    }

    @Test
    void normalize_Timestamps_ShouldBecomeUtcIsoStrings() {
        Timestamp timestamp = Timestamp.valueOf(LocalDateTime.of(2024, 3, 1, 10, 0));

        assertThat(RowValueNormalizer.normalize(timestamp)).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(RowValueNormalizer.normalize(LocalDate.of(2024, 3, 1))).isEqualTo("2024-03-01");
    }

    @Test
    void normalize_NullAndStrings_ShouldPassThrough() {
        assertThat(RowValueNormalizer.normalize(null)).isNull();
        assertThat(RowValueNormalizer.normalize("GC")).isEqualTo("GC");
        assertThat(RowValueNormalizer.normalize(Boolean.TRUE)).isEqualTo(true);
    }
}
