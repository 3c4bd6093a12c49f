package com.tpcc.gateway.repository.spanner;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.google.cloud.Timestamp;
import com.google.cloud.spanner.DatabaseClient;
import com.google.cloud.spanner.Dialect;
import com.google.cloud.spanner.ResultSet;
import com.google.cloud.spanner.Spanner;
import com.google.cloud.spanner.SpannerException;
import com.google.cloud.spanner.Statement;
import com.google.cloud.spanner.Type;
import com.google.cloud.spanner.Value;
import com.tpcc.gateway.config.TpccProperties;
import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.SchemaDialect;
import com.tpcc.gateway.repository.BackendException;
import com.tpcc.gateway.repository.BackendTransaction;
import com.tpcc.gateway.repository.ProjectionColumnInference;
import com.tpcc.gateway.repository.QueryBackend;
import com.tpcc.gateway.repository.sql.NativePlaceholders;
import com.tpcc.gateway.repository.sql.ParameterSet;
import com.tpcc.gateway.repository.sql.TranslatedQuery;
import com.tpcc.gateway.repository.sql.TypedValue;

import lombok.extern.slf4j.Slf4j;

/**
 * Native Cloud Spanner backend.
 *
 * Reads use single-use read-only transactions (strong snapshot). Each DML
 * statement and each transaction body runs through the client's read-write
 * transaction runner, which re-runs the body itself when Spanner aborts it.
 * Schema changes go through the database admin client and block on the
 * long-running operation.
 *
 * Placeholders: the PostgreSQL dialect keeps {@code $n}; GoogleSQL receives
 * {@code @pn}. Both bind under the key {@code pn}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "tpcc.backend", name = "provider", havingValue = "spanner")
public class SpannerQueryBackend implements QueryBackend {

    static final String PROVIDER_NAME = "Google Spanner";

    private final Spanner spanner;
    private final DatabaseClient databaseClient;
    private final TpccProperties.Spanner settings;
    private final Dialect dialect;

    public SpannerQueryBackend(Spanner spanner, DatabaseClient databaseClient, TpccProperties properties) {
        this.spanner = spanner;
        this.databaseClient = databaseClient;
        this.settings = properties.getBackend().getSpanner();
        this.dialect = databaseClient.getDialect();
        log.info("Spanner backend ready: projects/{}/instances/{}/databases/{} dialect={}",
            settings.getProjectId(), settings.getInstanceId(), settings.getDatabaseId(), dialect);
    }

    @Override
    public String providerName() {
        return PROVIDER_NAME;
    }

    @Override
    public SchemaDialect schemaDialect() {
        return dialect == Dialect.POSTGRESQL ? SchemaDialect.SPANNER_POSTGRESQL : SchemaDialect.GOOGLE_STANDARD_SQL;
    }

    @Override
    public List<ResultRow> read(TranslatedQuery query) {
        try {
            return materialize(query.sql(), databaseClient.singleUse().executeQuery(toStatement(query)));
        } catch (SpannerException e) {
            throw SpannerErrorClassifier.classify("Query", e);
        }
    }

    @Override
    public long write(TranslatedQuery query) {
        Statement statement = toStatement(query);
        try {
            Long affected = databaseClient.readWriteTransaction().run(tx -> tx.executeUpdate(statement));
            return affected == null ? 0 : affected;
        } catch (SpannerException e) {
            throw SpannerErrorClassifier.classify("DML", e);
        }
    }

    @Override
    public <T> T readWrite(Function<BackendTransaction, T> body) {
        try {
            return databaseClient.readWriteTransaction().run(tx -> body.apply(new BackendTransaction() {
                @Override
                public List<ResultRow> query(TranslatedQuery query) {
                    return materialize(query.sql(), tx.executeQuery(toStatement(query)));
                }

                @Override
                public long update(TranslatedQuery query) {
                    return tx.executeUpdate(toStatement(query));
                }
            }));
        } catch (SpannerException e) {
            RuntimeException fromBody = bodyFailure(e);
            if (fromBody != null) {
                throw fromBody;
            }
            throw SpannerErrorClassifier.classify("Transaction", e);
        }
    }

    @Override
    public void updateSchema(List<String> statements) {
        try {
            spanner.getDatabaseAdminClient()
                .updateDatabaseDdl(settings.getInstanceId(), settings.getDatabaseId(), statements, null)
                .get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SpannerException spannerException) {
                throw SpannerErrorClassifier.classify("DDL", spannerException);
            }
            throw new BackendException(ErrorKind.BACKEND, "DDL failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(ErrorKind.BACKEND, "DDL interrupted", e);
        } catch (SpannerException e) {
            throw SpannerErrorClassifier.classify("DDL", e);
        }
    }

    // =========================================================================
    // Statements and rows
    // =========================================================================

    Statement toStatement(TranslatedQuery query) {
        String sql = dialect == Dialect.POSTGRESQL ? query.sql() : NativePlaceholders.toGoogleSql(query.sql());
        Statement.Builder builder = Statement.newBuilder(sql);
        ParameterSet parameters = query.parameters();
        for (int position = 1; position <= parameters.size(); position++) {
            builder.bind(ParameterSet.keyOf(position)).to(toValue(parameters.get(position)));
        }
        return builder.build();
    }

    private Value toValue(TypedValue value) {
        Object raw = value.value();
        switch (value.type()) {
            case BOOL:
                return Value.bool((Boolean) raw);
            case INT64:
                return Value.int64((Long) raw);
            case FLOAT64:
                return Value.float64((Double) raw);
            case NUMERIC:
                if (dialect == Dialect.POSTGRESQL) {
                    return Value.pgNumeric(raw == null ? null : ((BigDecimal) raw).toPlainString());
                }
                return Value.numeric((BigDecimal) raw);
            case TIMESTAMP:
                if (raw == null) {
                    return Value.timestamp(null);
                }
                Instant instant = (Instant) raw;
                return Value.timestamp(Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano()));
            case STRING:
            default:
                return Value.string((String) raw);
        }
    }

    private List<ResultRow> materialize(String sql, ResultSet resultSet) {
        List<ResultRow> rows = new ArrayList<>();
        try (ResultSet rs = resultSet) {
            List<String> names = null;
            while (rs.next()) {
                if (names == null) {
                    names = columnNames(sql, rs);
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < names.size(); i++) {
                    values.put(names.get(i), columnValue(rs, i));
                }
                rows.add(ResultRow.of(values));
            }
        }
        return rows;
    }

    private static List<String> columnNames(String sql, ResultSet rs) {
        List<Type.StructField> fields = rs.getType().getStructFields();
        List<String> metadataNames = new ArrayList<>(fields.size());
        for (Type.StructField field : fields) {
            metadataNames.add(field.getName());
        }
        return ProjectionColumnInference.resolve(sql, metadataNames);
    }

    private static Object columnValue(ResultSet rs, int index) {
        if (rs.isNull(index)) {
            return null;
        }
        Type.Code code = rs.getColumnType(index).getCode();
        switch (code) {
            case BOOL:
                return rs.getBoolean(index);
            case INT64:
                return rs.getLong(index);
            case FLOAT64:
                return rs.getDouble(index);
            case NUMERIC:
                return rs.getBigDecimal(index).doubleValue();
            case PG_NUMERIC:
                return Double.valueOf(rs.getValue(index).getString());
            case STRING:
                return rs.getString(index);
            case TIMESTAMP:
                return rs.getTimestamp(index).toString();
            case DATE:
                return rs.getDate(index).toString();
            default:
                return rs.getValue(index).toString();
        }
    }

    /**
     * Exceptions thrown by the transaction body reach the caller wrapped in a
     * SpannerException; hand back the original.
     */
    private static RuntimeException bodyFailure(SpannerException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime && !(cause instanceof SpannerException)) {
            return runtime;
        }
        return null;
    }
}
