package com.tpcc.gateway.repository.jdbc;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Param;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.tpcc.gateway.config.TpccProperties;
import com.tpcc.gateway.domain.ResultRow;
import com.tpcc.gateway.domain.SchemaDialect;
import com.tpcc.gateway.repository.BackendException;
import com.tpcc.gateway.repository.BackendTransaction;
import com.tpcc.gateway.repository.PlanAbortedException;
import com.tpcc.gateway.repository.ProjectionColumnInference;
import com.tpcc.gateway.repository.QueryBackend;
import com.tpcc.gateway.repository.RowValueNormalizer;
import com.tpcc.gateway.repository.sql.NativePlaceholders;
import com.tpcc.gateway.repository.sql.TranslatedQuery;
import com.tpcc.gateway.repository.sql.TranslationException;
import com.tpcc.gateway.repository.sql.TypedValue;

import lombok.extern.slf4j.Slf4j;

/**
 * PostgreSQL-compatible backend over the pooled DataSource.
 *
 * Statements run as jOOQ plain SQL with typed binds. Transaction scopes come
 * from Spring {@link TransactionTemplate}s:
 * - snapshot: read-only, REPEATABLE READ
 * - read-write: SERIALIZABLE, so conflicting TPC-C transactions fail with
 *   40001 and are retried by the executor
 * - schema: default isolation
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "tpcc.backend", name = "provider", havingValue = "jdbc", matchIfMissing = true)
public class JdbcQueryBackend implements QueryBackend {

    private final DSLContext dsl;
    private final TransactionTemplate snapshotTemplate;
    private final TransactionTemplate readWriteTemplate;
    private final TransactionTemplate schemaTemplate;
    private final String providerName;

    public JdbcQueryBackend(DSLContext dsl, PlatformTransactionManager transactionManager, TpccProperties properties) {
        this.dsl = dsl;
        this.providerName = properties.getBackend().getJdbc().getProviderName();

        this.snapshotTemplate = new TransactionTemplate(transactionManager);
        this.snapshotTemplate.setReadOnly(true);
        this.snapshotTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);

        this.readWriteTemplate = new TransactionTemplate(transactionManager);
        this.readWriteTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);

        this.schemaTemplate = new TransactionTemplate(transactionManager);

        log.info("JDBC backend ready: provider={}, jOOQ dialect={}", providerName, dsl.dialect());
    }

    @Override
    public String providerName() {
        return providerName;
    }

    @Override
    public SchemaDialect schemaDialect() {
        return SchemaDialect.POSTGRESQL;
    }

    @Override
    public List<ResultRow> read(TranslatedQuery query) {
        return inScope("Query", snapshotTemplate, () -> fetch(query));
    }

    @Override
    public long write(TranslatedQuery query) {
        return inScope("DML", readWriteTemplate, () -> (long) update(query));
    }

    @Override
    public <T> T readWrite(Function<BackendTransaction, T> body) {
        BackendTransaction transaction = new BackendTransaction() {
            @Override
            public List<ResultRow> query(TranslatedQuery query) {
                return classified("Query", () -> fetch(query));
            }

            @Override
            public long update(TranslatedQuery query) {
                return classified("DML", () -> (long) JdbcQueryBackend.this.update(query));
            }
        };
        return inScope("Transaction", readWriteTemplate, () -> body.apply(transaction));
    }

    @Override
    public void updateSchema(List<String> statements) {
        inScope("DDL", schemaTemplate, () -> {
            for (String statement : statements) {
                dsl.execute(statement);
            }
            return statements.size();
        });
    }

    // =========================================================================
    // Statement execution
    // =========================================================================

    private List<ResultRow> fetch(TranslatedQuery query) {
        NativePlaceholders.Expanded expanded = NativePlaceholders.toJdbc(query);
        Result<Record> result = dsl.resultQuery(expanded.sql(), binds(expanded.bindings())).fetch();

        Field<?>[] fields = result.fields();
        List<String> metadataNames = new ArrayList<>(fields.length);
        for (Field<?> field : fields) {
            metadataNames.add(field.getName());
        }
        List<String> names = ProjectionColumnInference.resolve(query.sql(), metadataNames);

        List<ResultRow> rows = new ArrayList<>(result.size());
        for (Record record : result) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < fields.length; i++) {
                values.put(names.get(i), RowValueNormalizer.normalize(record.get(i)));
            }
            rows.add(ResultRow.of(values));
        }
        return rows;
    }

    private int update(TranslatedQuery query) {
        NativePlaceholders.Expanded expanded = NativePlaceholders.toJdbc(query);
        return dsl.execute(expanded.sql(), binds(expanded.bindings()));
    }

    static Object[] binds(List<TypedValue> values) {
        Object[] binds = new Object[values.size()];
        for (int i = 0; i < values.size(); i++) {
            binds[i] = bind(values.get(i));
        }
        return binds;
    }

    private static Param<?> bind(TypedValue value) {
        Object raw = value.value();
        switch (value.type()) {
            case BOOL:
                return DSL.val((Boolean) raw, SQLDataType.BOOLEAN);
            case INT64:
                return DSL.val((Long) raw, SQLDataType.BIGINT);
            case FLOAT64:
                return DSL.val((Double) raw, SQLDataType.DOUBLE);
            case NUMERIC:
                return DSL.val((BigDecimal) raw, SQLDataType.NUMERIC);
            case TIMESTAMP:
                LocalDateTime utc = raw == null ? null : LocalDateTime.ofInstant((Instant) raw, ZoneOffset.UTC);
                return DSL.val(utc, SQLDataType.LOCALDATETIME);
            case STRING:
            default:
                return DSL.val((String) raw, SQLDataType.VARCHAR);
        }
    }

    // =========================================================================
    // Scopes and error classification
    // =========================================================================

    private <T> T inScope(String operation, TransactionTemplate template, Supplier<T> work) {
        return classified(operation, () -> template.execute(status -> work.get()));
    }

    private <T> T classified(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (BackendException | PlanAbortedException | TranslationException e) {
            throw e;
        } catch (org.jooq.exception.DataAccessException
                 | org.springframework.dao.DataAccessException
                 | TransactionException e) {
            throw JdbcErrorClassifier.classify(operation, e);
        }
    }
}
