package com.tpcc.gateway.config;

import javax.sql.DataSource;

import org.jooq.DSLContext;
import org.jooq.impl.DataSourceConnectionProvider;
import org.jooq.impl.DefaultConfiguration;
import org.jooq.impl.DefaultDSLContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.TransactionAwareDataSourceProxy;

/**
 * jOOQ {@link DSLContext} used by the JDBC backend to run plain SQL with typed
 * binds.
 *
 * The DataSource is wrapped so that jOOQ uses the connection bound to the
 * current Spring transaction.
 */
@Configuration
@ConditionalOnProperty(prefix = "tpcc.backend", name = "provider", havingValue = "jdbc", matchIfMissing = true)
public class JooqConfig {

    @Bean
    public DSLContext dslContext(DataSource dataSource, TpccProperties properties) {
        TransactionAwareDataSourceProxy proxy = new TransactionAwareDataSourceProxy(dataSource);

        DefaultConfiguration configuration = new DefaultConfiguration();
        configuration.setSQLDialect(properties.getBackend().getJdbc().getDialect());
        configuration.setConnectionProvider(new DataSourceConnectionProvider(proxy));

        return new DefaultDSLContext(configuration);
    }
}
