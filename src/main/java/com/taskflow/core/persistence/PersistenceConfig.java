package com.taskflow.core.persistence;

import com.taskflow.core.audit.InMemoryReconciliationLog;
import com.taskflow.core.audit.JdbcReconciliationLog;
import com.taskflow.core.audit.ReconciliationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Chooses the task store and reconciliation log implementations.
 * <p>
 * When {@code spring.datasource.url} is set, a pooled {@link DataSource} is built and both
 * stores are JDBC-backed (PostgreSQL in production). Otherwise in-memory stores are used,
 * suitable for development and testing but not durable across restarts.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnProperty(name = "spring.datasource.url")
    public DataSource dataSource(@Value("${spring.datasource.url}") String url,
                                 @Value("${spring.datasource.username:}") String username,
                                 @Value("${spring.datasource.password:}") String password) {
        log.info("Configuring DataSource for {}", url);
        return DataSourceBuilder.create()
                .url(url)
                .username(username)
                .password(password)
                .build();
    }

    @Bean
    public TaskStore taskStore(ObjectProvider<DataSource> dataSource, TaskDocumentCodec codec,
                               Clock clock) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory task store (tasks will not persist across restarts)");
            return new InMemoryTaskStore(clock);
        }
        log.info("Configuring JDBC task store");
        var store = new JdbcTaskStore(ds, codec, clock);
        store.createTables();
        return store;
    }

    @Bean
    public ReconciliationLog reconciliationLog(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory reconciliation log");
            return new InMemoryReconciliationLog();
        }
        log.info("Configuring JDBC reconciliation log");
        var reconciliationLog = new JdbcReconciliationLog(ds);
        reconciliationLog.createTables();
        return reconciliationLog;
    }
}
