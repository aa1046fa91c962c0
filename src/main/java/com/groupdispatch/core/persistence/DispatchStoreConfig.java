package com.groupdispatch.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link DispatchStore} bean.
 * <p>
 * When a {@link DataSource} is available (SQLite by default, PostgreSQL when configured)
 * a {@link JdbcDispatchStore} is created and its tables ensured. Otherwise an
 * {@link InMemoryDispatchStore} is used, which does not survive restarts.
 * <p>
 * The DataSource is looked up lazily: it comes from auto-configuration, which runs after
 * this class is parsed, so a bean condition on it would never match.
 */
@Configuration
public class DispatchStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(DispatchStoreConfig.class);

    @Bean
    public DispatchStore dispatchStore(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper) {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory dispatch store (state will not persist across restarts)");
            return new InMemoryDispatchStore();
        }
        log.info("Configuring JDBC dispatch store");
        var store = new JdbcDispatchStore(ds, objectMapper);
        store.createTables();
        return store;
    }
}
