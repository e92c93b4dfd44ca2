package com.switchboard.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.config.SwitchboardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link SharedStore} bean.
 * <p>
 * When a {@link DataSource} is available, a {@link JdbcSharedStore} is created that persists
 * entries to the database. Otherwise an {@link InMemorySharedStore} is used as a fallback --
 * suitable for development and testing but not durable across restarts.
 */
@Configuration
public class SharedStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SharedStoreConfig.class);

    @Bean
    public SharedStore sharedStore(ObjectProvider<DataSource> dataSource,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   SwitchboardProperties properties) throws Exception {
        int limit = properties.getStore().getQueryLimit();
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC shared store");
            var store = new JdbcSharedStore(ds, objectMapper, clock, limit);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory shared store (state will not persist across restarts)");
        return new InMemorySharedStore(clock, limit);
    }
}
