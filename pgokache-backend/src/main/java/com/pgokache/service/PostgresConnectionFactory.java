package com.pgokache.service;

import com.pgokache.collector.CollectorSettings;
import com.pgokache.model.Instance;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out connections from one small HikariCP pool per instance.
 *
 * <p>A pool is rebuilt when the instance's coordinates or password differ from the ones it was
 * created with, so edits take effect on the next connection.
 */
@Slf4j
@Service
public class PostgresConnectionFactory implements ConnectionFactory {
    private static final int MAXIMUM_POOL_SIZE = 2;

    private final CollectorSettings settings;
    private final Map<Long, Pool> pools = new ConcurrentHashMap<>();

    private record PoolKey(String host, int port, String dbname, String user, String sslMode, String password) {
    }

    private record Pool(PoolKey key, HikariDataSource dataSource) {
    }

    public PostgresConnectionFactory(CollectorSettings settings) {
        this.settings = settings;
    }

    @Override
    public Connection open(Instance instance, String password) {
        Objects.requireNonNull(instance, "instance");
        Long instanceId = Objects.requireNonNull(instance.getId(), "instance.id");
        PoolKey key = new PoolKey(instance.getHost(), instance.getPort(), instance.getDbname(),
                instance.getUser(), instance.getSslMode(), password);

        Pool pool = pools.compute(instanceId, (id, existing) -> {
            if (existing != null && existing.key().equals(key)) {
                return existing;
            }
            if (existing != null) {
                log.info("Connection settings changed, rebuilding pool for instance {}", id);
                existing.dataSource().close();
            }
            return new Pool(key, new HikariDataSource(buildHikariConfig(instance, password)));
        });

        try {
            return pool.dataSource().getConnection();
        } catch (SQLException e) {
            log.warn("Connection failed for instance {} ({}:{}/{}): {} (SQLState: {})", instanceId,
                    instance.getHost(), instance.getPort(), instance.getDbname(), e.getMessage(), e.getSQLState());
            throw new InstanceConnectionException("Cannot connect to instance " + instanceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void evict(long instanceId) {
        Pool pool = pools.remove(instanceId);
        if (pool != null) {
            pool.dataSource().close();
        }
    }

    @PreDestroy
    public void closeAll() {
        pools.values().forEach(p -> p.dataSource().close());
        pools.clear();
    }

    static String jdbcUrl(Instance instance) {
        return String.format("jdbc:postgresql://%s:%d/%s", instance.getHost(), instance.getPort(), instance.getDbname());
    }

    private HikariConfig buildHikariConfig(Instance instance, String password) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName("com.pgokache.service.HikariSqlExceptionOverride");
        config.setDriverClassName("org.postgresql.Driver");
        config.setJdbcUrl(jdbcUrl(instance));
        config.setUsername(instance.getUser());
        config.setPassword(password);
        if (instance.getSslMode() != null && !instance.getSslMode().isBlank()) {
            config.addDataSourceProperty("sslmode", instance.getSslMode());
        }
        // Ensure pg_stat_activity.application_name identifies the monitor.
        config.addDataSourceProperty("ApplicationName", "pgokache");
        if (settings.getStatementTimeoutMs() > 0) {
            config.addDataSourceProperty("options", "-c statement_timeout=" + settings.getStatementTimeoutMs());
        }

        // Failed statements must be recoverable with an explicit rollback.
        config.setAutoCommit(false);
        config.setReadOnly(true);
        config.setConnectionTimeout(settings.getConnectionTimeoutMs());
        // Fail on getConnection() instead of at pool construction.
        config.setInitializationFailTimeout(-1);
        config.setMaximumPoolSize(MAXIMUM_POOL_SIZE);
        config.setMinimumIdle(0);
        config.setIdleTimeout(60000);
        config.setPoolName("Pool-instance-" + instance.getId());
        return config;
    }
}
