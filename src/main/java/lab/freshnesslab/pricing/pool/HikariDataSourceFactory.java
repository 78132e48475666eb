package lab.freshnesslab.pricing.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.concurrent.TimeUnit;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.BackendFamily;
import org.springframework.stereotype.Component;

@Component
public class HikariDataSourceFactory implements DataSourceFactory {

    private static final int MIN_POOL_SIZE = 2;
    private static final int MAX_POOL_SIZE = 20;

    private final FreshnessLabProperties properties;

    public HikariDataSourceFactory(FreshnessLabProperties properties) {
        this.properties = properties;
    }

    @Override
    public HikariDataSource create(BackendFamily family,
                                   FreshnessLabProperties.BackendConnection settings,
                                   String poolName,
                                   String isolationLevel) {
        return new HikariDataSource(buildConfig(family, settings, poolName, isolationLevel));
    }

    HikariConfig buildConfig(BackendFamily family,
                             FreshnessLabProperties.BackendConnection settings,
                             String poolName,
                             String isolationLevel) {
        int maxSize = Math.min(MAX_POOL_SIZE, Math.max(MIN_POOL_SIZE, settings.getMaxPoolSize()));
        int minIdle = Math.min(maxSize, Math.max(MIN_POOL_SIZE, settings.getMinPoolSize()));

        HikariConfig config = new HikariConfig();
        config.setPoolName(poolName);
        config.setJdbcUrl(settings.jdbcUrl());
        config.setUsername(settings.getUser());
        config.setPassword(settings.getPassword());
        config.setMinimumIdle(minIdle);
        config.setMaximumPoolSize(maxSize);
        config.setConnectionTimeout(settings.getAcquireTimeoutMs());
        config.setIdleTimeout(settings.getIdleTimeoutMs());
        config.setAutoCommit(true);
        config.addDataSourceProperty("ApplicationName", settings.getApplicationName());
        long timeoutSeconds = properties.getStatementTimeoutSeconds();
        if (family.supportsSessionReset()) {
            config.addDataSourceProperty("options",
                    "-c statement_timeout=" + TimeUnit.SECONDS.toMillis(timeoutSeconds)
                            + " -c idle_in_transaction_session_timeout=" + TimeUnit.SECONDS.toMillis(timeoutSeconds));
        } else {
            // Materialize ignores startup options; Hikari runs the init SQL once per physical connection.
            config.setConnectionInitSql("SET statement_timeout TO '" + timeoutSeconds + "s'; "
                    + "SET TRANSACTION_ISOLATION TO '" + isolationLevel + "'");
            config.setConnectionTestQuery("SELECT 1");
        }
        return config;
    }
}
