package lab.freshnesslab.pricing.pool;

import com.zaxxer.hikari.HikariDataSource;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.BackendFamily;

public interface DataSourceFactory {

    /**
     * Builds a pool whose physical connections start with the given session isolation level.
     * Families that do not support it ignore the level.
     */
    HikariDataSource create(BackendFamily family,
                            FreshnessLabProperties.BackendConnection settings,
                            String poolName,
                            String isolationLevel);
}
