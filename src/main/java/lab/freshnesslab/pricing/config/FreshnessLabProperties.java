package lab.freshnesslab.pricing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lab.freshness")
public class FreshnessLabProperties {

    private long productId = 1;
    private int statementTimeoutSeconds = 120;
    private int correlationTimeoutSeconds = 300;
    private int acquireMaxAttempts = 3;
    private long acquireBackoffMs = 100;
    private long heartbeatIntervalMs = 1000;
    private long freshnessIntervalMs = 1000;
    private long supervisorTickMs = 500;
    private long rotationIntervalMs = 60000;
    private long drainTimeoutMs = 5000;
    private int refreshIntervalSeconds = 60;
    private int refreshMaxAttempts = 3;
    private long refreshRetryBackoffMs = 1000;
    private String viewName = "mv_dynamic_pricing";
    private long stalenessThresholdMs = 2000;
    private long qpsWindowMs = 1000;
    private int latencyWindowSize = 100;
    private long probeDelayMs = 200;
    private int floorConcurrency = 1;
    private int indexedConcurrency = 2;
    private String readinessIndexName = "dynamic_pricing_product_id_idx";
    private int readinessMaxAttempts = 3;
    private long readinessRetryBackoffMs = 1000;
    private String defaultIsolationLevel = "serializable";
    private int loopSchedulerPoolSize = 4;
    private BackendConnection baseline = BackendConnection.baselineDefaults();
    private BackendConnection streaming = BackendConnection.streamingDefaults();

    public long getProductId() {
        return productId;
    }

    public void setProductId(long productId) {
        this.productId = productId;
    }

    public int getStatementTimeoutSeconds() {
        return statementTimeoutSeconds;
    }

    public void setStatementTimeoutSeconds(int statementTimeoutSeconds) {
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    public int getCorrelationTimeoutSeconds() {
        return correlationTimeoutSeconds;
    }

    public void setCorrelationTimeoutSeconds(int correlationTimeoutSeconds) {
        this.correlationTimeoutSeconds = correlationTimeoutSeconds;
    }

    public int getAcquireMaxAttempts() {
        return acquireMaxAttempts;
    }

    public void setAcquireMaxAttempts(int acquireMaxAttempts) {
        this.acquireMaxAttempts = acquireMaxAttempts;
    }

    public long getAcquireBackoffMs() {
        return acquireBackoffMs;
    }

    public void setAcquireBackoffMs(long acquireBackoffMs) {
        this.acquireBackoffMs = acquireBackoffMs;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getFreshnessIntervalMs() {
        return freshnessIntervalMs;
    }

    public void setFreshnessIntervalMs(long freshnessIntervalMs) {
        this.freshnessIntervalMs = freshnessIntervalMs;
    }

    public long getSupervisorTickMs() {
        return supervisorTickMs;
    }

    public void setSupervisorTickMs(long supervisorTickMs) {
        this.supervisorTickMs = supervisorTickMs;
    }

    public long getRotationIntervalMs() {
        return rotationIntervalMs;
    }

    public void setRotationIntervalMs(long rotationIntervalMs) {
        this.rotationIntervalMs = rotationIntervalMs;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public int getRefreshIntervalSeconds() {
        return refreshIntervalSeconds;
    }

    public void setRefreshIntervalSeconds(int refreshIntervalSeconds) {
        this.refreshIntervalSeconds = refreshIntervalSeconds;
    }

    public int getRefreshMaxAttempts() {
        return refreshMaxAttempts;
    }

    public void setRefreshMaxAttempts(int refreshMaxAttempts) {
        this.refreshMaxAttempts = refreshMaxAttempts;
    }

    public long getRefreshRetryBackoffMs() {
        return refreshRetryBackoffMs;
    }

    public void setRefreshRetryBackoffMs(long refreshRetryBackoffMs) {
        this.refreshRetryBackoffMs = refreshRetryBackoffMs;
    }

    public String getViewName() {
        return viewName;
    }

    public void setViewName(String viewName) {
        this.viewName = viewName;
    }

    public long getStalenessThresholdMs() {
        return stalenessThresholdMs;
    }

    public void setStalenessThresholdMs(long stalenessThresholdMs) {
        this.stalenessThresholdMs = stalenessThresholdMs;
    }

    public long getQpsWindowMs() {
        return qpsWindowMs;
    }

    public void setQpsWindowMs(long qpsWindowMs) {
        this.qpsWindowMs = qpsWindowMs;
    }

    public int getLatencyWindowSize() {
        return latencyWindowSize;
    }

    public void setLatencyWindowSize(int latencyWindowSize) {
        this.latencyWindowSize = latencyWindowSize;
    }

    public long getProbeDelayMs() {
        return probeDelayMs;
    }

    public void setProbeDelayMs(long probeDelayMs) {
        this.probeDelayMs = probeDelayMs;
    }

    public int getFloorConcurrency() {
        return floorConcurrency;
    }

    public void setFloorConcurrency(int floorConcurrency) {
        this.floorConcurrency = floorConcurrency;
    }

    public int getIndexedConcurrency() {
        return indexedConcurrency;
    }

    public void setIndexedConcurrency(int indexedConcurrency) {
        this.indexedConcurrency = indexedConcurrency;
    }

    public String getReadinessIndexName() {
        return readinessIndexName;
    }

    public void setReadinessIndexName(String readinessIndexName) {
        this.readinessIndexName = readinessIndexName;
    }

    public int getReadinessMaxAttempts() {
        return readinessMaxAttempts;
    }

    public void setReadinessMaxAttempts(int readinessMaxAttempts) {
        this.readinessMaxAttempts = readinessMaxAttempts;
    }

    public long getReadinessRetryBackoffMs() {
        return readinessRetryBackoffMs;
    }

    public void setReadinessRetryBackoffMs(long readinessRetryBackoffMs) {
        this.readinessRetryBackoffMs = readinessRetryBackoffMs;
    }

    public String getDefaultIsolationLevel() {
        return defaultIsolationLevel;
    }

    public void setDefaultIsolationLevel(String defaultIsolationLevel) {
        this.defaultIsolationLevel = defaultIsolationLevel;
    }

    public int getLoopSchedulerPoolSize() {
        return loopSchedulerPoolSize;
    }

    public void setLoopSchedulerPoolSize(int loopSchedulerPoolSize) {
        this.loopSchedulerPoolSize = loopSchedulerPoolSize;
    }

    public BackendConnection getBaseline() {
        return baseline;
    }

    public void setBaseline(BackendConnection baseline) {
        this.baseline = baseline;
    }

    public BackendConnection getStreaming() {
        return streaming;
    }

    public void setStreaming(BackendConnection streaming) {
        this.streaming = streaming;
    }

    public static class BackendConnection {

        private String host = "localhost";
        private int port = 5432;
        private String database = "postgres";
        private String user = "postgres";
        private String password = "postgres";
        private String schema = "public";
        private String applicationName = "freshmart_pg";
        private int minPoolSize = 2;
        private int maxPoolSize = 20;
        private long acquireTimeoutMs = 30000;
        private long idleTimeoutMs = 120000;

        static BackendConnection baselineDefaults() {
            return new BackendConnection();
        }

        static BackendConnection streamingDefaults() {
            BackendConnection connection = new BackendConnection();
            connection.setPort(6875);
            connection.setDatabase("materialize");
            connection.setUser("materialize");
            connection.setPassword("materialize");
            connection.setApplicationName("freshmart_mz");
            return connection;
        }

        public String jdbcUrl() {
            return "jdbc:postgresql://" + host + ":" + port + "/" + database;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public String getApplicationName() {
            return applicationName;
        }

        public void setApplicationName(String applicationName) {
            this.applicationName = applicationName;
        }

        public int getMinPoolSize() {
            return minPoolSize;
        }

        public void setMinPoolSize(int minPoolSize) {
            this.minPoolSize = minPoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public long getAcquireTimeoutMs() {
            return acquireTimeoutMs;
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = acquireTimeoutMs;
        }

        public long getIdleTimeoutMs() {
            return idleTimeoutMs;
        }

        public void setIdleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = idleTimeoutMs;
        }
    }
}
