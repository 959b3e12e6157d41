package com.concierge.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties under {@code concierge.*}.
 */
@ConfigurationProperties(prefix = "concierge")
public class ConciergeProperties {

    public enum Persistence { MEMORY, JDBC }

    private Persistence persistence = Persistence.MEMORY;
    private final Jdbc jdbc = new Jdbc();
    private final Worker worker = new Worker();
    private final Cron cron = new Cron();
    private final Arbitration arbitration = new Arbitration();

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Worker getWorker() {
        return worker;
    }

    public Cron getCron() {
        return cron;
    }

    public Arbitration getArbitration() {
        return arbitration;
    }

    /**
     * PostgreSQL connection, used when persistence is {@code jdbc}.
     */
    public static class Jdbc {
        private String url = "jdbc:postgresql://localhost:5432/concierge";
        private String username = "concierge";
        private String password = "";
        private int maximumPoolSize = 10;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int threads = 4;
        private Duration pollInterval = Duration.ofSeconds(1);
        /** How long a claimed delivery stays invisible before it is redelivered */
        private Duration visibilityTimeout = Duration.ofMinutes(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Cron {
        private boolean enabled = true;
        private Duration syncInterval = Duration.ofSeconds(60);
        private int poolSize = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getSyncInterval() {
            return syncInterval;
        }

        public void setSyncInterval(Duration syncInterval) {
            this.syncInterval = syncInterval;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    /**
     * OpenAI-compatible endpoint consulted when keyword routing is inconclusive.
     */
    public static class Arbitration {
        private boolean enabled = false;
        private String baseUrl;
        private String apiKey;
        private String model;
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
