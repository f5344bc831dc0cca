package io.taskline.spring.boot;

import io.taskline.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the job scheduler and credential lifecycle.
 *
 * @see TasklineAutoConfiguration
 */
@ConfigurationProperties(prefix = "taskline")
public class TasklineProperties {

    private final Tables tables = new Tables();
    private final Scheduler scheduler = new Scheduler();
    private final Retry retry = new Retry();
    private final Recurring recurring = new Recurring();
    private final Refresh refresh = new Refresh();
    private final Retention retention = new Retention();
    private final OAuthState oauthState = new OAuthState();
    private final Metrics metrics = new Metrics();

    public Tables getTables() {
        return tables;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Retry getRetry() {
        return retry;
    }

    public Recurring getRecurring() {
        return recurring;
    }

    public Refresh getRefresh() {
        return refresh;
    }

    public Retention getRetention() {
        return retention;
    }

    public OAuthState getOauthState() {
        return oauthState;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Tables {
        private String job = TableNames.JOB_TABLE;
        private String credential = TableNames.CREDENTIAL_TABLE;
        private String recurringRun = TableNames.RECURRING_RUN_TABLE;
        private String oauthState = TableNames.OAUTH_STATE_TABLE;

        public String getJob() {
            return job;
        }

        public void setJob(String job) {
            this.job = job;
        }

        public String getCredential() {
            return credential;
        }

        public void setCredential(String credential) {
            this.credential = credential;
        }

        public String getRecurringRun() {
            return recurringRun;
        }

        public void setRecurringRun(String recurringRun) {
            this.recurringRun = recurringRun;
        }

        public String getOauthState() {
            return oauthState;
        }

        public void setOauthState(String oauthState) {
            this.oauthState = oauthState;
        }
    }

    public static class Scheduler {
        /**
         * Start the scheduler and recurring registry with the application context.
         */
        private boolean autoStart = true;
        private String workerId;
        private int workerCount = 4;
        private int batchSize = 50;
        private long intervalMs = 5000;
        private long drainTimeoutMs = 5000;
        private Duration defaultTimeout = Duration.ofMinutes(5);
        private Duration staleClaimTimeout = Duration.ofMinutes(30);

        /**
         * Per job type execution timeouts, keyed by job type.
         */
        private final Map<String, Duration> timeouts = new LinkedHashMap<>();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public Duration getStaleClaimTimeout() {
            return staleClaimTimeout;
        }

        public void setStaleClaimTimeout(Duration staleClaimTimeout) {
            this.staleClaimTimeout = staleClaimTimeout;
        }

        public Map<String, Duration> getTimeouts() {
            return timeouts;
        }
    }

    public static class Retry {
        private long baseDelayMs = 5000;
        private long maxDelayMs = 3_600_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Recurring {
        /**
         * Register the built-in recurring definitions.
         */
        private boolean enabled = true;
        private long intervalMs = 60_000;

        /**
         * Zone for the daily and weekly cadences.
         */
        private ZoneId zone = ZoneOffset.UTC;

        /**
         * Ids of built-in definitions to leave out, such as {@code analytics-sync}.
         */
        private List<String> exclude = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public ZoneId getZone() {
            return zone;
        }

        public void setZone(ZoneId zone) {
            this.zone = zone;
        }

        public List<String> getExclude() {
            return exclude;
        }

        public void setExclude(List<String> exclude) {
            this.exclude = exclude;
        }
    }

    public static class Refresh {
        private Duration safetyMargin = Duration.ofMinutes(5);
        private Duration expiringSoonWindow = Duration.ofHours(24);

        /**
         * How far ahead the recurring sweep looks for expiring credentials.
         */
        private Duration sweepThreshold = Duration.ofHours(24);
        private int sweepConcurrency = 10;

        public Duration getSafetyMargin() {
            return safetyMargin;
        }

        public void setSafetyMargin(Duration safetyMargin) {
            this.safetyMargin = safetyMargin;
        }

        public Duration getExpiringSoonWindow() {
            return expiringSoonWindow;
        }

        public void setExpiringSoonWindow(Duration expiringSoonWindow) {
            this.expiringSoonWindow = expiringSoonWindow;
        }

        public Duration getSweepThreshold() {
            return sweepThreshold;
        }

        public void setSweepThreshold(Duration sweepThreshold) {
            this.sweepThreshold = sweepThreshold;
        }

        public int getSweepConcurrency() {
            return sweepConcurrency;
        }

        public void setSweepConcurrency(int sweepConcurrency) {
            this.sweepConcurrency = sweepConcurrency;
        }
    }

    public static class Retention {
        private Duration period = Duration.ofDays(30);
        private int batchSize = 500;

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class OAuthState {
        private Duration ttl = Duration.ofMinutes(10);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "taskline";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
