package com.libauto.config;

import com.libauto.job.JobType;
import com.libauto.queue.BackoffType;
import com.libauto.queue.QueueNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "libauto")
public class LibAutoProperties {

    private final Database database = new Database();
    private final Scheduler scheduler = new Scheduler();
    private final Queues queues = new Queues();
    private final Worker worker = new Worker();
    private final Retention retention = new Retention();
    private final Admin admin = new Admin();
    private List<SeedJob> seedJobs = new ArrayList<>();

    public Database getDatabase() {
        return database;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Queues getQueues() {
        return queues;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retention getRetention() {
        return retention;
    }

    public Admin getAdmin() {
        return admin;
    }

    public List<SeedJob> getSeedJobs() {
        return seedJobs;
    }

    public void setSeedJobs(List<SeedJob> seedJobs) {
        this.seedJobs = seedJobs;
    }

    public static class Database {
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public enum OverlapPolicy {
        /**
         * A firing that finds the previous run of the same job still in progress
         * is dropped.
         */
        SKIP,
        /**
         * Runs of the same job may overlap.
         */
        ALLOW
    }

    public static class Scheduler {
        private boolean enabled = true;
        private String timezone = "Asia/Manila";
        private OverlapPolicy overlapPolicy = OverlapPolicy.SKIP;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public OverlapPolicy getOverlapPolicy() {
            return overlapPolicy;
        }

        public void setOverlapPolicy(OverlapPolicy overlapPolicy) {
            this.overlapPolicy = overlapPolicy;
        }
    }

    /**
     * The fixed set of named queues, pre-filled with their production defaults.
     */
    public static class Queues {
        private QueueSettings backup = new QueueSettings(3, BackoffType.EXPONENTIAL, 2000, 10, 20);
        private QueueSettings sync = new QueueSettings(5, BackoffType.EXPONENTIAL, 1000, 5, 10);
        private QueueSettings notifications = new QueueSettings(3, BackoffType.FIXED, 5000, 5, 10);
        private QueueSettings maintenance = new QueueSettings(2, BackoffType.FIXED, 10000, 3, 5);

        public QueueSettings getBackup() {
            return backup;
        }

        public void setBackup(QueueSettings backup) {
            this.backup = backup;
        }

        public QueueSettings getSync() {
            return sync;
        }

        public void setSync(QueueSettings sync) {
            this.sync = sync;
        }

        public QueueSettings getNotifications() {
            return notifications;
        }

        public void setNotifications(QueueSettings notifications) {
            this.notifications = notifications;
        }

        public QueueSettings getMaintenance() {
            return maintenance;
        }

        public void setMaintenance(QueueSettings maintenance) {
            this.maintenance = maintenance;
        }

        public Map<String, QueueSettings> asMap() {
            Map<String, QueueSettings> queues = new LinkedHashMap<>();
            queues.put(QueueNames.BACKUP, backup);
            queues.put(QueueNames.SYNC, sync);
            queues.put(QueueNames.NOTIFICATIONS, notifications);
            queues.put(QueueNames.MAINTENANCE, maintenance);
            return queues;
        }
    }

    public static class QueueSettings {
        private int attempts;
        private BackoffType backoffType;
        private long backoffDelayMs;
        private int removeOnComplete;
        private int removeOnFail;
        private int concurrency = 2;

        public QueueSettings() {
            this(3, BackoffType.EXPONENTIAL, 1000, 10, 20);
        }

        public QueueSettings(int attempts, BackoffType backoffType, long backoffDelayMs,
                int removeOnComplete, int removeOnFail) {
            this.attempts = attempts;
            this.backoffType = backoffType;
            this.backoffDelayMs = backoffDelayMs;
            this.removeOnComplete = removeOnComplete;
            this.removeOnFail = removeOnFail;
        }

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public BackoffType getBackoffType() {
            return backoffType;
        }

        public void setBackoffType(BackoffType backoffType) {
            this.backoffType = backoffType;
        }

        public long getBackoffDelayMs() {
            return backoffDelayMs;
        }

        public void setBackoffDelayMs(long backoffDelayMs) {
            this.backoffDelayMs = backoffDelayMs;
        }

        public int getRemoveOnComplete() {
            return removeOnComplete;
        }

        public void setRemoveOnComplete(int removeOnComplete) {
            this.removeOnComplete = removeOnComplete;
        }

        public int getRemoveOnFail() {
            return removeOnFail;
        }

        public void setRemoveOnFail(int removeOnFail) {
            this.removeOnFail = removeOnFail;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private long pollIntervalMs = 1000;
        private long heartbeatIntervalMs = 10000;
        private long stallTimeoutMs = 60000;
        private long stallCheckIntervalMs = 30000;
        private long shutdownTimeoutMs = 30000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }

        public long getStallTimeoutMs() {
            return stallTimeoutMs;
        }

        public void setStallTimeoutMs(long stallTimeoutMs) {
            this.stallTimeoutMs = stallTimeoutMs;
        }

        public long getStallCheckIntervalMs() {
            return stallCheckIntervalMs;
        }

        public void setStallCheckIntervalMs(long stallCheckIntervalMs) {
            this.stallCheckIntervalMs = stallCheckIntervalMs;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    public static class Retention {
        private String logRetention = "30d";
        private String auditLogRetention = "90d";
        private long sweepIntervalMs = 3600000;

        public String getLogRetention() {
            return logRetention;
        }

        public void setLogRetention(String logRetention) {
            this.logRetention = logRetention;
        }

        public String getAuditLogRetention() {
            return auditLogRetention;
        }

        public void setAuditLogRetention(String auditLogRetention) {
            this.auditLogRetention = auditLogRetention;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }

    public static class Admin {
        private boolean enabled = false;
        private String path = "/libauto/admin";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    /**
     * A job definition created at startup when no job with the same name exists.
     */
    public static class SeedJob {
        private String id;
        private String name;
        private JobType type;
        private String schedule;
        private boolean enabled = true;
        private Map<String, Object> config = new LinkedHashMap<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public JobType getType() {
            return type;
        }

        public void setType(JobType type) {
            this.type = type;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public void setConfig(Map<String, Object> config) {
            this.config = config;
        }
    }
}
