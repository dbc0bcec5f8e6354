package com.drawpool.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the drawpool dispatch worker.
 * <p>
 * Cache (queues): DRAWPOOL_CACHE_HOST, DRAWPOOL_CACHE_PORT. DB: DRAWPOOL_DB_HOST, DRAWPOOL_DB_PORT,
 * DRAWPOOL_DB_NAME, DRAWPOOL_DB_USER, DRAWPOOL_DB_PASSWORD. Channel definitions are read from the
 * JSON file named by DRAWPOOL_CHANNELS_FILE (see {@link ChannelConfigLoader}).
 */
public final class DrawPoolConfig {

    private static final String ENV_CACHE_HOST = "DRAWPOOL_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "DRAWPOOL_CACHE_PORT";
    private static final String ENV_DB_HOST = "DRAWPOOL_DB_HOST";
    private static final String ENV_DB_PORT = "DRAWPOOL_DB_PORT";
    private static final String ENV_DB_NAME = "DRAWPOOL_DB_NAME";
    private static final String ENV_DB_USER = "DRAWPOOL_DB_USER";
    private static final String ENV_DB_PASSWORD = "DRAWPOOL_DB_PASSWORD";
    private static final String ENV_QUEUE_MODE = "DRAWPOOL_QUEUE_MODE";
    private static final String ENV_TASK_QUEUE = "DRAWPOOL_TASK_QUEUE";
    private static final String ENV_NOTIFY_QUEUE = "DRAWPOOL_NOTIFY_QUEUE";
    private static final String ENV_CHANNELS_FILE = "DRAWPOOL_CHANNELS_FILE";
    private static final String ENV_JOB_TIMEOUT_MINUTES = "DRAWPOOL_JOB_TIMEOUT_MINUTES";
    private static final String ENV_RECONCILE_INTERVAL_SECONDS = "DRAWPOOL_RECONCILE_INTERVAL_SECONDS";
    private static final String ENV_ARCHIVE_INTERVAL_SECONDS = "DRAWPOOL_ARCHIVE_INTERVAL_SECONDS";
    private static final String ENV_QUEUE_POLL_SECONDS = "DRAWPOOL_QUEUE_POLL_SECONDS";
    private static final String ENV_ALLOWED_API_HOSTS = "DRAWPOOL_ALLOWED_API_HOSTS";
    private static final String ENV_UPLOAD_DIR = "DRAWPOOL_UPLOAD_DIR";
    private static final String ENV_UPLOAD_BASE_URL = "DRAWPOOL_UPLOAD_BASE_URL";

    public static final String DEFAULT_TASK_QUEUE = "MidJourney_Task_Queue";
    public static final String DEFAULT_NOTIFY_QUEUE = "MidJourney_Notify_Queue";
    private static final String DEFAULT_DB_NAME = "drawpool";
    private static final String DEFAULT_DB_USER = "drawpool";
    private static final String DEFAULT_CHANNELS_FILE = "config/channels.json";
    private static final int DEFAULT_JOB_TIMEOUT_MINUTES = 30;
    private static final int DEFAULT_RECONCILE_INTERVAL_SECONDS = 10;
    private static final int DEFAULT_ARCHIVE_INTERVAL_SECONDS = 5;
    private static final int DEFAULT_QUEUE_POLL_SECONDS = 1;
    private static final String DEFAULT_UPLOAD_DIR = "static/upload";
    private static final String DEFAULT_UPLOAD_BASE_URL = "http://localhost:5678/static/upload";

    /** Where the task and notify queues live. */
    public enum QueueMode {
        REDIS,
        MEMORY
    }

    private final String cacheHost;
    private final int cachePort;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final QueueMode queueMode;
    private final String taskQueueName;
    private final String notifyQueueName;
    private final String channelsFile;
    private final Duration jobTimeout;
    private final Duration reconcileInterval;
    private final Duration archiveInterval;
    private final Duration queuePollTimeout;
    private final List<String> allowedApiHosts;
    private final String uploadDir;
    private final String uploadBaseUrl;

    private DrawPoolConfig(Builder b) {
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.queueMode = b.queueMode;
        this.taskQueueName = b.taskQueueName;
        this.notifyQueueName = b.notifyQueueName;
        this.channelsFile = b.channelsFile;
        this.jobTimeout = b.jobTimeout;
        this.reconcileInterval = b.reconcileInterval;
        this.archiveInterval = b.archiveInterval;
        this.queuePollTimeout = b.queuePollTimeout;
        this.allowedApiHosts = Collections.unmodifiableList(new ArrayList<>(b.allowedApiHosts));
        this.uploadDir = b.uploadDir;
        this.uploadBaseUrl = b.uploadBaseUrl;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    /** Database name (DRAWPOOL_DB_NAME). Default "drawpool". */
    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** REDIS (default) shares queues across processes; MEMORY keeps them inside this JVM. */
    public QueueMode getQueueMode() {
        return queueMode;
    }

    /** Redis list key for generation tasks. Default {@value #DEFAULT_TASK_QUEUE}. */
    public String getTaskQueueName() {
        return taskQueueName;
    }

    /** Redis list key for client notifications. Default {@value #DEFAULT_NOTIFY_QUEUE}. */
    public String getNotifyQueueName() {
        return notifyQueueName;
    }

    /** Path of the channel definitions JSON file. Default {@code config/channels.json}. */
    public String getChannelsFile() {
        return channelsFile;
    }

    /** Age after which an unfinished job is expired and refunded. Default 30 minutes. */
    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public Duration getReconcileInterval() {
        return reconcileInterval;
    }

    public Duration getArchiveInterval() {
        return archiveInterval;
    }

    /** How long one blocking queue pop waits before the consumer re-checks its running flag. */
    public Duration getQueuePollTimeout() {
        return queuePollTimeout;
    }

    /** Hosts accepted for channel API URLs; empty means any host. */
    public List<String> getAllowedApiHosts() {
        return allowedApiHosts;
    }

    public String getUploadDir() {
        return uploadDir;
    }

    public String getUploadBaseUrl() {
        return uploadBaseUrl;
    }

    public static DrawPoolConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Builds the configuration from the given variable lookup (normally {@link System#getenv(String)}).
     * Unset, blank or unparsable values fall back to their defaults.
     */
    public static DrawPoolConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .cacheHost(getEnv(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.apply(ENV_CACHE_PORT), 6379))
                .dbHost(getEnv(env, ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(env.apply(ENV_DB_PORT), 5432))
                .dbName(getEnv(env, ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(env, ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(getEnv(env, ENV_DB_PASSWORD, ""))
                .queueMode(parseQueueMode(env.apply(ENV_QUEUE_MODE)))
                .taskQueueName(getEnv(env, ENV_TASK_QUEUE, DEFAULT_TASK_QUEUE))
                .notifyQueueName(getEnv(env, ENV_NOTIFY_QUEUE, DEFAULT_NOTIFY_QUEUE))
                .channelsFile(getEnv(env, ENV_CHANNELS_FILE, DEFAULT_CHANNELS_FILE))
                .jobTimeout(Duration.ofMinutes(parsePositiveInt(env.apply(ENV_JOB_TIMEOUT_MINUTES), DEFAULT_JOB_TIMEOUT_MINUTES)))
                .reconcileInterval(Duration.ofSeconds(parsePositiveInt(env.apply(ENV_RECONCILE_INTERVAL_SECONDS), DEFAULT_RECONCILE_INTERVAL_SECONDS)))
                .archiveInterval(Duration.ofSeconds(parsePositiveInt(env.apply(ENV_ARCHIVE_INTERVAL_SECONDS), DEFAULT_ARCHIVE_INTERVAL_SECONDS)))
                .queuePollTimeout(Duration.ofSeconds(parsePositiveInt(env.apply(ENV_QUEUE_POLL_SECONDS), DEFAULT_QUEUE_POLL_SECONDS)))
                .allowedApiHosts(parseCommaSeparated(env.apply(ENV_ALLOWED_API_HOSTS)))
                .uploadDir(getEnv(env, ENV_UPLOAD_DIR, DEFAULT_UPLOAD_DIR))
                .uploadBaseUrl(getEnv(env, ENV_UPLOAD_BASE_URL, DEFAULT_UPLOAD_BASE_URL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static QueueMode parseQueueMode(String value) {
        if (value == null || value.isBlank()) {
            return QueueMode.REDIS;
        }
        return "memory".equalsIgnoreCase(value.trim()) ? QueueMode.MEMORY : QueueMode.REDIS;
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        int parsed = parseInt(value, defaultValue);
        return parsed > 0 ? parsed : defaultValue;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private QueueMode queueMode = QueueMode.REDIS;
        private String taskQueueName = DEFAULT_TASK_QUEUE;
        private String notifyQueueName = DEFAULT_NOTIFY_QUEUE;
        private String channelsFile = DEFAULT_CHANNELS_FILE;
        private Duration jobTimeout = Duration.ofMinutes(DEFAULT_JOB_TIMEOUT_MINUTES);
        private Duration reconcileInterval = Duration.ofSeconds(DEFAULT_RECONCILE_INTERVAL_SECONDS);
        private Duration archiveInterval = Duration.ofSeconds(DEFAULT_ARCHIVE_INTERVAL_SECONDS);
        private Duration queuePollTimeout = Duration.ofSeconds(DEFAULT_QUEUE_POLL_SECONDS);
        private List<String> allowedApiHosts = List.of();
        private String uploadDir = DEFAULT_UPLOAD_DIR;
        private String uploadBaseUrl = DEFAULT_UPLOAD_BASE_URL;

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder queueMode(QueueMode queueMode) {
            this.queueMode = Objects.requireNonNull(queueMode, "queueMode");
            return this;
        }

        public Builder taskQueueName(String taskQueueName) {
            this.taskQueueName = taskQueueName != null ? taskQueueName : DEFAULT_TASK_QUEUE;
            return this;
        }

        public Builder notifyQueueName(String notifyQueueName) {
            this.notifyQueueName = notifyQueueName != null ? notifyQueueName : DEFAULT_NOTIFY_QUEUE;
            return this;
        }

        public Builder channelsFile(String channelsFile) {
            this.channelsFile = channelsFile != null ? channelsFile : DEFAULT_CHANNELS_FILE;
            return this;
        }

        public Builder jobTimeout(Duration jobTimeout) {
            this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout");
            return this;
        }

        public Builder reconcileInterval(Duration reconcileInterval) {
            this.reconcileInterval = Objects.requireNonNull(reconcileInterval, "reconcileInterval");
            return this;
        }

        public Builder archiveInterval(Duration archiveInterval) {
            this.archiveInterval = Objects.requireNonNull(archiveInterval, "archiveInterval");
            return this;
        }

        public Builder queuePollTimeout(Duration queuePollTimeout) {
            this.queuePollTimeout = Objects.requireNonNull(queuePollTimeout, "queuePollTimeout");
            return this;
        }

        public Builder allowedApiHosts(List<String> allowedApiHosts) {
            this.allowedApiHosts = allowedApiHosts != null ? new ArrayList<>(allowedApiHosts) : List.of();
            return this;
        }

        public Builder uploadDir(String uploadDir) {
            this.uploadDir = uploadDir != null ? uploadDir : DEFAULT_UPLOAD_DIR;
            return this;
        }

        public Builder uploadBaseUrl(String uploadBaseUrl) {
            this.uploadBaseUrl = uploadBaseUrl != null ? uploadBaseUrl : DEFAULT_UPLOAD_BASE_URL;
            return this;
        }

        public DrawPoolConfig build() {
            return new DrawPoolConfig(this);
        }
    }
}
