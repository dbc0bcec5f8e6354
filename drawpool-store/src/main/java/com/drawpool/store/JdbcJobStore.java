package com.drawpool.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * JDBC implementation of {@link JobStore}. Persists to tables drawpool_mj_jobs, drawpool_users and
 * drawpool_power_logs. Schema (CREATE TABLE IF NOT EXISTS) is executed once at bootstrap via
 * {@link #ensureSchema()}.
 * <p>
 * Timestamp columns hold UTC wall-clock time and are always bound and read with a UTC
 * {@link Calendar}, so results do not depend on the JVM default time zone.
 */
public final class JdbcJobStore implements JobStore {

    private static final String TABLE_JOBS = "drawpool_mj_jobs";
    private static final String TABLE_USERS = "drawpool_users";
    private static final String TABLE_POWER_LOGS = "drawpool_power_logs";
    private static final String SCHEMA_RESOURCE = "schema/drawpool.sql";
    private static final String JOB_COLUMNS =
            "id, user_id, task_id, channel_id, type, hash, prompt, err_msg, progress, power, org_url, img_url, created_at";
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private final JdbcConnectionProvider connections;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public JdbcJobStore(JdbcConnectionProvider connections) {
        this.connections = Objects.requireNonNull(connections, "JdbcConnectionProvider");
    }

    /**
     * Creates the drawpool tables and indexes if they do not exist. Idempotent; safe to call at bootstrap.
     * Loads and executes schema/drawpool.sql from classpath.
     */
    public void ensureSchema() {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Drawpool schema already initialized; skipping");
            return;
        }
        String sql;
        try (var in = JdbcJobStore.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                log.error("Schema resource not found: {}. Tables {}, {}, {} must exist already.",
                        SCHEMA_RESOURCE, TABLE_JOBS, TABLE_USERS, TABLE_POWER_LOGS);
                return;
            }
            sql = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
        } catch (Exception e) {
            log.error("Schema load failed: resource={}, error={}", SCHEMA_RESOURCE, e.getMessage(), e);
            throw new StoreException("Schema load failed: " + e.getMessage(), e);
        }
        List<String> statements = splitStatements(sql);
        log.info("Drawpool schema: executing {} statement(s) against {}", statements.size(), connections.jdbcUrl());
        try (Connection c = connections.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                    log.error("Drawpool schema: statement {}/{} failed. SQL: {} | Error: {} | SQLState: {}",
                            index, statements.size(), preview, e.getMessage(), e.getSQLState(), e);
                    throw new StoreException("Schema execution failed at statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Drawpool schema ready | tables={},{},{}", TABLE_JOBS, TABLE_USERS, TABLE_POWER_LOGS);
        } catch (SQLException e) {
            log.error("Drawpool schema: connection failed. url={} error={} SQLState={}", connections.jdbcUrl(), e.getMessage(), e.getSQLState(), e);
            throw new StoreException("Schema execution failed: " + e.getMessage(), e);
        }
    }

    /** Splits a script on {@code ;}, dropping comment lines and empty statements. */
    static List<String> splitStatements(String script) {
        List<String> out = new ArrayList<>();
        for (String raw : script.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) {
                out.add(stmt);
            }
        }
        return out;
    }

    @Override
    public long create(DrawJob job) {
        String sql = "INSERT INTO " + TABLE_JOBS + " (user_id, task_id, channel_id, type, hash, prompt, err_msg, progress, power, org_url, img_url, created_at) "
                + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, job.getUserId());
            ps.setString(2, job.getTaskId());
            ps.setString(3, job.getChannelId());
            ps.setString(4, job.getType());
            ps.setString(5, job.getHash());
            ps.setString(6, job.getPrompt());
            ps.setString(7, job.getErrMsg());
            ps.setInt(8, job.getProgress());
            ps.setLong(9, job.getPower());
            ps.setString(10, job.getOrgUrl());
            ps.setString(11, job.getImgUrl());
            ps.setTimestamp(12, Timestamp.from(job.getCreatedAt()), utc());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("Insert into " + TABLE_JOBS + " returned no id");
                }
                long id = keys.getLong(1);
                log.info("Job created | {} | jobId={} userId={} power={}", TABLE_JOBS, id, job.getUserId(), job.getPower());
                return id;
            }
        } catch (SQLException e) {
            log.error("Job persist failed: create userId={} error={} SQLState={}", job.getUserId(), e.getMessage(), e.getSQLState(), e);
            throw new StoreException("Job create failed", e);
        }
    }

    @Override
    public Optional<DrawJob> findById(long id) {
        List<DrawJob> jobs = queryJobs("SELECT " + JOB_COLUMNS + " FROM " + TABLE_JOBS + " WHERE id=?", id);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public List<DrawJob> findUnfinished() {
        return queryJobs("SELECT " + JOB_COLUMNS + " FROM " + TABLE_JOBS + " WHERE progress < ? ORDER BY id", DrawJob.PROGRESS_DONE);
    }

    @Override
    public List<DrawJob> findPendingArchival() {
        return queryJobs("SELECT " + JOB_COLUMNS + " FROM " + TABLE_JOBS
                + " WHERE progress = ? AND org_url <> '' AND img_url = '' ORDER BY id", DrawJob.PROGRESS_DONE);
    }

    private List<DrawJob> queryJobs(String sql, long param) {
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                List<DrawJob> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(mapJob(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            log.error("Job query failed: sql={} error={} SQLState={}", sql, e.getMessage(), e.getSQLState(), e);
            throw new StoreException("Job query failed", e);
        }
    }

    private static DrawJob mapJob(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at", utc());
        return DrawJob.builder()
                .id(rs.getLong("id"))
                .userId(rs.getLong("user_id"))
                .taskId(rs.getString("task_id"))
                .channelId(rs.getString("channel_id"))
                .type(rs.getString("type"))
                .hash(rs.getString("hash"))
                .prompt(rs.getString("prompt"))
                .errMsg(rs.getString("err_msg"))
                .progress(rs.getInt("progress"))
                .power(rs.getLong("power"))
                .orgUrl(rs.getString("org_url"))
                .imgUrl(rs.getString("img_url"))
                .createdAt(created != null ? created.toInstant() : Instant.now())
                .build();
    }

    @Override
    public void update(DrawJob job) {
        String sql = "UPDATE " + TABLE_JOBS + " SET task_id=?, channel_id=?, hash=?, prompt=?, err_msg=?, progress=?, org_url=?, img_url=? WHERE id=?";
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, job.getTaskId());
            ps.setString(2, job.getChannelId());
            ps.setString(3, job.getHash());
            ps.setString(4, job.getPrompt());
            ps.setString(5, truncate(job.getErrMsg(), 1024));
            ps.setInt(6, job.getProgress());
            ps.setString(7, job.getOrgUrl());
            ps.setString(8, job.getImgUrl());
            ps.setLong(9, job.getId());
            int rows = ps.executeUpdate();
            log.debug("Job updated | {} | jobId={} progress={} rows={}", TABLE_JOBS, job.getId(), job.getProgress(), rows);
        } catch (SQLException e) {
            log.error("Job persist failed: update jobId={} error={} SQLState={}", job.getId(), e.getMessage(), e.getSQLState(), e);
            throw new StoreException("Job update failed", e);
        }
    }

    @Override
    public Optional<UserAccount> findUser(long userId) {
        try (Connection c = connections.getConnection()) {
            return findUser(c, userId);
        } catch (SQLException e) {
            log.error("User query failed: userId={} error={} SQLState={}", userId, e.getMessage(), e.getSQLState(), e);
            throw new StoreException("User query failed", e);
        }
    }

    private static Optional<UserAccount> findUser(Connection c, long userId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id, username, power FROM " + TABLE_USERS + " WHERE id=?")) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new UserAccount(rs.getLong("id"), rs.getString("username"), rs.getLong("power")));
            }
        }
    }

    @Override
    public ExpiryResult expire(DrawJob job, String remark) {
        try (Connection c = connections.getConnection()) {
            c.setAutoCommit(false);
            try {
                ExpiryResult result = expireInTransaction(c, job, remark);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Job expiry failed: jobId={} userId={} error={} SQLState={}", job.getId(), job.getUserId(), e.getMessage(), e.getSQLState(), e);
            throw new StoreException("Job expiry failed", e);
        }
    }

    private static ExpiryResult expireInTransaction(Connection c, DrawJob job, String remark) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + TABLE_JOBS + " WHERE id=?")) {
            ps.setLong(1, job.getId());
            if (ps.executeUpdate() == 0) {
                return ExpiryResult.ALREADY_REMOVED;
            }
        }
        try (PreparedStatement ps = c.prepareStatement("UPDATE " + TABLE_USERS + " SET power = power + ? WHERE id=?")) {
            ps.setLong(1, job.getPower());
            ps.setLong(2, job.getUserId());
            if (ps.executeUpdate() == 0) {
                return ExpiryResult.REMOVED_WITHOUT_REFUND;
            }
        }
        UserAccount user = findUser(c, job.getUserId())
                .orElseThrow(() -> new SQLException("User " + job.getUserId() + " vanished inside refund transaction"));
        PowerLog entry = PowerLog.refund(user, job.getPower(), remark, Instant.now());
        String sql = "INSERT INTO " + TABLE_POWER_LOGS + " (user_id, username, type, amount, balance, mark, model, remark, created_at) VALUES (?,?,?,?,?,?,?,?,?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, entry.getUserId());
            ps.setString(2, entry.getUsername());
            ps.setInt(3, entry.getType().getCode());
            ps.setLong(4, entry.getAmount());
            ps.setLong(5, entry.getBalance());
            ps.setInt(6, entry.getMark().getCode());
            ps.setString(7, entry.getModel());
            ps.setString(8, truncate(entry.getRemark(), 512));
            ps.setTimestamp(9, Timestamp.from(entry.getCreatedAt()), utc());
            ps.executeUpdate();
        }
        log.info("Power refunded | {} | userId={} amount={} balance={} jobId={}",
                TABLE_POWER_LOGS, entry.getUserId(), entry.getAmount(), entry.getBalance(), job.getId());
        return ExpiryResult.REFUNDED;
    }

    private static String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() > maxLen ? s.substring(0, maxLen) : s;
    }

    private static Calendar utc() {
        return Calendar.getInstance(TimeZone.getTimeZone("UTC"));
    }
}
