package com.drawpool.store;

import com.drawpool.config.DrawPoolConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.TimeZone;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** {@link JdbcJobStore} against an in-memory H2 database in PostgreSQL mode. */
class JdbcJobStoreExpiryTest {

    private static final String REMARK = "Drawing task failed, power refunded. Task ID: t-1";

    private JdbcConnectionProvider connections;
    private JdbcJobStore store;

    @BeforeEach
    void setUp() throws SQLException {
        String url = "jdbc:h2:mem:drawpool_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
        connections = new JdbcConnectionProvider(DrawPoolConfig.builder().dbUser("sa").dbPassword("").build()) {
            @Override
            public String jdbcUrl() {
                return url;
            }
        };
        store = new JdbcJobStore(connections);
        store.ensureSchema();
        addUser(7, "alice", 50);
    }

    private void addUser(long id, String username, long power) throws SQLException {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement("INSERT INTO drawpool_users (id, username, power) VALUES (?,?,?)")) {
            ps.setLong(1, id);
            ps.setString(2, username);
            ps.setLong(3, power);
            ps.executeUpdate();
        }
    }

    private long logCount() throws SQLException {
        try (Connection c = connections.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM drawpool_power_logs")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private DrawJob stuckJob(long userId) {
        long id = store.create(DrawJob.builder().userId(userId).power(10).progress(50).taskId("t-1")
                .channelId("mj-plus-service-0").type("IMAGE").createdAt(Instant.now().minus(Duration.ofMinutes(31))).build());
        return store.findById(id).orElseThrow();
    }

    @Test
    void expiryDeletesJobCreditsUserAndWritesLog() throws SQLException {
        DrawJob job = stuckJob(7);

        assertEquals(ExpiryResult.REFUNDED, store.expire(job, REMARK));

        assertFalse(store.findById(job.getId()).isPresent());
        assertEquals(60, store.findUser(7).orElseThrow().getPower());
        try (Connection c = connections.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT user_id, username, type, amount, balance, mark, model, remark FROM drawpool_power_logs")) {
            assertTrue(rs.next());
            assertEquals(7, rs.getLong("user_id"));
            assertEquals("alice", rs.getString("username"));
            assertEquals(PowerLogType.REFUND.getCode(), rs.getInt("type"));
            assertEquals(10, rs.getLong("amount"));
            assertEquals(60, rs.getLong("balance"));
            assertEquals(PowerMark.ADD.getCode(), rs.getInt("mark"));
            assertEquals("mid-journey", rs.getString("model"));
            assertEquals(REMARK, rs.getString("remark"));
            assertFalse(rs.next());
        }
    }

    @Test
    void secondExpiryOfSameJobDoesNotRefundAgain() throws SQLException {
        DrawJob job = stuckJob(7);

        assertEquals(ExpiryResult.REFUNDED, store.expire(job, REMARK));
        assertEquals(ExpiryResult.ALREADY_REMOVED, store.expire(job, REMARK));

        assertEquals(60, store.findUser(7).orElseThrow().getPower());
        assertEquals(1, logCount());
    }

    @Test
    void jobOfMissingUserIsRemovedWithoutLog() throws SQLException {
        DrawJob job = stuckJob(99);

        assertEquals(ExpiryResult.REMOVED_WITHOUT_REFUND, store.expire(job, REMARK));

        assertFalse(store.findById(job.getId()).isPresent());
        assertEquals(0, logCount());
    }

    @Test
    void failedLogInsertRollsBackDeleteAndCredit() throws SQLException {
        DrawJob job = stuckJob(7);
        try (Connection c = connections.getConnection(); Statement st = c.createStatement()) {
            st.execute("DROP TABLE drawpool_power_logs");
        }

        assertThrows(StoreException.class, () -> store.expire(job, REMARK));

        assertTrue(store.findById(job.getId()).isPresent());
        assertEquals(50, store.findUser(7).orElseThrow().getPower());
    }

    @Test
    void creationTimeDoesNotShiftWithDefaultTimeZone() {
        TimeZone previous = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
            Instant createdAt = Instant.parse("2026-10-19T14:00:00Z");
            long id = store.create(DrawJob.builder().userId(7).power(10).progress(20).createdAt(createdAt).build());

            TimeZone.setDefault(TimeZone.getTimeZone("Asia/Tokyo"));
            DrawJob reread = store.findById(id).orElseThrow();

            assertEquals(createdAt, reread.getCreatedAt());
            assertFalse(reread.isExpired(createdAt.plus(Duration.ofMinutes(5)), Duration.ofMinutes(30)));
        } finally {
            TimeZone.setDefault(previous);
        }
    }
}
