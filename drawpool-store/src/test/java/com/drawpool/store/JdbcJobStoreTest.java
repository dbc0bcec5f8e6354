package com.drawpool.store;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcJobStoreTest {

    @Test
    void splitStatementsDropsCommentsAndBlanks() {
        String script = """
                -- header comment
                CREATE TABLE a (id INT);

                -- second
                CREATE INDEX i ON a (id);
                ;
                """;
        List<String> statements = JdbcJobStore.splitStatements(script);
        assertEquals(2, statements.size());
        assertEquals("CREATE TABLE a (id INT)", statements.get(0));
        assertEquals("CREATE INDEX i ON a (id)", statements.get(1));
    }

    @Test
    void bundledSchemaCreatesAllTables() throws Exception {
        String sql;
        try (InputStream in = JdbcJobStore.class.getClassLoader().getResourceAsStream("schema/drawpool.sql")) {
            assertNotNull(in);
            sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        List<String> statements = JdbcJobStore.splitStatements(sql);
        assertTrue(statements.stream().allMatch(s -> s.contains("IF NOT EXISTS")));
        assertTrue(statements.stream().anyMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS drawpool_mj_jobs")));
        assertTrue(statements.stream().anyMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS drawpool_users")));
        assertTrue(statements.stream().anyMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS drawpool_power_logs")));
    }
}
