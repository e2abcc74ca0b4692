package com.dcruver.vaultdrift.store;

import com.dcruver.vaultdrift.VaultFixtures;
import com.dcruver.vaultdrift.domain.CacheCorruptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SchemaManagerTest {

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        dataSource = VaultFixtures.dataSource(tempDir);
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @Test
    void testFreshDatabaseGetsCurrentVersion() {
        SchemaManager schemaManager = new SchemaManager(dataSource);
        assertEquals(0, schemaManager.currentVersion());

        schemaManager.init();

        assertEquals(SchemaManager.SCHEMA_VERSION, schemaManager.currentVersion());
    }

    @Test
    void testReopeningExistingDatabase() {
        new SchemaManager(dataSource).init();

        assertDoesNotThrow(() -> new SchemaManager(dataSource).init());
    }

    @Test
    void testOtherVersionIsCorruption() {
        jdbcTemplate.execute("PRAGMA user_version = 99");

        CacheCorruptionException error = assertThrows(CacheCorruptionException.class,
            () -> new SchemaManager(dataSource).init());
        assertTrue(error.getMessage().contains("99"));
    }

    @Test
    void testMissingColumnIsCorruption() {
        jdbcTemplate.execute("CREATE TABLE sessions (session_date TEXT PRIMARY KEY)");

        assertThrows(CacheCorruptionException.class, () -> new SchemaManager(dataSource).init());
    }

    @Test
    void testTruncatedVectorIsCorruption() {
        byte[] blob = VectorCodec.encode(new double[] {0.1, 0.2, 0.3});

        assertArrayEquals(new double[] {0.1, 0.2, 0.3}, VectorCodec.decode(blob, 3, "test"));
        assertThrows(CacheCorruptionException.class, () -> VectorCodec.decode(blob, 4, "test"));
        assertThrows(CacheCorruptionException.class, () -> VectorCodec.decode(new byte[5], 1, "test"));
        assertThrows(CacheCorruptionException.class, () -> VectorCodec.decode(null, 1, "test"));
    }
}
