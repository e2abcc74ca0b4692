package com.dcruver.vaultdrift.store;

import com.dcruver.vaultdrift.domain.CacheCorruptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates and verifies the SQLite schema. The schema version lives in {@code PRAGMA user_version};
 * a database written by another version is treated as corrupt rather than migrated.
 */
@Component
@Slf4j
public class SchemaManager {

    public static final int SCHEMA_VERSION = 1;

    private static final Map<String, String> TABLES = new LinkedHashMap<>();
    private static final Map<String, List<String>> COLUMNS = new LinkedHashMap<>();

    static {
        TABLES.put("notes", """
            CREATE TABLE IF NOT EXISTS notes (
                note_id TEXT PRIMARY KEY,
                title TEXT NOT NULL,
                content TEXT NOT NULL,
                content_hash TEXT NOT NULL,
                created TEXT NOT NULL,
                modified TEXT NOT NULL,
                is_virtual INTEGER NOT NULL DEFAULT 0,
                source_ref TEXT
            )
            """);
        COLUMNS.put("notes", List.of("note_id", "title", "content", "content_hash", "created", "modified",
            "is_virtual", "source_ref"));

        TABLES.put("links", """
            CREATE TABLE IF NOT EXISTS links (
                source_id TEXT NOT NULL,
                target_id TEXT NOT NULL,
                PRIMARY KEY (source_id, target_id)
            )
            """);
        COLUMNS.put("links", List.of("source_id", "target_id"));

        TABLES.put("semantic_cache", """
            CREATE TABLE IF NOT EXISTS semantic_cache (
                content_hash TEXT NOT NULL,
                model TEXT NOT NULL,
                dimension INTEGER NOT NULL,
                vector BLOB NOT NULL,
                created_at INTEGER NOT NULL,
                PRIMARY KEY (content_hash, model)
            )
            """);
        COLUMNS.put("semantic_cache", List.of("content_hash", "model", "dimension", "vector", "created_at"));

        TABLES.put("sessions", """
            CREATE TABLE IF NOT EXISTS sessions (
                session_date TEXT PRIMARY KEY,
                vault_state_hash TEXT NOT NULL,
                note_count INTEGER NOT NULL,
                created_at INTEGER NOT NULL
            )
            """);
        COLUMNS.put("sessions", List.of("session_date", "vault_state_hash", "note_count", "created_at"));

        TABLES.put("session_embeddings", """
            CREATE TABLE IF NOT EXISTS session_embeddings (
                session_date TEXT NOT NULL,
                note_id TEXT NOT NULL,
                content_hash TEXT NOT NULL,
                modified TEXT NOT NULL,
                dimension INTEGER NOT NULL,
                semantic_dimension INTEGER NOT NULL,
                vector BLOB NOT NULL,
                cluster_id INTEGER,
                cluster_label TEXT,
                PRIMARY KEY (session_date, note_id)
            )
            """);
        COLUMNS.put("session_embeddings", List.of("session_date", "note_id", "content_hash", "modified",
            "dimension", "semantic_dimension", "vector", "cluster_id", "cluster_label"));

        TABLES.put("session_links", """
            CREATE TABLE IF NOT EXISTS session_links (
                session_date TEXT NOT NULL,
                source_id TEXT NOT NULL,
                target_id TEXT NOT NULL,
                PRIMARY KEY (session_date, source_id, target_id)
            )
            """);
        COLUMNS.put("session_links", List.of("session_date", "source_id", "target_id"));

        TABLES.put("embedding_metrics", """
            CREATE TABLE IF NOT EXISTS embedding_metrics (
                session_date TEXT PRIMARY KEY,
                metrics_json TEXT NOT NULL,
                computed_at INTEGER NOT NULL
            )
            """);
        COLUMNS.put("embedding_metrics", List.of("session_date", "metrics_json", "computed_at"));
    }

    private final JdbcTemplate jdbcTemplate;
    private volatile boolean ready;

    public SchemaManager(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    /**
     * Create missing tables on a fresh database, verify an existing one.
     */
    @PostConstruct
    public synchronized void init() {
        if (ready) {
            return;
        }
        int version = currentVersion();
        if (version != 0 && version != SCHEMA_VERSION) {
            throw new CacheCorruptionException(String.format(
                "Database schema version %d does not match expected version %d", version, SCHEMA_VERSION));
        }

        TABLES.values().forEach(jdbcTemplate::execute);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_session_embeddings_note
            ON session_embeddings(note_id, session_date)
            """);
        verifyColumns();

        if (version == 0) {
            jdbcTemplate.execute("PRAGMA user_version = " + SCHEMA_VERSION);
            log.info("Created schema version {}", SCHEMA_VERSION);
        }
        ready = true;
        log.info("Initialized drift store (schema version {})", SCHEMA_VERSION);
    }

    public int currentVersion() {
        Integer version = jdbcTemplate.queryForObject("PRAGMA user_version", Integer.class);
        return version == null ? 0 : version;
    }

    private void verifyColumns() {
        for (Map.Entry<String, List<String>> table : COLUMNS.entrySet()) {
            Set<String> actual = new HashSet<>(jdbcTemplate.query(
                "PRAGMA table_info(" + table.getKey() + ")",
                (rs, rowNum) -> rs.getString("name")));
            for (String column : table.getValue()) {
                if (!actual.contains(column)) {
                    throw new CacheCorruptionException(String.format(
                        "Table %s is missing column %s", table.getKey(), column));
                }
            }
        }
    }
}
