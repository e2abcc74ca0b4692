package com.dcruver.vaultdrift.store;

import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.Link;
import com.dcruver.vaultdrift.domain.SessionAlreadyExistsException;
import com.dcruver.vaultdrift.domain.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Append-only store of analysis sessions, one per date.
 *
 * A session is written in a single transaction, so readers see either the whole session or none of it.
 */
@Component
@Slf4j
public class SessionStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SessionStore(DataSource dataSource, SchemaManager schemaManager) {
        schemaManager.init();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Persist a complete session atomically.
     *
     * @throws SessionAlreadyExistsException if the date is stored and mode is REJECT_EXISTING
     */
    public void writeSession(LocalDate date, String vaultStateHash, Collection<SessionRecord> records,
                             Collection<Link> links, WriteMode mode) {
        String key = date.toString();
        transactionTemplate.executeWithoutResult(status -> {
            if (mode == WriteMode.REPLACE) {
                deleteSessionRows(key);
            } else if (exists(date)) {
                throw new SessionAlreadyExistsException(date);
            }
            try {
                jdbcTemplate.update(
                    "INSERT INTO sessions (session_date, vault_state_hash, note_count, created_at) VALUES (?, ?, ?, ?)",
                    key, vaultStateHash, records.size(), Instant.now().getEpochSecond()
                );
            } catch (DataAccessException e) {
                // another writer committed the same date in between
                if (exists(date)) {
                    throw new SessionAlreadyExistsException(date);
                }
                throw e;
            }

            List<Object[]> rows = new ArrayList<>(records.size());
            for (SessionRecord record : records) {
                Embedding embedding = record.getEmbedding();
                rows.add(new Object[] {
                    key,
                    record.getNoteId(),
                    record.getContentHash(),
                    record.getModified().toString(),
                    embedding.dimension(),
                    embedding.semanticDimension(),
                    VectorCodec.encode(embedding.values()),
                    record.getClusterId(),
                    record.getClusterLabel()
                });
            }
            jdbcTemplate.batchUpdate(
                "INSERT INTO session_embeddings (session_date, note_id, content_hash, modified, dimension, " +
                "semantic_dimension, vector, cluster_id, cluster_label) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                rows
            );

            List<Object[]> linkRows = links.stream()
                .map(l -> new Object[] {key, l.getSourceId(), l.getTargetId()})
                .collect(Collectors.toList());
            jdbcTemplate.batchUpdate(
                "INSERT OR IGNORE INTO session_links (session_date, source_id, target_id) VALUES (?, ?, ?)",
                linkRows
            );
        });
        log.info("Stored session {} with {} notes and {} links ({})", date, records.size(), links.size(), mode);
    }

    /**
     * @throws SessionNotFoundException if nothing is stored for the date
     */
    public SessionSnapshot readSession(LocalDate date) {
        return findSession(date).orElseThrow(() -> new SessionNotFoundException(date));
    }

    public Optional<SessionSnapshot> findSession(LocalDate date) {
        String key = date.toString();
        List<String> hashes = jdbcTemplate.query(
            "SELECT vault_state_hash FROM sessions WHERE session_date = ?",
            (rs, rowNum) -> rs.getString("vault_state_hash"),
            key
        );
        if (hashes.isEmpty()) {
            return Optional.empty();
        }

        Map<String, SessionRecord> records = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT * FROM session_embeddings WHERE session_date = ? ORDER BY note_id",
            new SessionRecordRowMapper(),
            key
        ).forEach(r -> records.put(r.getNoteId(), r));

        return Optional.of(new SessionSnapshot(date, hashes.get(0),
            Collections.unmodifiableMap(records), readLinks(date)));
    }

    public boolean exists(LocalDate date) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sessions WHERE session_date = ?", Integer.class, date.toString());
        return count != null && count > 0;
    }

    /**
     * Dates with stored sessions in [from, to], oldest first.
     */
    public List<LocalDate> sessionsBetween(LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT session_date FROM sessions WHERE session_date >= ? AND session_date <= ? ORDER BY session_date",
            (rs, rowNum) -> LocalDate.parse(rs.getString("session_date")),
            from.toString(), to.toString()
        );
    }

    public List<LocalDate> allSessions() {
        return jdbcTemplate.query(
            "SELECT session_date FROM sessions ORDER BY session_date",
            (rs, rowNum) -> LocalDate.parse(rs.getString("session_date"))
        );
    }

    public List<SessionSummary> summaries() {
        return jdbcTemplate.query(
            "SELECT * FROM sessions ORDER BY session_date",
            (rs, rowNum) -> new SessionSummary(
                LocalDate.parse(rs.getString("session_date")),
                rs.getInt("note_count"),
                rs.getString("vault_state_hash"),
                Instant.ofEpochSecond(rs.getLong("created_at")))
        );
    }

    public Optional<SessionRecord> readRecord(LocalDate date, String noteId) {
        List<SessionRecord> results = jdbcTemplate.query(
            "SELECT * FROM session_embeddings WHERE session_date = ? AND note_id = ?",
            new SessionRecordRowMapper(),
            date.toString(), noteId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * The note's records in the given sessions, ordered by date. Sessions without the note are skipped.
     */
    public Map<LocalDate, SessionRecord> readRecords(String noteId, Collection<LocalDate> sessions) {
        Set<String> wanted = sessions.stream().map(LocalDate::toString).collect(Collectors.toSet());
        Map<LocalDate, SessionRecord> byDate = new TreeMap<>();
        jdbcTemplate.query(
            "SELECT * FROM session_embeddings WHERE note_id = ? ORDER BY session_date",
            (ResultSet rs) -> {
                String date = rs.getString("session_date");
                if (wanted.contains(date)) {
                    byDate.put(LocalDate.parse(date), mapRecord(rs));
                }
            },
            noteId
        );
        return byDate;
    }

    public List<Link> readLinks(LocalDate date) {
        return jdbcTemplate.query(
            "SELECT source_id, target_id FROM session_links WHERE session_date = ? ORDER BY source_id, target_id",
            (rs, rowNum) -> Link.of(rs.getString("source_id"), rs.getString("target_id")),
            date.toString()
        );
    }

    /**
     * Links present in the earlier session and gone in the later one.
     */
    public List<Link> removedLinks(LocalDate earlier, LocalDate later) {
        Set<Link> remaining = new HashSet<>(readLinks(later));
        return readLinks(earlier).stream()
            .filter(l -> !remaining.contains(l))
            .collect(Collectors.toList());
    }

    private void deleteSessionRows(String key) {
        jdbcTemplate.update("DELETE FROM session_embeddings WHERE session_date = ?", key);
        jdbcTemplate.update("DELETE FROM session_links WHERE session_date = ?", key);
        jdbcTemplate.update("DELETE FROM embedding_metrics WHERE session_date = ?", key);
        jdbcTemplate.update("DELETE FROM sessions WHERE session_date = ?", key);
    }

    private static SessionRecord mapRecord(ResultSet rs) throws SQLException {
        String noteId = rs.getString("note_id");
        double[] vector = VectorCodec.decode(rs.getBytes("vector"), rs.getInt("dimension"),
            "note " + noteId + " in session " + rs.getString("session_date"));
        int clusterId = rs.getInt("cluster_id");
        boolean noise = rs.wasNull();
        return SessionRecord.builder()
            .noteId(noteId)
            .contentHash(rs.getString("content_hash"))
            .modified(LocalDateTime.parse(rs.getString("modified")))
            .embedding(new Embedding(vector, rs.getInt("semantic_dimension")))
            .clusterId(noise ? null : clusterId)
            .clusterLabel(rs.getString("cluster_label"))
            .build();
    }

    /**
     * Row mapper for SessionRecord
     */
    private static class SessionRecordRowMapper implements RowMapper<SessionRecord> {
        @Override
        public SessionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return mapRecord(rs);
        }
    }
}
