package com.dcruver.vaultdrift.store;

import com.dcruver.vaultdrift.domain.Link;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.domain.NoteCorpus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Current notes and links, as last handed over by the ingestion layer.
 */
@Component
@Slf4j
public class NoteRepository {

    private static final int ID_CHUNK = 500;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public NoteRepository(DataSource dataSource, SchemaManager schemaManager) {
        schemaManager.init();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Replace the stored corpus with a new one in one transaction.
     */
    public void replaceCorpus(NoteCorpus corpus) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("DELETE FROM links");
            jdbcTemplate.update("DELETE FROM notes");
            jdbcTemplate.batchUpdate(
                "INSERT INTO notes (note_id, title, content, content_hash, created, modified, is_virtual, source_ref) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                corpus.notes().stream()
                    .map(n -> new Object[] {
                        n.getId(),
                        n.getTitle() == null ? n.getId() : n.getTitle(),
                        n.getContent() == null ? "" : n.getContent(),
                        n.getContentHash(),
                        n.getCreated().toString(),
                        n.getModified().toString(),
                        n.isVirtual() ? 1 : 0,
                        n.getSourceRef()
                    })
                    .collect(Collectors.toList())
            );
            jdbcTemplate.batchUpdate(
                "INSERT INTO links (source_id, target_id) VALUES (?, ?)",
                corpus.links().stream()
                    .map(l -> new Object[] {l.getSourceId(), l.getTargetId()})
                    .collect(Collectors.toList())
            );
        });
        log.info("Stored corpus of {} notes and {} links", corpus.size(), corpus.links().size());
    }

    public NoteCorpus loadCorpus() {
        return new NoteCorpus(findAll(), links());
    }

    public List<Note> findAll() {
        return jdbcTemplate.query("SELECT * FROM notes ORDER BY note_id", new NoteRowMapper());
    }

    public List<Link> links() {
        return jdbcTemplate.query(
            "SELECT source_id, target_id FROM links ORDER BY source_id, target_id",
            (rs, rowNum) -> Link.of(rs.getString("source_id"), rs.getString("target_id"))
        );
    }

    public Optional<Note> findById(String noteId) {
        List<Note> results = jdbcTemplate.query("SELECT * FROM notes WHERE note_id = ?", new NoteRowMapper(), noteId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Notes for the given ids, skipping ids no longer stored. Ordered by id.
     */
    public List<Note> findAllById(Collection<String> noteIds) {
        List<String> ids = new ArrayList<>(new TreeSet<>(noteIds));
        List<Note> notes = new ArrayList<>(ids.size());
        // bound parameters per statement are limited, so large id sets go in chunks
        for (int from = 0; from < ids.size(); from += ID_CHUNK) {
            List<String> chunk = ids.subList(from, Math.min(ids.size(), from + ID_CHUNK));
            String placeholders = chunk.stream().map(id -> "?").collect(Collectors.joining(", "));
            notes.addAll(jdbcTemplate.query(
                "SELECT * FROM notes WHERE note_id IN (" + placeholders + ") ORDER BY note_id",
                new NoteRowMapper(),
                chunk.toArray()
            ));
        }
        return notes;
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM notes", Integer.class);
        return count == null ? 0 : count;
    }

    /**
     * Row mapper for Note
     */
    private static class NoteRowMapper implements RowMapper<Note> {
        @Override
        public Note mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Note.builder()
                .id(rs.getString("note_id"))
                .title(rs.getString("title"))
                .content(rs.getString("content"))
                .created(LocalDateTime.parse(rs.getString("created")))
                .modified(LocalDateTime.parse(rs.getString("modified")))
                .virtual(rs.getInt("is_virtual") == 1)
                .sourceRef(rs.getString("source_ref"))
                .build();
        }
    }
}
