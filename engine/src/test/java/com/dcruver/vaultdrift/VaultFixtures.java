package com.dcruver.vaultdrift;

import com.dcruver.vaultdrift.app.DataSourceConfig;
import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.store.SessionRecord;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Shared builders for notes, records and a file-backed test database.
 */
public final class VaultFixtures {

    public static final LocalDateTime CREATED = LocalDateTime.of(2024, 6, 1, 9, 0);

    private VaultFixtures() {
    }

    public static DataSource dataSource(Path dir) {
        try {
            return DataSourceConfig.sqliteDataSource(dir.resolve("vaultdrift-test.db"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Defaults with fast retries and small clusters.
     */
    public static EngineProperties properties() {
        EngineProperties properties = new EngineProperties();
        properties.getEmbedding().setRetryWait(Duration.ofMillis(1));
        properties.getEmbedding().setTimeout(Duration.ofSeconds(5));
        properties.getEmbedding().setHashingDimension(32);
        properties.getClustering().setMinClusterSize(3);
        properties.getClustering().setMinSamples(2);
        return properties;
    }

    public static Note note(String id, String content) {
        return note(id, content, CREATED);
    }

    public static Note note(String id, String content, LocalDateTime created) {
        return Note.builder()
            .id(id)
            .title(id)
            .content(content)
            .created(created)
            .modified(created)
            .build();
    }

    public static SessionRecord record(String noteId, double... values) {
        return clusteredRecord(noteId, null, values);
    }

    public static SessionRecord clusteredRecord(String noteId, Integer clusterId, double... values) {
        return SessionRecord.builder()
            .noteId(noteId)
            .contentHash(Note.hash(noteId))
            .modified(CREATED)
            .embedding(new Embedding(values, values.length))
            .clusterId(clusterId)
            .clusterLabel(clusterId == null ? null : "label " + clusterId)
            .build();
    }
}
