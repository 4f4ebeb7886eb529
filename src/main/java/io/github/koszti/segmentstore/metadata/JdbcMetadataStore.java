package io.github.koszti.segmentstore.metadata;

import io.github.koszti.segmentstore.exception.StorageDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Relational metadata store (MySQL / TiDB compatible SQL, see schema.sql).
 */
@Component
@ConditionalOnProperty(prefix = "store.metadata", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcMetadataStore implements MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcMetadataStore.class);

    private static final String INSERT_FILE =
            "INSERT INTO files (id, name, size, segment_count, created_at) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_SEGMENT =
            "INSERT INTO segments (id, file_id, order_index, hash, blob_key, size) VALUES (?, ?, ?, ?, ?, ?)";
    private static final String SELECT_FILE =
            "SELECT id, name, size, segment_count, created_at FROM files WHERE id = ?";
    private static final String SELECT_SEGMENTS =
            "SELECT id, file_id, order_index, hash, blob_key, size FROM segments "
                    + "WHERE file_id = ? ORDER BY order_index ASC";

    private static final RowMapper<FileRecord> FILE_ROW_MAPPER = (rs, rowNum) -> new FileRecord(
            rs.getString("id"),
            rs.getString("name"),
            rs.getLong("size"),
            rs.getInt("segment_count"),
            rs.getTimestamp("created_at").toInstant()
    );

    private static final RowMapper<SegmentRecord> SEGMENT_ROW_MAPPER = (rs, rowNum) -> new SegmentRecord(
            rs.getString("id"),
            rs.getString("file_id"),
            rs.getInt("order_index"),
            rs.getString("hash"),
            rs.getString("blob_key"),
            rs.getLong("size")
    );

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcMetadataStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
    }

    @Override
    public void createFile(FileRecord file) {
        try {
            jdbcTemplate.update(INSERT_FILE,
                    file.id(),
                    file.name(),
                    file.size(),
                    file.segmentCount(),
                    Timestamp.from(file.createdAt()));
        } catch (DataAccessException e) {
            throw failure("Failed to insert file " + file.id(), e);
        }
    }

    @Override
    public void createSegment(SegmentRecord segment) {
        try {
            jdbcTemplate.update(INSERT_SEGMENT,
                    segment.id(),
                    segment.fileId(),
                    segment.orderIndex(),
                    segment.hash(),
                    segment.blobKey(),
                    segment.size());
        } catch (DataAccessException e) {
            throw failure("Failed to insert segment " + segment.orderIndex() + " of file " + segment.fileId(), e);
        }
    }

    /**
     * Inserts the file row and every segment row in one transaction, so readers never see a
     * file whose segment count disagrees with its persisted segments.
     */
    @Override
    public void createFileWithSegments(FileRecord file, List<SegmentRecord> segments) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                createFile(file);
                if (!segments.isEmpty()) {
                    jdbcTemplate.batchUpdate(INSERT_SEGMENT, segments, segments.size(), (ps, segment) -> {
                        ps.setString(1, segment.id());
                        ps.setString(2, segment.fileId());
                        ps.setInt(3, segment.orderIndex());
                        ps.setString(4, segment.hash());
                        ps.setString(5, segment.blobKey());
                        ps.setLong(6, segment.size());
                    });
                }
            });
        } catch (DataAccessException e) {
            throw failure("Failed to commit metadata for file " + file.id(), e);
        }
        log.debug("Committed metadata for file {} ({} segments)", file.id(), segments.size());
    }

    @Override
    public Optional<FileRecord> getFile(String fileId) {
        try {
            List<FileRecord> rows = jdbcTemplate.query(SELECT_FILE, FILE_ROW_MAPPER, fileId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw failure("Failed to query file " + fileId, e);
        }
    }

    @Override
    public List<SegmentRecord> getSegments(String fileId) {
        try {
            return jdbcTemplate.query(SELECT_SEGMENTS, SEGMENT_ROW_MAPPER, fileId);
        } catch (DataAccessException e) {
            throw failure("Failed to query segments of file " + fileId, e);
        }
    }

    private static StorageDependencyException failure(String message, DataAccessException e) {
        return new StorageDependencyException(StorageDependencyException.Dependency.METADATA_STORE,
                message + ": " + e.getMostSpecificCause().getMessage(), e);
    }
}
