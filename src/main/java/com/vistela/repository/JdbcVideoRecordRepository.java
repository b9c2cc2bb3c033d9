package com.vistela.repository;

import com.vistela.config.DatabaseProps;
import com.vistela.exception.ConfigurationException;
import com.vistela.exception.IllegalStatusTransitionException;
import com.vistela.exception.VideoAlreadyExistsException;
import com.vistela.exception.VideoStoreException;
import com.vistela.exception.VideoStoreUnavailableException;
import com.vistela.model.VideoRecord;
import com.vistela.model.VideoStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link VideoRecordRepository} over the {@code videos} table. Each call borrows one pooled
 * connection through {@link JdbcTemplate}, which returns it on every exit path.
 */
@Repository
@Slf4j
public class JdbcVideoRecordRepository implements VideoRecordRepository {

    private static final String COLUMNS =
            "video_id, user_id, filename, storage_key, status, created_at, updated_at";

    private static final RowMapper<VideoRecord> ROW_MAPPER = (rs, rowNum) -> VideoRecord.builder()
            .videoId(rs.getString("video_id"))
            .userId(rs.getString("user_id"))
            .filename(rs.getString("filename"))
            .storageKey(rs.getString("storage_key"))
            .status(rs.getString("status"))
            .createdAt(fromColumn(rs.getObject("created_at", LocalDateTime.class)))
            .updatedAt(fromColumn(rs.getObject("updated_at", LocalDateTime.class)))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final DatabaseProps props;
    private final Clock clock;

    public JdbcVideoRecordRepository(JdbcTemplate jdbcTemplate, DatabaseProps props, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public boolean insert(VideoRecord record) {
        requireConfiguration();
        String videoId = record.getVideoId();
        String status = record.getStatus() != null ? record.getStatus() : VideoStatus.DEFAULT.value();
        LocalDateTime now = toColumn(now());

        try {
            jdbcTemplate.update(
                    "INSERT INTO videos (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                    videoId,
                    record.getUserId(),
                    record.getFilename(),
                    record.getStorageKey(),
                    status,
                    now,
                    now);
        } catch (DuplicateKeyException e) {
            log.warn("Video {} already exists", videoId);
            throw new VideoAlreadyExistsException(videoId, e);
        } catch (DataAccessException e) {
            throw translate("inserting video " + videoId, e);
        }

        log.info("Inserted video {} for user {}", videoId, record.getUserId());
        return true;
    }

    @Override
    public Optional<VideoRecord> get(String videoId) {
        requireConfiguration();
        try {
            List<VideoRecord> rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM videos WHERE video_id = ?",
                    ROW_MAPPER,
                    videoId);
            log.debug("Lookup of video {} found {} row(s)", videoId, rows.size());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw translate("getting video " + videoId, e);
        }
    }

    @Override
    public List<VideoRecord> list(String userId, String status, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        requireConfiguration();

        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM videos WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (userId != null) {
            sql.append(" AND user_id = ?");
            params.add(userId);
        }
        if (status != null) {
            sql.append(" AND status = ?");
            params.add(status);
        }
        // video_id keeps rows with equal created_at in a stable order
        sql.append(" ORDER BY created_at DESC, video_id DESC LIMIT ?");
        params.add(limit);

        try {
            List<VideoRecord> rows = jdbcTemplate.query(sql.toString(), ROW_MAPPER, params.toArray());
            log.debug("Listed {} video(s) for user={} status={}", rows.size(), userId, status);
            return rows;
        } catch (DataAccessException e) {
            throw translate("listing videos", e);
        }
    }

    @Override
    public Optional<VideoRecord> updateStatus(String videoId, VideoStatus target) {
        requireConfiguration();
        Set<VideoStatus> predecessors = VideoStatus.predecessorsOf(target);

        int updated = 0;
        if (!predecessors.isEmpty()) {
            String placeholders = predecessors.stream().map(s -> "?").collect(Collectors.joining(", "));
            List<Object> params = new ArrayList<>();
            params.add(target.value());
            params.add(toColumn(now()));
            params.add(videoId);
            predecessors.forEach(s -> params.add(s.value()));

            try {
                // GREATEST keeps updated_at >= created_at if the clock steps back
                updated = jdbcTemplate.update(
                        "UPDATE videos SET status = ?, updated_at = GREATEST(created_at, CAST(? AS TIMESTAMP))"
                                + " WHERE video_id = ? AND status IN (" + placeholders + ")",
                        params.toArray());
            } catch (DataAccessException e) {
                throw translate("updating status of video " + videoId, e);
            }
        }

        Optional<VideoRecord> current = get(videoId);
        if (updated > 0) {
            log.info("Video {} moved to {}", videoId, target.value());
            return current;
        }
        if (current.isEmpty()) {
            return current;
        }
        String currentStatus = current.get().getStatus();
        log.warn("Rejected status change of video {} from {} to {}", videoId, currentStatus, target.value());
        throw new IllegalStatusTransitionException(videoId, currentStatus, target.value());
    }

    @Override
    public boolean delete(String videoId) {
        requireConfiguration();
        try {
            int deleted = jdbcTemplate.update("DELETE FROM videos WHERE video_id = ?", videoId);
            if (deleted > 0) {
                log.info("Deleted video {}", videoId);
            }
            return deleted > 0;
        } catch (DataAccessException e) {
            throw translate("deleting video " + videoId, e);
        }
    }

    @Override
    public Map<String, Long> countByStatus(String userId) {
        requireConfiguration();
        String sql = "SELECT status, COUNT(*) AS total FROM videos"
                + (userId != null ? " WHERE user_id = ?" : "")
                + " GROUP BY status ORDER BY status";
        Object[] params = userId != null ? new Object[]{userId} : new Object[0];

        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            jdbcTemplate.query(sql, rs -> {
                counts.put(rs.getString("status"), rs.getLong("total"));
            }, params);
            return counts;
        } catch (DataAccessException e) {
            throw translate("counting videos", e);
        }
    }

    private void requireConfiguration() {
        try {
            props.requireComplete();
        } catch (ConfigurationException e) {
            log.error("Database configuration error: {}", e.getMessage());
            throw e;
        }
    }

    private Instant now() {
        // Postgres keeps microseconds
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * The timestamp columns carry no zone; they always hold UTC wall-clock time.
     */
    private static LocalDateTime toColumn(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant fromColumn(LocalDateTime value) {
        return value.toInstant(ZoneOffset.UTC);
    }

    private VideoStoreException translate(String action, DataAccessException e) {
        if (e instanceof CannotGetJdbcConnectionException) {
            log.error("No database connection available while {}: {}", action, e.getMessage());
            return new VideoStoreUnavailableException("Database unavailable while " + action, e);
        }
        log.error("Database error while {}: {}", action, e.getMessage(), e);
        return new VideoStoreException("Database error while " + action, e);
    }
}
