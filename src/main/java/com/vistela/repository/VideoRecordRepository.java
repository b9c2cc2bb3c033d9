package com.vistela.repository;

import com.vistela.model.VideoRecord;
import com.vistela.model.VideoStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of {@link VideoRecord}s keyed by video id.
 * <p>
 * Every operation validates the database settings first and throws
 * {@link com.vistela.exception.ConfigurationException} before touching the connection pool.
 * Database failures surface as {@link com.vistela.exception.VideoStoreException}.
 */
public interface VideoRecordRepository {

    int DEFAULT_LIST_LIMIT = 100;

    /**
     * Insert a new record. Timestamps are assigned by the store; a missing status becomes "pending".
     *
     * @throws com.vistela.exception.VideoAlreadyExistsException if the video id is taken
     */
    boolean insert(VideoRecord record);

    Optional<VideoRecord> get(String videoId);

    /**
     * Records matching every given filter, newest first, at most {@code limit} of them.
     *
     * @param userId optional owner filter
     * @param status optional status filter
     */
    List<VideoRecord> list(String userId, String status, int limit);

    default List<VideoRecord> list(String userId, String status) {
        return list(userId, status, DEFAULT_LIST_LIMIT);
    }

    /**
     * Move a video to {@code target} if its current status allows it.
     *
     * @return the updated record, or empty if the video does not exist
     * @throws com.vistela.exception.IllegalStatusTransitionException if the current status does not lead to {@code target}
     */
    Optional<VideoRecord> updateStatus(String videoId, VideoStatus target);

    boolean delete(String videoId);

    /**
     * Number of records per status value, optionally for one user.
     */
    Map<String, Long> countByStatus(String userId);
}
