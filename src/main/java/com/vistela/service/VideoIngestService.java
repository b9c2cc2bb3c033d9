package com.vistela.service;

import com.vistela.exception.VideoAlreadyExistsException;
import com.vistela.exception.VideoStoreException;
import com.vistela.model.VideoRecord;
import com.vistela.model.VideoStatus;
import com.vistela.repository.VideoRecordRepository;
import com.vistela.storage.BlobStore;
import com.vistela.storage.StorageKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Stores an uploaded video: the bytes go to object storage, the metadata to the videos table.
 */
@Service
@Slf4j
public class VideoIngestService {

    static final String VIDEO_FOLDER = "videos";

    private final BlobStore blobStore;
    private final VideoRecordRepository videoRecordRepository;

    public VideoIngestService(BlobStore blobStore, VideoRecordRepository videoRecordRepository) {
        this.blobStore = blobStore;
        this.videoRecordRepository = videoRecordRepository;
    }

    /**
     * Upload {@code source} under a key derived from the video id and record it as pending.
     *
     * @return the record as stored, with timestamps
     * @throws VideoAlreadyExistsException if the video id is taken; nothing is uploaded in that case
     *                                     unless a concurrent ingest claimed the id after the check
     */
    public VideoRecord ingest(String videoId, String userId, String filename, Resource source) throws IOException {
        if (videoRecordRepository.get(videoId).isPresent()) {
            log.warn("Refusing to ingest video {}: id already in use", videoId);
            throw new VideoAlreadyExistsException(videoId, null);
        }

        String storageKey = blobStore.upload(source, StorageKeys.forVideo(videoId, filename), VIDEO_FOLDER);

        try {
            videoRecordRepository.insert(VideoRecord.builder()
                    .videoId(videoId)
                    .userId(userId)
                    .filename(filename)
                    .storageKey(storageKey)
                    .status(VideoStatus.DEFAULT.value())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Recording video {} failed; uploaded object {} is orphaned", videoId, storageKey, e);
            throw e;
        }

        log.info("Ingested video {} ({}) for user {} at {}", videoId, filename, userId, storageKey);
        return videoRecordRepository.get(videoId)
                .orElseThrow(() -> new VideoStoreException("Video " + videoId + " not readable after insert", null));
    }
}
