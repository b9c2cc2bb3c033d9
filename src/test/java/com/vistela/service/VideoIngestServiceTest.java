package com.vistela.service;

import com.vistela.exception.BlobStoreException;
import com.vistela.exception.VideoAlreadyExistsException;
import com.vistela.model.VideoRecord;
import com.vistela.repository.VideoRecordRepository;
import com.vistela.storage.BlobStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.core.io.ByteArrayResource;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class VideoIngestServiceTest {

    private final BlobStore blobStore = mock(BlobStore.class);
    private final VideoRecordRepository repository = mock(VideoRecordRepository.class);
    private final VideoIngestService service = new VideoIngestService(blobStore, repository);

    private final ByteArrayResource source = new ByteArrayResource(new byte[]{1, 2, 3});

    @Test
    void uploadsUnderVideoIdThenRecordsPendingVideo() throws Exception {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        VideoRecord stored = VideoRecord.builder()
                .videoId("vid-1").userId("user-1").filename("Clip.MP4").storageKey("videos/vid-1.mp4")
                .status("pending").createdAt(now).updatedAt(now)
                .build();
        when(repository.get("vid-1")).thenReturn(Optional.empty(), Optional.of(stored));
        when(blobStore.upload(source, "vid-1.mp4", "videos")).thenReturn("videos/vid-1.mp4");

        VideoRecord result = service.ingest("vid-1", "user-1", "Clip.MP4", source);

        ArgumentCaptor<VideoRecord> inserted = ArgumentCaptor.forClass(VideoRecord.class);
        verify(repository).insert(inserted.capture());
        assertThat(inserted.getValue().getStorageKey()).isEqualTo("videos/vid-1.mp4");
        assertThat(inserted.getValue().getFilename()).isEqualTo("Clip.MP4");
        assertThat(inserted.getValue().getStatus()).isEqualTo("pending");
        assertThat(inserted.getValue().getCreatedAt()).isNull();
        assertThat(result).isEqualTo(stored);
    }

    @Test
    void takenIdIsRejectedBeforeUploading() throws Exception {
        when(repository.get("vid-1")).thenReturn(Optional.of(VideoRecord.builder().videoId("vid-1").build()));

        assertThatThrownBy(() -> service.ingest("vid-1", "user-1", "clip.mp4", source))
                .isInstanceOf(VideoAlreadyExistsException.class);

        verify(blobStore, never()).upload(any(), anyString(), any());
        verify(repository, never()).insert(any());
    }

    @Test
    void failedUploadRecordsNothing() throws Exception {
        when(repository.get("vid-1")).thenReturn(Optional.empty());
        when(blobStore.upload(eq(source), anyString(), anyString()))
                .thenThrow(new BlobStoreException(BlobStoreException.Reason.ACCESS_DENIED, "videos/vid-1.mp4",
                        "denied", null));

        assertThatThrownBy(() -> service.ingest("vid-1", "user-1", "clip.mp4", source))
                .isInstanceOf(BlobStoreException.class);

        verify(repository, never()).insert(any());
    }

    @Test
    void failedInsertAfterUploadReportsOrphanedObject(CapturedOutput output) throws Exception {
        VideoAlreadyExistsException conflict = new VideoAlreadyExistsException("vid-1", null);
        when(repository.get("vid-1")).thenReturn(Optional.empty());
        when(blobStore.upload(source, "vid-1.mp4", "videos")).thenReturn("videos/vid-1.mp4");
        when(repository.insert(any())).thenThrow(conflict);

        assertThatThrownBy(() -> service.ingest("vid-1", "user-1", "clip.mp4", source))
                .isSameAs(conflict);

        verify(blobStore).upload(source, "vid-1.mp4", "videos");
        assertThat(output).contains("Recording video vid-1 failed; uploaded object videos/vid-1.mp4 is orphaned")
                .contains("VideoAlreadyExistsException");
    }
}
