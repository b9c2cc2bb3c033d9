package com.vistela.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VideoRecord {
    private String videoId;
    private String userId;
    private String filename;
    private String storageKey; // Object key returned by the blob store
    private String status; // pending, processing, completed, failed (not enforced on insert)
    private Instant createdAt;
    private Instant updatedAt;
}
