package com.vistela.exception;

public class IllegalStatusTransitionException extends RuntimeException {

    private final String videoId;
    private final String currentStatus;
    private final String targetStatus;

    public IllegalStatusTransitionException(String videoId, String currentStatus, String targetStatus) {
        super(String.format("Video %s cannot move from '%s' to '%s'", videoId, currentStatus, targetStatus));
        this.videoId = videoId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }

    public String getTargetStatus() {
        return targetStatus;
    }
}
