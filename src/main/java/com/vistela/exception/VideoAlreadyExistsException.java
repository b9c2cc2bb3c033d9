package com.vistela.exception;

public class VideoAlreadyExistsException extends RuntimeException {

    private final String videoId;

    public VideoAlreadyExistsException(String videoId, Throwable cause) {
        super("Video already exists: " + videoId, cause);
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }
}
