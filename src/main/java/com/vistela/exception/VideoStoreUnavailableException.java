package com.vistela.exception;

/**
 * No connection could be obtained from the pool within the configured timeout.
 */
public class VideoStoreUnavailableException extends VideoStoreException {

    public VideoStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
