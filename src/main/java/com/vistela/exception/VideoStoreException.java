package com.vistela.exception;

/**
 * Database failure while reading or writing video records. The driver exception is kept as cause.
 */
public class VideoStoreException extends RuntimeException {

    public VideoStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
