package com.vistela.exception;

/**
 * Upload to object storage failed after the SDK gave up retrying.
 */
public class BlobStoreException extends RuntimeException {

    public enum Reason {
        /** Credentials rejected or bucket policy denies the write */
        ACCESS_DENIED,
        /** Bucket does not exist */
        NOT_FOUND,
        /** Network error, throttling or server-side error */
        TRANSIENT,
        /** Any other request the service refused */
        REJECTED
    }

    private final Reason reason;
    private final String key;

    public BlobStoreException(Reason reason, String key, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.key = key;
    }

    public Reason getReason() {
        return reason;
    }

    public String getKey() {
        return key;
    }
}
