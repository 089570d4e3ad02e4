package com.whereq.easel.exception;

/**
 * Exception thrown when an input asset cannot be uploaded to the engine
 */
public class AssetUploadException extends RuntimeException {
    public AssetUploadException(String message) {
        super(message);
    }

    public AssetUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
