package com.pixshare.service;

/**
 * An upload through a share link exceeded the link's size or file-count quota.
 */
public class UploadLimitException extends RuntimeException {

    public UploadLimitException(String message) {
        super(message);
    }
}
