package com.vineroute.hoscompliance.exception;

/**
 * Generic storage failure. The underlying cause is kept for logging only
 * and is never exposed in the API response.
 */
public class StorageUnavailableException extends ComplianceException {

    public StorageUnavailableException(String operation, Throwable cause) {
        super(ErrorCategory.STORAGE, "Storage unavailable during " + operation, cause);
    }
}
