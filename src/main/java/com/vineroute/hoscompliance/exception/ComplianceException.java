package com.vineroute.hoscompliance.exception;

/**
 * Base class for every typed error raised by the compliance core.
 *
 * Compliance violations are NOT exceptions: they are returned as
 * {@link com.vineroute.hoscompliance.model.ComplianceViolation} values.
 * Only conditions that reject a request extend this class.
 */
public abstract class ComplianceException extends RuntimeException {

    private final ErrorCategory category;

    protected ComplianceException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected ComplianceException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /** Stable machine-readable code, e.g. "AlreadyClockedIn" */
    public String getErrorCode() {
        String simpleName = getClass().getSimpleName();
        return simpleName.endsWith("Exception")
                ? simpleName.substring(0, simpleName.length() - "Exception".length())
                : simpleName;
    }
}
