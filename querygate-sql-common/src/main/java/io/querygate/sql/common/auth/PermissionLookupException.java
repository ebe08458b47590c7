package io.querygate.sql.common.auth;

/**
 * The caller's catalog permissions could not be determined. Callers must treat this as a denial.
 */
public class PermissionLookupException extends Exception {
    public PermissionLookupException(String message) {
        super(message);
    }

    public PermissionLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
