package io.querygate.sql.common.auth;

/**
 * The query touches at least one catalog outside the caller's allowed set. The message
 * never names the offending catalogs.
 */
public class CatalogAccessDeniedException extends UnauthorizedException {
    public static final String MESSAGE = "access denied to catalog";

    public CatalogAccessDeniedException() {
        super(MESSAGE);
    }
}
