package io.querygate.sql.common.auth;

public class ShowCatalogsForbiddenException extends UnauthorizedException {
    public static final String MESSAGE = "SHOW CATALOGS is not allowed; use the catalogs API instead";

    public ShowCatalogsForbiddenException() {
        super(MESSAGE);
    }
}
