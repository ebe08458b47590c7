package io.querygate.sql.catalog.authorization;

/**
 * Used when no role source is configured: every caller may access every catalog.
 */
public class UnrestrictedPermissionSource implements PermissionSource {
    @Override
    public AllowedCatalogs allowedCatalogs(String callerId) {
        return AllowedCatalogs.unrestricted();
    }
}
