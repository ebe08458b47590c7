package io.querygate.sql.catalog.authorization;

import io.querygate.sql.common.auth.PermissionLookupException;

import java.util.Objects;

/**
 * @param callerId identity of the caller, used for logging and lookups
 * @param allowed  the caller's allowed catalogs
 * @param canEdit  whether the caller may edit the query, which also trusts raw parameter values
 */
public record PermissionContext(String callerId, AllowedCatalogs allowed, boolean canEdit) {

    public PermissionContext {
        Objects.requireNonNull(allowed, "allowed");
    }

    public static PermissionContext lookup(PermissionSource source, String callerId, boolean canEdit)
            throws PermissionLookupException {
        return new PermissionContext(callerId, source.allowedCatalogs(callerId), canEdit);
    }
}
