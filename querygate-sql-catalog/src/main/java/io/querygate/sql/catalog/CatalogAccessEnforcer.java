package io.querygate.sql.catalog;

import io.querygate.sql.catalog.authorization.AllowedCatalogs;
import io.querygate.sql.catalog.authorization.PermissionContext;
import io.querygate.sql.catalog.authorization.PermissionSource;
import io.querygate.sql.common.auth.CatalogAccessDeniedException;
import io.querygate.sql.common.auth.PermissionLookupException;
import io.querygate.sql.common.auth.ShowCatalogsForbiddenException;
import io.querygate.sql.common.auth.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a query may run against the catalogs it touches.
 * <p>
 * Denials carry a fixed message; the rejected catalog names are only written to the server log.
 */
public final class CatalogAccessEnforcer {

    private static final Logger logger = LoggerFactory.getLogger(CatalogAccessEnforcer.class);

    private CatalogAccessEnforcer() {
    }

    /**
     * Looks up the caller's permissions and checks the query against them.
     *
     * @throws PermissionLookupException if the caller's permissions cannot be determined
     * @throws UnauthorizedException     if the query touches a catalog the caller may not access
     */
    public static void enforce(PermissionSource permissionSource, String callerId, String sql, String effectiveCatalog)
            throws PermissionLookupException, UnauthorizedException {
        var allowed = permissionSource.allowedCatalogs(callerId);
        enforce(callerId, allowed, sql, effectiveCatalog);
    }

    public static void enforce(PermissionContext context, String sql, String effectiveCatalog) throws UnauthorizedException {
        enforce(context.callerId(), context.allowed(), sql, effectiveCatalog);
    }

    private static void enforce(String callerId, AllowedCatalogs allowed, String sql, String effectiveCatalog)
            throws UnauthorizedException {
        if (allowed.isUnrestricted()) {
            return;
        }
        if (CatalogReferenceExtractor.isShowCatalogs(sql)) {
            logger.warn("Rejected SHOW CATALOGS from {}", callerId);
            throw new ShowCatalogsForbiddenException();
        }
        var denied = new ArrayList<String>();
        for (var catalog : CatalogSet.of(sql, effectiveCatalog).required()) {
            if (!allowed.allows(catalog)) {
                denied.add(catalog);
            }
        }
        if (!denied.isEmpty()) {
            logger.warn("Denied catalog access for {}: {}", callerId, denied);
            throw new CatalogAccessDeniedException();
        }
    }

    public static boolean canAccessCatalog(PermissionContext context, String catalog) {
        return context.allowed().allows(catalog);
    }

    /**
     * @return the available catalogs the caller may see, in their original order
     */
    public static List<String> filterCatalogs(List<String> available, AllowedCatalogs allowed) {
        if (allowed.isUnrestricted()) {
            return List.copyOf(available);
        }
        var filtered = new ArrayList<String>();
        for (var catalog : available) {
            if (allowed.allows(catalog)) {
                filtered.add(catalog);
            }
        }
        return List.copyOf(filtered);
    }
}
