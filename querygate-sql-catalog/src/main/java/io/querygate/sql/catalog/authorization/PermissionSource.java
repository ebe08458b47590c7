package io.querygate.sql.catalog.authorization;

import com.typesafe.config.Config;
import io.querygate.sql.common.ConfigBasedProvider;
import io.querygate.sql.common.auth.PermissionLookupException;

/**
 * Role lookup: which catalogs a caller may query.
 * <p>
 * Implementations may block (database or service calls). A failed lookup must throw rather than
 * return a permissive answer.
 */
public interface PermissionSource extends ConfigBasedProvider {

    AllowedCatalogs allowedCatalogs(String callerId) throws PermissionLookupException;

    @Override
    default void setConfig(Config config) {
    }
}
