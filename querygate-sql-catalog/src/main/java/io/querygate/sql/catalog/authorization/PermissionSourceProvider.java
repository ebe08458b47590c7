package io.querygate.sql.catalog.authorization;

import com.typesafe.config.Config;
import io.querygate.sql.common.ConfigBasedProvider;

import static io.querygate.sql.common.ConfigConstants.PERMISSION_SOURCE_PREFIX;

public interface PermissionSourceProvider extends ConfigBasedProvider {
    static PermissionSource load(Config config) throws Exception {
        return ConfigBasedProvider.<PermissionSource>load(config, PERMISSION_SOURCE_PREFIX, new UnrestrictedPermissionSource());
    }
}
