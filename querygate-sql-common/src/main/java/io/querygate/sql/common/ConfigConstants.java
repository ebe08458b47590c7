package io.querygate.sql.common;

import com.typesafe.config.Config;

public class ConfigConstants {

    public static final String CONFIG_PATH = "querygate";

    // Query defaults
    public static final String DEFAULT_CATALOG_KEY = "default_catalog";
    public static final String DEFAULT_SCHEMA_KEY = "default_schema";

    // Permission source configuration keys
    public static final String PERMISSION_SOURCE_PREFIX = "permission_source";
    public static final String ROLES_KEY = "roles";
    public static final String USERS_KEY = "users";
    public static final String NAME_KEY = "name";
    public static final String USERNAME_KEY = "username";
    public static final String CATALOGS_KEY = "catalogs";
    public static final String ADMIN_KEY = "admin";

    // Parameter options
    public static final String MAX_OPTIONS_KEY = "options.max_options";

    public static String getDefaultCatalog(Config config) {
        return config.hasPath(DEFAULT_CATALOG_KEY) ? config.getString(DEFAULT_CATALOG_KEY) : "";
    }

    public static String getDefaultSchema(Config config) {
        return config.hasPath(DEFAULT_SCHEMA_KEY) ? config.getString(DEFAULT_SCHEMA_KEY) : "";
    }

    public static int getMaxOptions(Config config) {
        return config.getInt(MAX_OPTIONS_KEY);
    }
}
