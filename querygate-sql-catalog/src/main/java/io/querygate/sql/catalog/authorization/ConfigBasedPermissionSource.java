package io.querygate.sql.catalog.authorization;

import com.typesafe.config.Config;
import io.querygate.sql.common.auth.PermissionLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static io.querygate.sql.common.ConfigConstants.*;

/**
 * Roles and user assignments declared in configuration:
 * <pre>
 * permission_source {
 *   class = "io.querygate.sql.catalog.authorization.ConfigBasedPermissionSource"
 *   roles = [ { name = analyst, catalogs = [hive, memory] }, { name = admin, admin = true } ]
 *   users = [ { username = alice, roles = [analyst] } ]
 * }
 * </pre>
 * A user holding an admin role is unrestricted. Any other user gets the union of their roles' catalogs.
 */
public class ConfigBasedPermissionSource implements PermissionSource {

    private static final Logger logger = LoggerFactory.getLogger(ConfigBasedPermissionSource.class);

    private record Role(String name, List<String> catalogs, boolean admin) { }

    private volatile Map<String, AllowedCatalogs> userCatalogs = Map.of();

    public ConfigBasedPermissionSource() {
    }

    public ConfigBasedPermissionSource(Config config) {
        setConfig(config);
    }

    @Override
    public void setConfig(Config config) {
        var roles = loadRoles(config);
        var userRoleMapping = loadUserRoleMapping(config);
        var result = new HashMap<String, AllowedCatalogs>();
        userRoleMapping.forEach((user, roleNames) -> result.put(user, resolve(user, roleNames, roles)));
        userCatalogs = Map.copyOf(result);
        logger.info("Loaded catalog permissions for {} user(s) and {} role(s)", result.size(), roles.size());
    }

    @Override
    public AllowedCatalogs allowedCatalogs(String callerId) throws PermissionLookupException {
        var allowed = callerId == null ? null : userCatalogs.get(callerId);
        if (allowed == null) {
            throw new PermissionLookupException("No role assignment for caller " + callerId);
        }
        return allowed;
    }

    private static AllowedCatalogs resolve(String user, List<String> roleNames, Map<String, Role> roles) {
        var catalogs = new LinkedHashSet<String>();
        for (var roleName : roleNames) {
            var role = roles.get(roleName);
            if (role == null) {
                logger.warn("User {} references unknown role {}", user, roleName);
                continue;
            }
            if (role.admin()) {
                return AllowedCatalogs.unrestricted();
            }
            catalogs.addAll(role.catalogs());
        }
        return AllowedCatalogs.of(catalogs);
    }

    private static Map<String, Role> loadRoles(Config config) {
        var res = new HashMap<String, Role>();
        if (!config.hasPath(ROLES_KEY)) {
            return res;
        }
        for (var roleConfigObject : config.getObjectList(ROLES_KEY)) {
            var roleConfig = roleConfigObject.toConfig();
            var name = roleConfig.getString(NAME_KEY);
            var catalogs = roleConfig.hasPath(CATALOGS_KEY) ? roleConfig.getStringList(CATALOGS_KEY) : List.<String>of();
            var admin = roleConfig.hasPath(ADMIN_KEY) && roleConfig.getBoolean(ADMIN_KEY);
            res.put(name, new Role(name, catalogs, admin));
        }
        return res;
    }

    private static Map<String, List<String>> loadUserRoleMapping(Config config) {
        var res = new HashMap<String, List<String>>();
        if (!config.hasPath(USERS_KEY)) {
            return res;
        }
        for (var userConfigObject : config.getObjectList(USERS_KEY)) {
            var userConfig = userConfigObject.toConfig();
            var user = userConfig.getString(USERNAME_KEY);
            var roles = userConfig.hasPath(ROLES_KEY) ? userConfig.getStringList(ROLES_KEY) : List.<String>of();
            res.put(user, roles);
        }
        return res;
    }
}
