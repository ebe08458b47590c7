package io.querygate.sql.catalog.authorization;

import com.typesafe.config.ConfigFactory;
import io.querygate.sql.common.auth.PermissionLookupException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigBasedPermissionSourceTest {

    private static final String PERMISSIONS = """
            permission_source {
              class = "io.querygate.sql.catalog.authorization.ConfigBasedPermissionSource"
              roles = [
                { name = analyst, catalogs = [hive, memory] }
                { name = sales, catalogs = [crm] }
                { name = admin, admin = true }
              ]
              users = [
                { username = alice, roles = [analyst, sales] }
                { username = carol, roles = [analyst, admin] }
                { username = dave, roles = [ghost] }
                { username = erin }
              ]
            }
            """;

    @Test
    public void testLoadFromProvider() throws Exception {
        var source = PermissionSourceProvider.load(ConfigFactory.parseString(PERMISSIONS));
        assertInstanceOf(ConfigBasedPermissionSource.class, source);
        assertEquals(AllowedCatalogs.of(Set.of("hive", "memory", "crm")), source.allowedCatalogs("alice"));
    }

    @Test
    public void testAdminRoleIsUnrestricted() throws Exception {
        var source = new ConfigBasedPermissionSource(ConfigFactory.parseString(PERMISSIONS).getConfig("permission_source"));
        assertTrue(source.allowedCatalogs("carol").isUnrestricted());
    }

    @Test
    public void testUnknownRoleGrantsNothing() throws Exception {
        var source = new ConfigBasedPermissionSource(ConfigFactory.parseString(PERMISSIONS).getConfig("permission_source"));
        var dave = source.allowedCatalogs("dave");
        assertFalse(dave.isUnrestricted());
        assertTrue(dave.catalogs().isEmpty());
        assertTrue(source.allowedCatalogs("erin").catalogs().isEmpty());
    }

    @Test
    public void testUnknownUserFailsClosed() {
        var source = new ConfigBasedPermissionSource(ConfigFactory.parseString(PERMISSIONS).getConfig("permission_source"));
        assertThrows(PermissionLookupException.class, () -> source.allowedCatalogs("mallory"));
        assertThrows(PermissionLookupException.class, () -> source.allowedCatalogs(null));
    }

    @Test
    public void testMissingBlockDefaultsToUnrestricted() throws Exception {
        var source = PermissionSourceProvider.load(ConfigFactory.parseString("other = 1"));
        assertInstanceOf(UnrestrictedPermissionSource.class, source);
        assertTrue(source.allowedCatalogs("anyone").isUnrestricted());
    }

    @Test
    public void testBlockWithoutClassKeepsUnrestrictedDefault() throws Exception {
        var source = PermissionSourceProvider.load(ConfigFactory.parseString("permission_source { note = x }"));
        assertInstanceOf(UnrestrictedPermissionSource.class, source);
    }
}
