package io.querygate.sql.catalog.authorization;

import java.util.Collection;
import java.util.Set;

/**
 * The catalogs a caller may touch. {@link #unrestricted()} stands for administrators, who are not
 * limited to a list; an empty restricted set allows nothing.
 */
public final class AllowedCatalogs {

    private static final AllowedCatalogs UNRESTRICTED = new AllowedCatalogs(null);

    private final Set<String> catalogs;

    private AllowedCatalogs(Set<String> catalogs) {
        this.catalogs = catalogs;
    }

    public static AllowedCatalogs unrestricted() {
        return UNRESTRICTED;
    }

    public static AllowedCatalogs of(Collection<String> catalogs) {
        return new AllowedCatalogs(catalogs == null ? Set.of() : Set.copyOf(catalogs));
    }

    public boolean isUnrestricted() {
        return catalogs == null;
    }

    public boolean allows(String catalog) {
        return catalogs == null || catalogs.contains(catalog);
    }

    /**
     * @return the allowed names; empty for an unrestricted caller, check {@link #isUnrestricted()} first
     */
    public Set<String> catalogs() {
        return catalogs == null ? Set.of() : catalogs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllowedCatalogs other)) {
            return false;
        }
        return catalogs == null ? other.catalogs == null : catalogs.equals(other.catalogs);
    }

    @Override
    public int hashCode() {
        return catalogs == null ? 0 : catalogs.hashCode() + 1;
    }

    @Override
    public String toString() {
        return isUnrestricted() ? "AllowedCatalogs[unrestricted]" : "AllowedCatalogs" + catalogs;
    }
}
