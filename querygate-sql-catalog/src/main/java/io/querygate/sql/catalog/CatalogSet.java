package io.querygate.sql.catalog;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * The catalogs a query needs: those it references by name plus the catalog it runs in.
 *
 * @param referenced       catalogs named in the query text, in order of discovery
 * @param effectiveCatalog the session catalog the query executes in, possibly blank
 */
public record CatalogSet(List<String> referenced, String effectiveCatalog) {

    public CatalogSet {
        referenced = referenced == null ? List.of() : List.copyOf(referenced);
        effectiveCatalog = effectiveCatalog == null ? "" : effectiveCatalog;
    }

    public static CatalogSet of(String sql, String effectiveCatalog) {
        return new CatalogSet(CatalogReferenceExtractor.extract(sql), effectiveCatalog);
    }

    public List<String> required() {
        var required = new LinkedHashSet<>(referenced);
        if (!effectiveCatalog.isBlank()) {
            required.add(effectiveCatalog);
        }
        return List.copyOf(required);
    }
}
