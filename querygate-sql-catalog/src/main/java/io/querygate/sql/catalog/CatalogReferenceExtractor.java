package io.querygate.sql.catalog;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the catalogs a query names explicitly.
 * <p>
 * This is a textual scan, not a parse: references inside comments or string literals are reported too,
 * which only ever makes enforcement stricter.
 */
public final class CatalogReferenceExtractor {

    private static final String IDENTIFIER = "[a-zA-Z_][a-zA-Z0-9_]*";
    private static final String SEGMENT = "(" + IDENTIFIER + "|\"[^\"]+\")";

    static final Pattern SHOW_CATALOGS_PATTERN = Pattern.compile("(?i)\\bSHOW\\s+CATALOGS\\b");

    // catalog.schema.table, each part bare or double-quoted
    private static final Pattern THREE_PART_PATTERN =
            Pattern.compile("(?i)" + SEGMENT + "\\s*\\.\\s*" + SEGMENT + "\\s*\\.\\s*" + SEGMENT);

    private static final Pattern SHOW_SCHEMAS_PATTERN =
            Pattern.compile("(?i)\\bSHOW\\s+SCHEMAS\\s+(?:FROM|IN)\\s+(\"([^\"]+)\"|" + IDENTIFIER + ")");

    private static final Pattern SHOW_TABLES_PATTERN =
            Pattern.compile("(?i)\\bSHOW\\s+TABLES\\s+(?:FROM|IN)\\s+(\"([^\"]+)\"|" + IDENTIFIER + ")\\s*\\.");

    private static final Pattern USE_PATTERN =
            Pattern.compile("(?i)\\bUSE\\s+(\"([^\"]+)\"|" + IDENTIFIER + ")\\s*\\.");

    private CatalogReferenceExtractor() {
    }

    /**
     * @return referenced catalog names, unquoted and deduplicated: three-part references first,
     * then SHOW SCHEMAS, SHOW TABLES and USE targets
     */
    public static List<String> extract(String sql) {
        if (sql == null || sql.isEmpty()) {
            return List.of();
        }
        var catalogs = new LinkedHashSet<String>();
        var threePart = THREE_PART_PATTERN.matcher(sql);
        while (threePart.find()) {
            add(catalogs, unquote(threePart.group(1)));
        }
        collectStatementTargets(SHOW_SCHEMAS_PATTERN.matcher(sql), catalogs);
        collectStatementTargets(SHOW_TABLES_PATTERN.matcher(sql), catalogs);
        collectStatementTargets(USE_PATTERN.matcher(sql), catalogs);
        return List.copyOf(catalogs);
    }

    public static boolean isShowCatalogs(String sql) {
        return sql != null && SHOW_CATALOGS_PATTERN.matcher(sql).find();
    }

    static String unquote(String identifier) {
        if (identifier.length() >= 2 && identifier.startsWith("\"") && identifier.endsWith("\"")) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }

    private static void collectStatementTargets(Matcher matcher, LinkedHashSet<String> catalogs) {
        while (matcher.find()) {
            var quoted = matcher.group(2);
            add(catalogs, quoted != null ? quoted : unquote(matcher.group(1)));
        }
    }

    private static void add(LinkedHashSet<String> catalogs, String catalog) {
        if (catalog != null && !catalog.isEmpty()) {
            catalogs.add(catalog);
        }
    }
}
