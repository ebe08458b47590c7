package io.querygate.sql.template;

import java.util.List;

/**
 * @param sql     the template with every resolvable placeholder substituted; placeholders of missing
 *                parameters are left in place
 * @param missing logical names of parameters without a usable value, in first-encountered order
 */
public record ResolvedQuery(String sql, List<String> missing) {

    public ResolvedQuery {
        missing = List.copyOf(missing);
    }

    /**
     * Only a complete query may be executed.
     */
    public boolean isComplete() {
        return missing.isEmpty();
    }
}
