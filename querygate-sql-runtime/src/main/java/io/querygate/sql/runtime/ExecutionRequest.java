package io.querygate.sql.runtime;

/**
 * A fully resolved and authorized query, ready for the executor.
 */
public record ExecutionRequest(String sql, String catalog, String schema, CachePriority priority, String queryId) {
}
