package io.querygate.sql.runtime;

/**
 * The engine that runs prepared queries, typically with a result cache in front of it.
 */
public interface QueryExecutor {
    QueryResult execute(ExecutionRequest request) throws QueryExecutionException;
}
