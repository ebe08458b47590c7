package io.querygate.sql.runtime;

/**
 * How long the executor may keep a result cached.
 */
public enum CachePriority {
    /** Ad hoc queries, short lived. */
    LOW,
    /** Dashboard widgets and parameter options. */
    NORMAL,
    /** Scheduled queries such as alerts. */
    HIGH
}
