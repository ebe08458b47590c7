package io.querygate.sql.template.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a placeholder turns into when its parameter has no value.
 */
public enum EmptyBehavior {
    /** Report the parameter as missing. */
    MISSING("missing", null),
    /** Substitute {@code NULL}. */
    NULL("null", "NULL"),
    /** Substitute a predicate that matches no rows. */
    MATCH_NONE("match_none", "1=0");

    private final String wireName;
    private final String substitution;

    EmptyBehavior(String wireName, String substitution) {
        this.wireName = wireName;
        this.substitution = substitution;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return the SQL fragment to substitute, or null when the parameter must be reported missing
     */
    public String substitution() {
        return substitution;
    }

    @JsonCreator
    public static EmptyBehavior fromWireName(String value) {
        for (var behavior : values()) {
            if (behavior.wireName.equals(value)) {
                return behavior;
            }
        }
        return MISSING;
    }
}
