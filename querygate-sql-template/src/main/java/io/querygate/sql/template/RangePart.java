package io.querygate.sql.template;

/**
 * Which end of a daterange a placeholder stands for.
 */
public enum RangePart {
    NONE,
    START,
    END
}
