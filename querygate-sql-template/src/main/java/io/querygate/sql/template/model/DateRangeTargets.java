package io.querygate.sql.template.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Explicit placeholder names for the two ends of a daterange parameter.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DateRangeTargets(String start, String end) {
}
