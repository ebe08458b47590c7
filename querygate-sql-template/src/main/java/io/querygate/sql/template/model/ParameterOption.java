package io.querygate.sql.template.model;

public record ParameterOption(String value, String label) {
}
