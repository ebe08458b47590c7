package io.querygate.sql.template.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ParameterType {
    TEXT("text"),
    NUMBER("number"),
    DATE("date"),
    DATERANGE("daterange"),
    SELECT("select"),
    MULTISELECT("multiselect");

    private final String wireName;

    ParameterType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Unknown types are rejected: a definition whose type cannot be understood is never resolved.
     */
    @JsonCreator
    public static ParameterType fromWireName(String value) {
        for (var type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown parameter type: " + value);
    }
}
