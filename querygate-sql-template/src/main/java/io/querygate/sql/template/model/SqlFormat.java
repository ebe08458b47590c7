package io.querygate.sql.template.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SqlFormat {
    RAW("raw"),
    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    IDENTIFIER("identifier"),
    STRING_LIST("string_list"),
    NUMBER_LIST("number_list");

    private final String wireName;

    SqlFormat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Unknown formats fall back to {@link #RAW}, which only accepts conservative tokens
     * unless the caller is trusted.
     */
    @JsonCreator
    public static SqlFormat fromWireName(String value) {
        for (var format : values()) {
            if (format.wireName.equals(value)) {
                return format;
            }
        }
        return RAW;
    }
}
