package io.querygate.sql.template.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A caller-supplied parameter value, decoded once from JSON into one of a closed set of shapes.
 * JSON {@code null} has no representation here; it decodes to "no value".
 */
@JsonDeserialize(using = ParameterValueDeserializer.class)
public sealed interface ParameterValue
        permits ParameterValue.Text, ParameterValue.Numeric, ParameterValue.Bool,
        ParameterValue.ListValue, ParameterValue.Range {

    /**
     * True when the value carries nothing a user entered: a blank string, an empty list
     * or a range with neither end set.
     */
    boolean isEmpty();

    /**
     * Scalar rendering used by the formatter. Lists join their elements with {@code ,}.
     */
    String asText();

    static Text text(String value) {
        return new Text(value);
    }

    static Numeric number(BigDecimal value) {
        return new Numeric(value);
    }

    static Numeric number(double value) {
        return new Numeric(BigDecimal.valueOf(value));
    }

    static Numeric number(long value) {
        return new Numeric(BigDecimal.valueOf(value));
    }

    static Bool bool(boolean value) {
        return new Bool(value);
    }

    static ListValue list(List<ParameterValue> elements) {
        return new ListValue(elements);
    }

    static Range range(String start, String end) {
        return new Range(start, end);
    }

    record Text(String value) implements ParameterValue {
        public Text {
            value = value == null ? "" : value;
        }

        @Override
        public boolean isEmpty() {
            return value.isBlank();
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record Numeric(BigDecimal value) implements ParameterValue {
        public Numeric {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        /**
         * Integral values render without a decimal point and fractions keep every digit;
         * exponent notation is never produced.
         */
        @Override
        public String asText() {
            var stripped = value.stripTrailingZeros();
            if (stripped.scale() < 0) {
                stripped = stripped.setScale(0);
            }
            return stripped.toPlainString();
        }
    }

    record Bool(boolean value) implements ParameterValue {
        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record ListValue(List<ParameterValue> elements) implements ParameterValue {
        public ListValue {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }

        @Override
        public boolean isEmpty() {
            return elements.isEmpty();
        }

        @Override
        public String asText() {
            return elements.stream().map(ParameterValue::asText).collect(Collectors.joining(","));
        }
    }

    /**
     * A {@code {"start": ..., "end": ...}} object as sent for daterange parameters.
     */
    record Range(String start, String end) implements ParameterValue {
        public Range {
            start = start == null ? "" : start;
            end = end == null ? "" : end;
        }

        @Override
        public boolean isEmpty() {
            return start.isBlank() && end.isBlank();
        }

        @Override
        public String asText() {
            return start + "," + end;
        }
    }
}
