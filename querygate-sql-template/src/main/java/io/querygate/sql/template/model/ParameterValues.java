package io.querygate.sql.template.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions from loosely typed input (JSON trees or plain Java objects) into {@link ParameterValue}.
 */
public final class ParameterValues {

    private ParameterValues() {
    }

    /**
     * Decodes a JSON object of {@code name -> value}. Entries whose value is JSON null are dropped.
     */
    public static Map<String, ParameterValue> fromJsonObject(JsonNode object) {
        if (object == null || object.isNull() || object.isMissingNode()) {
            return Map.of();
        }
        if (!object.isObject()) {
            throw new IllegalArgumentException("Parameter values must be a JSON object, got " + object.getNodeType());
        }
        var result = new LinkedHashMap<String, ParameterValue>();
        var fields = object.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var value = fromJson(entry.getValue());
            if (value != null) {
                result.put(entry.getKey(), value);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * @return the decoded value, or null for JSON null / missing nodes
     */
    public static ParameterValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return ParameterValue.text(node.textValue());
        }
        if (node.isNumber()) {
            return ParameterValue.number(node.decimalValue());
        }
        if (node.isBoolean()) {
            return ParameterValue.bool(node.booleanValue());
        }
        if (node.isArray()) {
            var elements = new ArrayList<ParameterValue>(node.size());
            for (var element : node) {
                var value = fromJson(element);
                elements.add(value == null ? ParameterValue.text("") : value);
            }
            return ParameterValue.list(elements);
        }
        if (node.isObject()) {
            return ParameterValue.range(scalarText(node.get("start")), scalarText(node.get("end")));
        }
        throw new IllegalArgumentException("Unsupported parameter value type " + node.getNodeType());
    }

    /**
     * Converts plain Java values (String, Number, Boolean, Collection, Map with start/end)
     * into parameter values. Null maps to null.
     */
    public static ParameterValue of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof ParameterValue parameterValue) {
            return parameterValue;
        }
        if (value instanceof String s) {
            return ParameterValue.text(s);
        }
        if (value instanceof BigDecimal decimal) {
            return ParameterValue.number(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            return ParameterValue.number(((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return ParameterValue.number(new BigDecimal(number.toString()));
        }
        if (value instanceof Boolean b) {
            return ParameterValue.bool(b);
        }
        if (value instanceof Collection<?> collection) {
            var elements = new ArrayList<ParameterValue>(collection.size());
            for (var element : collection) {
                var converted = of(element);
                elements.add(converted == null ? ParameterValue.text("") : converted);
            }
            return ParameterValue.list(elements);
        }
        if (value instanceof Map<?, ?> map) {
            return ParameterValue.range(toText(map.get("start")), toText(map.get("end")));
        }
        throw new IllegalArgumentException("Unsupported parameter value type " + value.getClass().getName());
    }

    public static Map<String, ParameterValue> ofMap(Map<String, ?> values) {
        var result = new LinkedHashMap<String, ParameterValue>();
        values.forEach((name, value) -> {
            var converted = of(value);
            if (converted != null) {
                result.put(name, converted);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private static String scalarText(JsonNode node) {
        var value = fromJson(node);
        return value == null ? null : value.asText();
    }

    private static String toText(Object value) {
        var converted = of(value);
        return converted == null ? null : converted.asText();
    }
}
