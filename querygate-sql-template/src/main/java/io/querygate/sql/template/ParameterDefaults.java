package io.querygate.sql.template;

import io.querygate.sql.template.model.ParameterDefinition;
import io.querygate.sql.template.model.ParameterValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ParameterDefaults {

    private ParameterDefaults() {
    }

    /**
     * Fills in each definition's {@code default_value} where the caller sent nothing usable.
     * Caller-supplied, non-empty values always win.
     */
    public static Map<String, ParameterValue> applyDefaults(Map<String, ParameterValue> values,
                                                            List<ParameterDefinition> definitions) {
        var result = new LinkedHashMap<String, ParameterValue>();
        if (values != null) {
            result.putAll(values);
        }
        if (definitions == null) {
            return Collections.unmodifiableMap(result);
        }
        for (var definition : definitions) {
            var defaultValue = definition.defaultValue();
            if (isBlank(definition.name()) || defaultValue == null || defaultValue.isEmpty()) {
                continue;
            }
            if (!hasValue(result, definition.name()) && !hasRangeSiteValue(result, definition)) {
                result.put(definition.name(), defaultValue);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * A daterange value may also be keyed by one of its placeholder names, such as
     * {@code <name>_start} or {@code targets.end}.
     */
    private static boolean hasRangeSiteValue(Map<String, ParameterValue> values, ParameterDefinition definition) {
        if (!definition.isDateRange()) {
            return false;
        }
        var targets = definition.targets();
        if (targets != null && (hasValue(values, targets.start()) || hasValue(values, targets.end()))) {
            return true;
        }
        return hasValue(values, definition.name() + ParameterDefinitionResolver.START_SUFFIX)
                || hasValue(values, definition.name() + ParameterDefinitionResolver.END_SUFFIX);
    }

    private static boolean isBlank(String name) {
        return name == null || name.isBlank();
    }

    private static boolean hasValue(Map<String, ParameterValue> values, String key) {
        if (key == null) {
            return false;
        }
        var value = values.get(key);
        return value != null && !value.isEmpty();
    }
}
