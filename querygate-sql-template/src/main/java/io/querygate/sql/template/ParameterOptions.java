package io.querygate.sql.template;

import io.querygate.sql.template.model.ParameterDefinition;
import io.querygate.sql.template.model.ParameterOption;
import io.querygate.sql.template.model.ParameterValue;
import io.querygate.sql.template.model.ParameterValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Option lists for select and multiselect parameters.
 */
public final class ParameterOptions {

    public static final int DEFAULT_MAX_OPTIONS = 200;

    private ParameterOptions() {
    }

    /**
     * A parameter with {@code depends_on} can only list options once every parent has a value.
     */
    public static boolean dependenciesSatisfied(ParameterDefinition definition, Map<String, ParameterValue> values) {
        for (var parent : definition.dependsOn()) {
            var value = values == null ? null : values.get(parent);
            if (value == null || value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public static List<ParameterOption> staticOptions(ParameterDefinition definition) {
        return definition.options();
    }

    public static List<ParameterOption> fromRows(List<List<Object>> rows) {
        return fromRows(rows, DEFAULT_MAX_OPTIONS);
    }

    /**
     * Converts an options query result into options: the first column is the value and the optional
     * second column the label. Rows without a value are skipped; at most {@code maxOptions} rows are read.
     */
    public static List<ParameterOption> fromRows(List<List<Object>> rows, int maxOptions) {
        var options = new ArrayList<ParameterOption>(Math.min(rows.size(), maxOptions));
        for (int i = 0; i < rows.size() && i < maxOptions; i++) {
            var row = rows.get(i);
            if (row == null || row.isEmpty() || row.get(0) == null) {
                continue;
            }
            var value = cellText(row.get(0));
            var label = row.size() > 1 && row.get(1) != null ? cellText(row.get(1)) : value;
            options.add(new ParameterOption(value, label));
        }
        return List.copyOf(options);
    }

    private static String cellText(Object cell) {
        if ((cell instanceof Double || cell instanceof Float) && !Double.isFinite(((Number) cell).doubleValue())) {
            return String.valueOf(cell);
        }
        if (cell instanceof Number || cell instanceof Boolean) {
            return ParameterValues.of(cell).asText();
        }
        return String.valueOf(cell);
    }
}
