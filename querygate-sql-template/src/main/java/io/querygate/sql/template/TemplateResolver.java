package io.querygate.sql.template;

import io.querygate.sql.template.format.ParameterFormatException;
import io.querygate.sql.template.format.ValueFormatter;
import io.querygate.sql.template.model.ParameterDefinition;
import io.querygate.sql.template.model.ParameterValue;
import io.querygate.sql.template.model.SqlFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Substitutes the placeholders of a SQL template with safely formatted values.
 * <p>
 * Resolution never fails: a placeholder whose value is absent or cannot be formatted is left untouched
 * and its logical name is reported in {@link ResolvedQuery#missing()}. A query with missing parameters
 * must not be executed.
 */
public final class TemplateResolver {

    private static final Logger logger = LoggerFactory.getLogger(TemplateResolver.class);

    static final String RANGE_JOIN = " AND ";

    private TemplateResolver() {
    }

    /**
     * @param text        the SQL template
     * @param values      caller values keyed by logical name or placeholder text
     * @param definitions declared parameter definitions
     * @param trusted     whether the caller may edit the template, which relaxes raw-format validation
     */
    public static ResolvedQuery resolve(String text,
                                        Map<String, ParameterValue> values,
                                        List<ParameterDefinition> definitions,
                                        boolean trusted) {
        if (text == null || text.isEmpty()) {
            return new ResolvedQuery(text == null ? "" : text, List.of());
        }
        var safeValues = values == null ? Map.<String, ParameterValue>of() : values;
        var placeholders = ParameterExtractor.extract(text);
        var substitutions = new HashMap<String, String>();
        var missing = new LinkedHashSet<String>();
        for (var placeholder : placeholders) {
            var match = ParameterDefinitionResolver.resolve(placeholder, definitions);
            var logicalName = match.logicalName(placeholder);
            var value = safeValues.get(logicalName);
            var keyedBySite = false;
            if (value == null) {
                value = safeValues.get(placeholder);
                keyedBySite = value != null && !placeholder.equals(logicalName);
            }
            var substitution = substitute(placeholder, match, value, keyedBySite, trusted);
            if (substitution == null) {
                missing.add(logicalName);
            } else {
                substitutions.put(placeholder, substitution);
            }
        }
        var sql = apply(text, substitutions);
        if (!missing.isEmpty()) {
            logger.debug("Template resolved with {} missing parameter(s): {}", missing.size(), missing);
        }
        return new ResolvedQuery(sql, List.copyOf(missing));
    }

    /**
     * Logical names of every parameter the template refers to, in order of first appearance.
     */
    public static List<String> requiredParameters(String text, List<ParameterDefinition> definitions) {
        var names = new LinkedHashSet<String>();
        for (var placeholder : ParameterExtractor.extract(text)) {
            names.add(ParameterDefinitionResolver.resolve(placeholder, definitions).logicalName(placeholder));
        }
        return List.copyOf(names);
    }

    /**
     * @param keyedBySite whether the value was sent under the placeholder name rather than the logical name
     * @return the SQL fragment for the placeholder, or null when the parameter is missing
     */
    private static String substitute(String placeholder, DefinitionMatch match, ParameterValue value,
                                     boolean keyedBySite, boolean trusted) {
        var definition = match.definition();
        if (value == null || value.isEmpty()) {
            return definition == null ? null : definition.effectiveEmptyBehavior().substitution();
        }
        if (definition != null && definition.isDateRange()) {
            return substituteRange(placeholder, definition, match.rangePart(), value, keyedBySite, trusted);
        }
        var format = definition == null || definition.sqlFormat() == null ? SqlFormat.RAW : definition.sqlFormat();
        return format(placeholder, value, format, trusted);
    }

    private static String substituteRange(String placeholder, ParameterDefinition definition, RangePart part,
                                          ParameterValue value, boolean keyedBySite, boolean trusted) {
        var bounds = keyedBySite && value instanceof ParameterValue.Text text
                ? RangeBounds.single(part, text.value())
                : RangeBounds.parse(value);
        var format = definition.sqlFormat() == null ? SqlFormat.DATE : definition.sqlFormat();
        switch (part) {
            case START -> {
                return formatBound(placeholder, bounds.start(), format, trusted);
            }
            case END -> {
                return formatBound(placeholder, bounds.end(), format, trusted);
            }
            default -> {
                var start = formatBound(placeholder, bounds.start(), format, trusted);
                var end = formatBound(placeholder, bounds.end(), format, trusted);
                if (start == null || end == null) {
                    return null;
                }
                return start + RANGE_JOIN + end;
            }
        }
    }

    private static String formatBound(String placeholder, String bound, SqlFormat format, boolean trusted) {
        if (bound.isBlank()) {
            return null;
        }
        return format(placeholder, ParameterValue.text(bound), format, trusted);
    }

    private static String format(String placeholder, ParameterValue value, SqlFormat format, boolean trusted) {
        try {
            return ValueFormatter.format(value, format, trusted);
        } catch (ParameterFormatException e) {
            logger.debug("Placeholder {} rejected as {}: {}", placeholder, format.wireName(), e.getMessage());
            return null;
        }
    }

    private static String apply(String text, Map<String, String> substitutions) {
        var matcher = ParameterExtractor.PLACEHOLDER_PATTERN.matcher(text);
        var buffer = new StringBuilder(text.length());
        while (matcher.find()) {
            var substitution = substitutions.get(matcher.group(1));
            var replacement = substitution == null ? matcher.group() : substitution;
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    /**
     * The two ends of a daterange value; an end that was not supplied is the empty string.
     */
    record RangeBounds(String start, String end) {

        /**
         * A plain value sent under a start or end placeholder name is that bound.
         */
        static RangeBounds single(RangePart part, String bound) {
            return part == RangePart.END ? new RangeBounds("", bound.trim()) : new RangeBounds(bound.trim(), "");
        }

        static RangeBounds parse(ParameterValue value) {
            if (value instanceof ParameterValue.Range range) {
                return new RangeBounds(range.start().trim(), range.end().trim());
            }
            if (value instanceof ParameterValue.ListValue list) {
                var elements = list.elements();
                var start = elements.size() > 0 ? elements.get(0).asText().trim() : "";
                var end = elements.size() > 1 ? elements.get(1).asText().trim() : "";
                return new RangeBounds(start, end);
            }
            if (value instanceof ParameterValue.Text text) {
                var raw = text.value();
                var comma = raw.indexOf(',');
                if (comma < 0) {
                    return new RangeBounds(raw.trim(), "");
                }
                return new RangeBounds(raw.substring(0, comma).trim(), raw.substring(comma + 1).trim());
            }
            return new RangeBounds("", "");
        }
    }
}
