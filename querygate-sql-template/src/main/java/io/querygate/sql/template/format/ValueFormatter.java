package io.querygate.sql.template.format;

import io.querygate.sql.template.model.ParameterValue;
import io.querygate.sql.template.model.SqlFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders a single parameter value as a SQL literal or fragment.
 * <p>
 * Every output is either a quoted literal with embedded single quotes doubled, or text that has been
 * matched against a strict pattern. The one exception is {@link SqlFormat#RAW} for trusted callers,
 * which is still quote-escaped but otherwise passed through.
 */
public final class ValueFormatter {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    /**
     * Tokens an untrusted caller may put into a raw placeholder: letters, digits and {@code _.,:@/-}.
     */
    private static final Pattern SAFE_RAW_PATTERN = Pattern.compile("^[a-zA-Z0-9_.,:@/\\-]+$");

    @FunctionalInterface
    private interface Rule {
        String apply(ParameterValue value, boolean trustedRaw) throws ParameterFormatException;
    }

    private static final Map<SqlFormat, Rule> RULES;

    static {
        var rules = new EnumMap<SqlFormat, Rule>(SqlFormat.class);
        rules.put(SqlFormat.STRING, (value, trusted) -> quote(value.asText()));
        rules.put(SqlFormat.NUMBER, (value, trusted) -> number(value.asText()));
        rules.put(SqlFormat.DATE, (value, trusted) -> date(value.asText()));
        rules.put(SqlFormat.IDENTIFIER, (value, trusted) -> identifier(value.asText()));
        rules.put(SqlFormat.STRING_LIST, (value, trusted) -> stringList(value));
        rules.put(SqlFormat.NUMBER_LIST, (value, trusted) -> numberList(value));
        rules.put(SqlFormat.RAW, ValueFormatter::raw);
        RULES = Collections.unmodifiableMap(rules);
    }

    private ValueFormatter() {
    }

    /**
     * @param value      the value to render, must not be empty
     * @param format     target format; null is treated as {@link SqlFormat#RAW}
     * @param trustedRaw whether raw values skip token validation (edit capability)
     * @throws ParameterFormatException if the value does not satisfy the format
     */
    public static String format(ParameterValue value, SqlFormat format, boolean trustedRaw) throws ParameterFormatException {
        var effective = format == null ? SqlFormat.RAW : format;
        if (value == null || value.isEmpty()) {
            throw new ParameterFormatException(effective, "No value to format as " + effective.wireName());
        }
        return RULES.get(effective).apply(value, trustedRaw);
    }

    public static String escapeSingleQuotes(String value) {
        return value.replace("'", "''");
    }

    public static String quote(String value) {
        return "'" + escapeSingleQuotes(value) + "'";
    }

    private static String number(String text) throws ParameterFormatException {
        var trimmed = text.trim();
        if (!NUMBER_PATTERN.matcher(trimmed).matches()) {
            throw new ParameterFormatException(SqlFormat.NUMBER, "Value is not a number");
        }
        return trimmed;
    }

    private static String date(String text) throws ParameterFormatException {
        var trimmed = text.trim();
        if (!DATE_PATTERN.matcher(trimmed).matches()) {
            throw new ParameterFormatException(SqlFormat.DATE, "Value is not a YYYY-MM-DD date");
        }
        return "DATE '" + trimmed + "'";
    }

    private static String identifier(String text) throws ParameterFormatException {
        var trimmed = text.trim();
        if (!IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new ParameterFormatException(SqlFormat.IDENTIFIER, "Value is not a valid identifier");
        }
        return "\"" + trimmed + "\"";
    }

    private static String stringList(ParameterValue value) throws ParameterFormatException {
        var elements = listElements(value, SqlFormat.STRING_LIST);
        var rendered = new ArrayList<String>(elements.size());
        for (var element : elements) {
            rendered.add(quote(element));
        }
        return String.join(",", rendered);
    }

    private static String numberList(ParameterValue value) throws ParameterFormatException {
        var elements = listElements(value, SqlFormat.NUMBER_LIST);
        var rendered = new ArrayList<String>(elements.size());
        for (var element : elements) {
            if (!NUMBER_PATTERN.matcher(element).matches()) {
                throw new ParameterFormatException(SqlFormat.NUMBER_LIST, "List element is not a number");
            }
            rendered.add(element);
        }
        return String.join(",", rendered);
    }

    private static String raw(ParameterValue value, boolean trustedRaw) throws ParameterFormatException {
        var text = value.asText();
        if (!trustedRaw && !SAFE_RAW_PATTERN.matcher(text).matches()) {
            throw new ParameterFormatException(SqlFormat.RAW, "Raw value contains characters that require edit permission");
        }
        return escapeSingleQuotes(text);
    }

    /**
     * Native lists keep their elements; anything else is split on commas. Elements are trimmed and
     * must not be empty.
     */
    private static List<String> listElements(ParameterValue value, SqlFormat format) throws ParameterFormatException {
        List<String> raw;
        if (value instanceof ParameterValue.ListValue list) {
            raw = new ArrayList<>(list.elements().size());
            for (var element : list.elements()) {
                raw.add(element.asText());
            }
        } else {
            raw = List.of(value.asText().split(",", -1));
        }
        var result = new ArrayList<String>(raw.size());
        for (var element : raw) {
            var trimmed = element.trim();
            if (trimmed.isEmpty()) {
                throw new ParameterFormatException(format, "List contains an empty element");
            }
            result.add(trimmed);
        }
        return result;
    }
}
