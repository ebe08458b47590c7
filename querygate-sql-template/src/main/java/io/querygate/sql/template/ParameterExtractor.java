package io.querygate.sql.template;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds {@code {{name}}} placeholders in a SQL template.
 * <p>
 * Names follow identifier syntax ({@code [a-zA-Z_][a-zA-Z0-9_]*}); whitespace inside the braces is
 * ignored. Anything else between double braces is not a placeholder and stays literal text.
 */
public final class ParameterExtractor {

    /**
     * Group 1: placeholder name.
     */
    static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\}\\}");

    private ParameterExtractor() {
    }

    /**
     * @return placeholder names in order of first occurrence, without duplicates
     */
    public static List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var names = new LinkedHashSet<String>();
        var matcher = PLACEHOLDER_PATTERN.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return List.copyOf(names);
    }
}
