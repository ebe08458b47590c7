package io.querygate.sql.template;

import io.querygate.sql.template.model.ParameterDefinition;

import java.util.List;

/**
 * Maps a placeholder name to the definition it belongs to.
 * <p>
 * Resolution order: exact name, then explicit {@code targets.start}/{@code targets.end} of a daterange
 * definition, then the {@code <name>_start}/{@code <name>_end} convention of a daterange definition.
 */
public final class ParameterDefinitionResolver {

    static final String START_SUFFIX = "_start";
    static final String END_SUFFIX = "_end";

    private ParameterDefinitionResolver() {
    }

    public static DefinitionMatch resolve(String placeholder, List<ParameterDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            return DefinitionMatch.unmatched();
        }
        for (var definition : definitions) {
            if (!isNamed(definition)) {
                continue;
            }
            if (placeholder.equals(definition.name())) {
                return new DefinitionMatch(definition, RangePart.NONE);
            }
        }
        for (var definition : definitions) {
            if (!isNamed(definition) || !definition.isDateRange() || definition.targets() == null) {
                continue;
            }
            if (placeholder.equals(definition.targets().start())) {
                return new DefinitionMatch(definition, RangePart.START);
            }
            if (placeholder.equals(definition.targets().end())) {
                return new DefinitionMatch(definition, RangePart.END);
            }
        }
        for (var definition : definitions) {
            if (!isNamed(definition) || !definition.isDateRange()) {
                continue;
            }
            if (placeholder.equals(definition.name() + START_SUFFIX)) {
                return new DefinitionMatch(definition, RangePart.START);
            }
            if (placeholder.equals(definition.name() + END_SUFFIX)) {
                return new DefinitionMatch(definition, RangePart.END);
            }
        }
        return DefinitionMatch.unmatched();
    }

    /**
     * Definitions without a name cannot be reported or looked up and are ignored.
     */
    private static boolean isNamed(ParameterDefinition definition) {
        return definition != null && definition.name() != null && !definition.name().isBlank();
    }
}
