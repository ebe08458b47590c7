package io.querygate.sql.template;

import io.querygate.sql.template.model.ParameterDefinition;

/**
 * @param definition the matched definition, or null for a legacy untyped placeholder
 * @param rangePart  the daterange end the placeholder stands for, {@link RangePart#NONE} otherwise
 */
public record DefinitionMatch(ParameterDefinition definition, RangePart rangePart) {

    private static final DefinitionMatch UNMATCHED = new DefinitionMatch(null, RangePart.NONE);

    public static DefinitionMatch unmatched() {
        return UNMATCHED;
    }

    public boolean matched() {
        return definition != null;
    }

    /**
     * The name a missing parameter is reported under: the definition's name when matched,
     * otherwise the placeholder text itself.
     */
    public String logicalName(String placeholder) {
        return definition == null ? placeholder : definition.name();
    }
}
