package io.querygate.sql.template.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A declared dashboard parameter, as stored in the dashboard's {@code parameters} JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterDefinition(@JsonProperty("name") String name,
                                  @JsonProperty("type") ParameterType type,
                                  @JsonProperty("label") String label,
                                  @JsonProperty("required") boolean required,
                                  @JsonProperty("sql_format") SqlFormat sqlFormat,
                                  @JsonProperty("targets") DateRangeTargets targets,
                                  @JsonProperty("default_value") ParameterValue defaultValue,
                                  @JsonProperty("options") List<ParameterOption> options,
                                  @JsonProperty("options_query_id") String optionsQueryId,
                                  @JsonProperty("depends_on") List<String> dependsOn,
                                  @JsonProperty("empty_behavior") EmptyBehavior emptyBehavior) {

    public ParameterDefinition {
        options = options == null ? List.of() : List.copyOf(options);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static ParameterDefinition of(String name, ParameterType type, SqlFormat sqlFormat) {
        return new ParameterDefinition(name, type, null, false, sqlFormat, null, null, null, null, null, null);
    }

    public ParameterDefinition withEmptyBehavior(EmptyBehavior behavior) {
        return new ParameterDefinition(name, type, label, required, sqlFormat, targets, defaultValue,
                options, optionsQueryId, dependsOn, behavior);
    }

    public ParameterDefinition withTargets(String start, String end) {
        return new ParameterDefinition(name, type, label, required, sqlFormat, new DateRangeTargets(start, end),
                defaultValue, options, optionsQueryId, dependsOn, emptyBehavior);
    }

    public ParameterDefinition withDefaultValue(ParameterValue value) {
        return new ParameterDefinition(name, type, label, required, sqlFormat, targets, value,
                options, optionsQueryId, dependsOn, emptyBehavior);
    }

    public ParameterDefinition withDependsOn(List<String> names) {
        return new ParameterDefinition(name, type, label, required, sqlFormat, targets, defaultValue,
                options, optionsQueryId, names, emptyBehavior);
    }

    public ParameterDefinition withOptions(List<ParameterOption> staticOptions) {
        return new ParameterDefinition(name, type, label, required, sqlFormat, targets, defaultValue,
                staticOptions, optionsQueryId, dependsOn, emptyBehavior);
    }

    public boolean isDateRange() {
        return type == ParameterType.DATERANGE;
    }

    public EmptyBehavior effectiveEmptyBehavior() {
        return emptyBehavior == null ? EmptyBehavior.MISSING : emptyBehavior;
    }
}
