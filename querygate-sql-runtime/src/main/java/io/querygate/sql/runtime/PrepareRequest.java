package io.querygate.sql.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.querygate.sql.template.model.ParameterDefinition;

import java.util.List;

/**
 * Command line input: a query template, its parameter definitions and the caller's values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrepareRequest(@JsonProperty("query") String query,
                             @JsonProperty("catalog") String catalog,
                             @JsonProperty("schema") String schema,
                             @JsonProperty("parameters") List<ParameterDefinition> parameters,
                             @JsonProperty("values") JsonNode values,
                             @JsonProperty("user") String user,
                             @JsonProperty("can_edit") boolean canEdit) {

    public QueryTemplate toTemplate() {
        return QueryTemplate.of(query, catalog, schema, parameters);
    }
}
