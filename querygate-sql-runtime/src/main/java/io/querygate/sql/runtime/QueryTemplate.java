package io.querygate.sql.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.querygate.sql.template.model.ParameterDefinition;

import java.util.List;

/**
 * A saved query together with the parameters declared for it.
 *
 * @param queryId    identifier of the saved query, used as part of the executor's cache key; may be null
 * @param catalog    catalog the query runs in; blank means the configured default
 * @param schema     schema the query runs in; blank means the configured default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryTemplate(@JsonProperty("query_id") String queryId,
                            @JsonProperty("query") String query,
                            @JsonProperty("catalog") String catalog,
                            @JsonProperty("schema") String schema,
                            @JsonProperty("parameters") List<ParameterDefinition> parameters) {

    public QueryTemplate {
        query = query == null ? "" : query;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static QueryTemplate of(String query, String catalog, String schema, List<ParameterDefinition> parameters) {
        return new QueryTemplate(null, query, catalog, schema, parameters);
    }
}
