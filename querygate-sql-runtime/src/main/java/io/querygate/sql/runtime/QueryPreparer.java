package io.querygate.sql.runtime;

import com.typesafe.config.Config;
import io.querygate.sql.catalog.CatalogAccessEnforcer;
import io.querygate.sql.catalog.authorization.PermissionSource;
import io.querygate.sql.catalog.authorization.PermissionSourceProvider;
import io.querygate.sql.common.ConfigConstants;
import io.querygate.sql.common.auth.PermissionLookupException;
import io.querygate.sql.common.auth.UnauthorizedException;
import io.querygate.sql.template.ParameterDefaults;
import io.querygate.sql.template.ParameterOptions;
import io.querygate.sql.template.TemplateResolver;
import io.querygate.sql.template.model.ParameterDefinition;
import io.querygate.sql.template.model.ParameterOption;
import io.querygate.sql.template.model.ParameterValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a saved query and caller-supplied values into something the executor may run:
 * placeholders are resolved, then the resolved SQL is checked against the caller's catalog permissions.
 * A query with missing parameters is never authorized or executed.
 */
public class QueryPreparer {

    private static final Logger logger = LoggerFactory.getLogger(QueryPreparer.class);

    private final PermissionSource permissionSource;
    private final String defaultCatalog;
    private final String defaultSchema;
    private final int maxOptions;

    public QueryPreparer(PermissionSource permissionSource, String defaultCatalog, String defaultSchema, int maxOptions) {
        this.permissionSource = Objects.requireNonNull(permissionSource, "permissionSource");
        this.defaultCatalog = defaultCatalog == null ? "" : defaultCatalog;
        this.defaultSchema = defaultSchema == null ? "" : defaultSchema;
        this.maxOptions = maxOptions;
    }

    /**
     * @param config the {@code querygate} block
     */
    public static QueryPreparer create(Config config) throws Exception {
        var permissionSource = PermissionSourceProvider.load(config);
        logger.info("Using permission source {}", permissionSource.getClass().getName());
        return new QueryPreparer(permissionSource,
                ConfigConstants.getDefaultCatalog(config),
                ConfigConstants.getDefaultSchema(config),
                ConfigConstants.getMaxOptions(config));
    }

    public PreparedQuery prepare(QueryTemplate template, Map<String, ParameterValue> values,
                                 String callerId, boolean canEdit)
            throws PermissionLookupException, UnauthorizedException {
        return prepare(template, values, callerId, canEdit, CachePriority.NORMAL);
    }

    /**
     * @param canEdit whether the caller may edit the query; only then are free-form raw values accepted
     * @throws PermissionLookupException if the caller's catalog permissions cannot be determined
     * @throws UnauthorizedException     if the resolved query touches a catalog the caller may not access
     */
    public PreparedQuery prepare(QueryTemplate template, Map<String, ParameterValue> values,
                                 String callerId, boolean canEdit, CachePriority priority)
            throws PermissionLookupException, UnauthorizedException {
        var definitions = template.parameters();
        var required = TemplateResolver.requiredParameters(template.query(), definitions);
        var withDefaults = ParameterDefaults.applyDefaults(values, definitions);
        var resolved = TemplateResolver.resolve(template.query(), withDefaults, definitions, canEdit);
        if (!resolved.isComplete()) {
            logger.debug("Query {} needs input for {}", template.queryId(), resolved.missing());
            return PreparedQuery.needsInput(required, resolved.missing());
        }
        var catalog = effectiveCatalog(template);
        CatalogAccessEnforcer.enforce(permissionSource, callerId, resolved.sql(), catalog);
        var request = new ExecutionRequest(resolved.sql(), catalog, effectiveSchema(template), priority, template.queryId());
        return PreparedQuery.ready(request, required);
    }

    /**
     * Runs a prepared query.
     *
     * @throws IllegalStateException if the query still needs input
     */
    public QueryResult execute(QueryExecutor executor, PreparedQuery prepared) throws QueryExecutionException {
        if (!prepared.isReady()) {
            throw new IllegalStateException("Query has missing parameters: " + prepared.missingParameters());
        }
        var request = prepared.request();
        try {
            return executor.execute(request);
        } catch (QueryExecutionException e) {
            logger.atError().setCause(e).log("Execution failed for query {} on catalog {}", request.queryId(), request.catalog());
            throw e;
        }
    }

    /**
     * Lists the choices for a select or multiselect parameter.
     * <p>
     * Without an options query the definition's static options are returned. An options query whose
     * parent parameters are not all set, or that still has unresolved placeholders, yields no options
     * and is not executed. Options queries are resolved as untrusted regardless of the caller.
     *
     * @param optionsTemplate the saved query referenced by {@code options_query_id}, or null
     * @throws IllegalArgumentException if the parameter has neither static options nor an options query
     */
    public List<ParameterOption> prepareOptions(QueryExecutor executor, ParameterDefinition definition,
                                                QueryTemplate optionsTemplate, Map<String, ParameterValue> values,
                                                String callerId)
            throws PermissionLookupException, UnauthorizedException, QueryExecutionException {
        if (optionsTemplate == null) {
            if (!definition.options().isEmpty()) {
                return ParameterOptions.staticOptions(definition);
            }
            throw new IllegalArgumentException("Parameter " + definition.name() + " has no options query");
        }
        if (!ParameterOptions.dependenciesSatisfied(definition, values)) {
            logger.debug("Options for {} wait on {}", definition.name(), definition.dependsOn());
            return List.of();
        }
        var prepared = prepare(optionsTemplate, values, callerId, false, CachePriority.NORMAL);
        if (!prepared.isReady()) {
            logger.debug("Options query for {} needs input for {}", definition.name(), prepared.missingParameters());
            return List.of();
        }
        var result = execute(executor, prepared);
        return ParameterOptions.fromRows(result.rows(), maxOptions);
    }

    String effectiveCatalog(QueryTemplate template) {
        return isBlank(template.catalog()) ? defaultCatalog : template.catalog();
    }

    String effectiveSchema(QueryTemplate template) {
        return isBlank(template.schema()) ? defaultSchema : template.schema();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
