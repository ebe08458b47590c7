package io.querygate.sql.runtime;

import com.typesafe.config.ConfigFactory;
import io.querygate.sql.catalog.authorization.AllowedCatalogs;
import io.querygate.sql.catalog.authorization.PermissionSource;
import io.querygate.sql.catalog.authorization.UnrestrictedPermissionSource;
import io.querygate.sql.common.auth.CatalogAccessDeniedException;
import io.querygate.sql.common.auth.PermissionLookupException;
import io.querygate.sql.template.model.EmptyBehavior;
import io.querygate.sql.template.model.ParameterDefinition;
import io.querygate.sql.template.model.ParameterOption;
import io.querygate.sql.template.model.ParameterType;
import io.querygate.sql.template.model.ParameterValue;
import io.querygate.sql.template.model.ParameterValues;
import io.querygate.sql.template.model.SqlFormat;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QueryPreparerTest {

    private static final PermissionSource PERMISSIONS = callerId -> {
        switch (callerId) {
            case "alice":
                return AllowedCatalogs.of(Set.of("memory"));
            case "root":
                return AllowedCatalogs.unrestricted();
            default:
                throw new PermissionLookupException("unknown caller " + callerId);
        }
    };

    private static final ParameterDefinition COUNTRY = ParameterDefinition.of("country", ParameterType.SELECT, SqlFormat.STRING);
    private static final ParameterDefinition CITY = ParameterDefinition.of("city", ParameterType.SELECT, SqlFormat.STRING)
            .withDependsOn(List.of("country"));

    /**
     * Records every request and answers with a fixed result.
     */
    static class RecordingExecutor implements QueryExecutor {
        final List<ExecutionRequest> requests = new ArrayList<>();
        final QueryResult result;

        RecordingExecutor(QueryResult result) {
            this.result = result;
        }

        @Override
        public QueryResult execute(ExecutionRequest request) {
            requests.add(request);
            return result;
        }
    }

    private static QueryPreparer preparer() {
        return new QueryPreparer(PERMISSIONS, "memory", "default", 200);
    }

    @Test
    public void testReadyQueryUsesDefaultCatalogAndSchema() throws Exception {
        var template = new QueryTemplate("q1", "SELECT * FROM city WHERE country = {{country}}", null, "", List.of(COUNTRY));
        var prepared = preparer().prepare(template, Map.of("country", ParameterValue.text("JPN")), "alice", false);
        assertTrue(prepared.isReady());
        assertEquals(new ExecutionRequest("SELECT * FROM city WHERE country = 'JPN'", "memory", "default", CachePriority.NORMAL, "q1"),
                prepared.request());
        assertEquals(List.of("country"), prepared.requiredParameters());
        assertTrue(prepared.missingParameters().isEmpty());
    }

    @Test
    public void testMissingInputSkipsAuthorizationAndExecution() throws Exception {
        var template = QueryTemplate.of("SELECT * FROM hive.default.t WHERE c = {{country}}", null, null, List.of(COUNTRY));
        // an unknown caller would fail the permission lookup, so reaching it would throw
        var prepared = preparer().prepare(template, Map.of(), "mallory", false);
        assertFalse(prepared.isReady());
        assertNull(prepared.request());
        assertEquals(List.of("country"), prepared.missingParameters());

        var executor = new RecordingExecutor(new QueryResult(List.of(), List.of()));
        assertThrows(IllegalStateException.class, () -> preparer().execute(executor, prepared));
        assertTrue(executor.requests.isEmpty());
    }

    @Test
    public void testResolvedQueryIsAuthorized() {
        var template = QueryTemplate.of("SELECT * FROM hive.default.t WHERE c = {{country}}", "memory", null, List.of(COUNTRY));
        assertThrows(CatalogAccessDeniedException.class,
                () -> preparer().prepare(template, Map.of("country", ParameterValue.text("JPN")), "alice", false));
    }

    @Test
    public void testTemplateCatalogIsEnforced() {
        var template = QueryTemplate.of("SELECT 1", "hive", null, List.of());
        assertThrows(CatalogAccessDeniedException.class, () -> preparer().prepare(template, Map.of(), "alice", true));
    }

    @Test
    public void testLookupFailureAbortsPreparation() {
        var template = QueryTemplate.of("SELECT 1", null, null, List.of());
        assertThrows(PermissionLookupException.class, () -> preparer().prepare(template, Map.of(), "mallory", false));
    }

    @Test
    public void testRawTrustFollowsEditCapability() throws Exception {
        var filter = ParameterDefinition.of("filter", ParameterType.TEXT, SqlFormat.RAW);
        var template = QueryTemplate.of("SELECT * FROM t WHERE {{filter}}", null, null, List.of(filter));
        Map<String, ParameterValue> values = Map.of("filter", ParameterValue.text("a = 1 OR b = 2"));

        var viewer = preparer().prepare(template, values, "alice", false);
        assertEquals(List.of("filter"), viewer.missingParameters());

        var editor = preparer().prepare(template, values, "alice", true);
        assertEquals("SELECT * FROM t WHERE a = 1 OR b = 2", editor.request().sql());
    }

    @Test
    public void testDefaultsAreApplied() throws Exception {
        var withDefault = COUNTRY.withDefaultValue(ParameterValue.text("FRA"));
        var template = QueryTemplate.of("SELECT * FROM city WHERE country = {{country}}", null, null, List.of(withDefault));
        var prepared = preparer().prepare(template, null, "alice", false, CachePriority.HIGH);
        assertEquals("SELECT * FROM city WHERE country = 'FRA'", prepared.request().sql());
        assertEquals(CachePriority.HIGH, prepared.request().priority());
    }

    @Test
    public void testExecuteHandsRequestToExecutor() throws Exception {
        var template = QueryTemplate.of("SELECT 1", "memory", "s", List.of());
        var executor = new RecordingExecutor(new QueryResult(List.of("one"), List.of(List.of(1))));
        var preparer = preparer();
        var result = preparer.execute(executor, preparer.prepare(template, Map.of(), "alice", false));
        assertEquals(List.of("one"), result.columns());
        assertEquals(1, executor.requests.size());
        assertEquals("s", executor.requests.get(0).schema());
    }

    @Test
    public void testExecutionFailurePropagates() throws Exception {
        var preparer = preparer();
        var prepared = preparer.prepare(QueryTemplate.of("SELECT 1", null, null, List.of()), Map.of(), "root", false);
        QueryExecutor failing = request -> {
            throw new QueryExecutionException("engine unavailable");
        };
        var e = assertThrows(QueryExecutionException.class, () -> preparer.execute(failing, prepared));
        assertEquals("engine unavailable", e.getMessage());
    }

    @Test
    public void testOptionsFromQuery() throws Exception {
        var optionsQuery = QueryTemplate.of("SELECT code, name FROM city WHERE country = {{country}}", null, null, List.of(COUNTRY));
        List<List<Object>> rows = List.of(List.of("TYO", "Tokyo"), List.of("OSA"));
        var executor = new RecordingExecutor(new QueryResult(List.of("code", "name"), rows));
        var options = preparer().prepareOptions(executor, CITY, optionsQuery,
                ParameterValues.ofMap(Map.of("country", "JPN")), "alice");
        assertEquals(List.of(new ParameterOption("TYO", "Tokyo"), new ParameterOption("OSA", "OSA")), options);
        assertEquals("SELECT code, name FROM city WHERE country = 'JPN'", executor.requests.get(0).sql());
    }

    @Test
    public void testOptionsWaitForParents() throws Exception {
        var optionsQuery = QueryTemplate.of("SELECT code FROM city WHERE country = {{country}}", null, null, List.of(COUNTRY));
        var executor = new RecordingExecutor(new QueryResult(List.of(), List.of()));
        assertEquals(List.of(), preparer().prepareOptions(executor, CITY, optionsQuery, Map.of(), "alice"));
        assertTrue(executor.requests.isEmpty());
    }

    @Test
    public void testOptionsQueryIsUntrusted() throws Exception {
        var filter = ParameterDefinition.of("filter", ParameterType.TEXT, SqlFormat.RAW);
        var optionsQuery = QueryTemplate.of("SELECT code FROM city WHERE {{filter}}", null, null, List.of(filter));
        var executor = new RecordingExecutor(new QueryResult(List.of(), List.of()));
        var definition = ParameterDefinition.of("city", ParameterType.SELECT, SqlFormat.STRING);
        var options = preparer().prepareOptions(executor, definition, optionsQuery,
                Map.of("filter", ParameterValue.text("1=1 OR x")), "root");
        assertEquals(List.of(), options);
        assertTrue(executor.requests.isEmpty());
    }

    @Test
    public void testOptionsAreCappedByConfiguration() throws Exception {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(List.of("v" + i));
        }
        var preparer = new QueryPreparer(new UnrestrictedPermissionSource(), "", "", 3);
        var executor = new RecordingExecutor(new QueryResult(List.of("v"), rows));
        var definition = ParameterDefinition.of("v", ParameterType.SELECT, SqlFormat.STRING);
        var options = preparer.prepareOptions(executor, definition, QueryTemplate.of("SELECT v FROM t", null, null, List.of()),
                Map.of(), "anyone");
        assertEquals(3, options.size());
    }

    @Test
    public void testStaticOptions() throws Exception {
        var definition = ParameterDefinition.of("size", ParameterType.SELECT, SqlFormat.STRING)
                .withOptions(List.of(new ParameterOption("s", "Small"), new ParameterOption("l", "Large")));
        var executor = new RecordingExecutor(new QueryResult(List.of(), List.of()));
        assertEquals(definition.options(), preparer().prepareOptions(executor, definition, null, Map.of(), "alice"));

        var bare = ParameterDefinition.of("size", ParameterType.SELECT, SqlFormat.STRING);
        assertThrows(IllegalArgumentException.class, () -> preparer().prepareOptions(executor, bare, null, Map.of(), "alice"));
    }

    @Test
    public void testMatchNoneQueryStillRuns() throws Exception {
        var region = ParameterDefinition.of("region", ParameterType.MULTISELECT, SqlFormat.STRING_LIST)
                .withEmptyBehavior(EmptyBehavior.MATCH_NONE);
        var template = QueryTemplate.of("SELECT * FROM sales WHERE {{region}}", null, null, List.of(region));
        var prepared = preparer().prepare(template, Map.of(), "alice", false);
        assertEquals("SELECT * FROM sales WHERE 1=0", prepared.request().sql());
    }

    @Test
    public void testCreateFromConfig() throws Exception {
        var config = ConfigFactory.parseString("""
                default_catalog = memory
                default_schema = main
                options { max_options = 50 }
                permission_source {
                  class = "io.querygate.sql.catalog.authorization.ConfigBasedPermissionSource"
                  roles = [ { name = analyst, catalogs = [memory] } ]
                  users = [ { username = alice, roles = [analyst] } ]
                }
                """);
        var preparer = QueryPreparer.create(config);
        var template = QueryTemplate.of("SELECT 1", null, null, List.of());
        assertEquals("memory", preparer.prepare(template, Map.of(), "alice", false).request().catalog());
        assertEquals("main", preparer.effectiveSchema(template));
        assertThrows(CatalogAccessDeniedException.class,
                () -> preparer.prepare(QueryTemplate.of("SELECT 1", "hive", null, List.of()), Map.of(), "alice", false));
    }
}
