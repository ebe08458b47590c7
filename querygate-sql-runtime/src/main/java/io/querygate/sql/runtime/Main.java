package io.querygate.sql.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.querygate.sql.common.auth.PermissionLookupException;
import io.querygate.sql.common.auth.UnauthorizedException;
import io.querygate.sql.common.util.ConfigUtils;
import io.querygate.sql.template.model.ParameterValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Prepares a query from a JSON request file and prints the SQL that would be executed.
 * <pre>
 * java io.querygate.sql.runtime.Main --conf querygate.default_catalog=hive request.json
 * </pre>
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int EXIT_READY = 0;
    public static final int EXIT_NEEDS_INPUT = 1;
    public static final int EXIT_DENIED = 2;
    public static final int EXIT_ERROR = 3;

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out));
    }

    public static int run(String[] args, PrintStream out) throws Exception {
        var commandLine = ConfigUtils.loadCommandLineConfig(args);
        if (commandLine.mainParameters().size() != 1) {
            out.println("Usage: Main [--conf key=value]... <request.json>");
            return EXIT_ERROR;
        }
        var config = ConfigUtils.loadAppConfig(commandLine.config());
        var preparer = QueryPreparer.create(config);
        PrepareRequest request;
        try {
            request = MAPPER.readValue(Path.of(commandLine.mainParameters().get(0)).toFile(), PrepareRequest.class);
        } catch (IOException e) {
            logger.atError().setCause(e).log("Unable to read request {}", commandLine.mainParameters().get(0));
            out.println("Invalid request: " + e.getMessage());
            return EXIT_ERROR;
        }
        var values = ParameterValues.fromJsonObject(request.values());
        try {
            var prepared = preparer.prepare(request.toTemplate(), values, request.user(), request.canEdit(), CachePriority.LOW);
            if (!prepared.isReady()) {
                out.println("Missing parameters: " + String.join(", ", prepared.missingParameters()));
                return EXIT_NEEDS_INPUT;
            }
            var executionRequest = prepared.request();
            out.println("-- catalog: " + executionRequest.catalog() + ", schema: " + executionRequest.schema());
            out.println(executionRequest.sql());
            return EXIT_READY;
        } catch (UnauthorizedException e) {
            out.println("Denied: " + e.getMessage());
            return EXIT_DENIED;
        } catch (PermissionLookupException e) {
            logger.atError().setCause(e).log("Permission lookup failed for {}", request.user());
            out.println("Denied: permissions unavailable");
            return EXIT_DENIED;
        }
    }
}
