package io.querygate.sql.runtime;

import java.util.List;

/**
 * Outcome of preparing a template: either a request to execute, or the parameters the caller
 * still has to supply.
 *
 * @param request            the request to execute, null when input is missing
 * @param requiredParameters logical names of every parameter the template uses
 * @param missingParameters  logical names that had no usable value
 */
public record PreparedQuery(ExecutionRequest request, List<String> requiredParameters, List<String> missingParameters) {

    public PreparedQuery {
        requiredParameters = requiredParameters == null ? List.of() : List.copyOf(requiredParameters);
        missingParameters = missingParameters == null ? List.of() : List.copyOf(missingParameters);
    }

    public static PreparedQuery ready(ExecutionRequest request, List<String> requiredParameters) {
        return new PreparedQuery(request, requiredParameters, List.of());
    }

    public static PreparedQuery needsInput(List<String> requiredParameters, List<String> missingParameters) {
        return new PreparedQuery(null, requiredParameters, missingParameters);
    }

    public boolean isReady() {
        return request != null;
    }
}
