package io.querygate.sql.runtime;

import java.util.List;

public record QueryResult(List<String> columns, List<List<Object>> rows) {
    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : rows;
    }
}
