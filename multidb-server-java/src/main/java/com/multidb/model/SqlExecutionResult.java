package com.multidb.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one statement against one source: rows, an affected-row count, or a failure.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SqlExecutionResult {

    public enum FailureType {
        CONNECTION,
        EXECUTION
    }

    private boolean success;
    private List<Map<String, Object>> data;
    private String error;

    @JsonProperty("failure_type")
    private FailureType failureType;

    @JsonProperty("row_count")
    private Integer rowCount;

    @JsonProperty("rows_affected")
    private Integer rowsAffected;

    private SqlExecutionResult(boolean success, List<Map<String, Object>> data, String error,
                               FailureType failureType, Integer rowCount, Integer rowsAffected) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.failureType = failureType;
        this.rowCount = rowCount;
        this.rowsAffected = rowsAffected;
    }

    public static SqlExecutionResult rows(List<Map<String, Object>> data) {
        List<Map<String, Object>> rows = Objects.requireNonNullElseGet(data, ArrayList::new);
        return new SqlExecutionResult(true, rows, null, null, rows.size(), null);
    }

    public static SqlExecutionResult affected(int rowsAffected) {
        return new SqlExecutionResult(true, null, null, null, null, rowsAffected);
    }

    public static SqlExecutionResult failure(FailureType failureType, String error) {
        return new SqlExecutionResult(false, null, Objects.requireNonNullElse(error, "unknown error"),
            failureType, null, null);
    }

    public boolean hasRows() {
        return success && data != null && !data.isEmpty();
    }

    /**
     * First value of the first row, or null when there is none.
     */
    public Object firstValue() {
        if (!hasRows()) {
            return null;
        }
        Map<String, Object> first = data.get(0);
        return first.isEmpty() ? null : first.values().iterator().next();
    }
}
