package com.multidb.model;

import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * A lookup statement with its positional JDBC parameters.
 */
@Data
public class SearchStatement {
    private final String sql;
    private final List<Object> parameters;

    /**
     * Binds {@code %term%} to every {@code ?} placeholder in the statement.
     */
    public static SearchStatement like(String sql, String term) {
        int placeholders = 0;
        for (int i = 0; i < sql.length(); i++) {
            if (sql.charAt(i) == '?') {
                placeholders++;
            }
        }
        return new SearchStatement(sql, Collections.nCopies(placeholders, "%" + term + "%"));
    }

    public Object[] parameterArray() {
        return parameters.toArray();
    }
}
