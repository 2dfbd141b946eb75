package com.multidb.model;

import lombok.Data;

import java.util.function.Predicate;

/**
 * A canned statement guarded by a test over the lowercased question.
 */
@Data
public class QueryTemplate {
    private final Predicate<String> guard;
    private final String statement;

    public static QueryTemplate when(Predicate<String> guard, String statement) {
        return new QueryTemplate(guard, statement);
    }

    public boolean matches(String lowercasedQuestion) {
        return guard.test(lowercasedQuestion);
    }
}
