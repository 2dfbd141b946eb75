package com.multidb.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class QueryRequest {
    @NotBlank(message = "Question is required")
    private String question;

    // Constructors
    public QueryRequest() {}

    public QueryRequest(String question) {
        this.question = question;
    }
}
