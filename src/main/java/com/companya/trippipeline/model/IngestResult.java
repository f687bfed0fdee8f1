package com.companya.trippipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestResult(String status, String message) {

    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static IngestResult done() {
        return new IngestResult(DONE, null);
    }

    public static IngestResult error(String message) {
        return new IngestResult(ERROR, message);
    }
}
