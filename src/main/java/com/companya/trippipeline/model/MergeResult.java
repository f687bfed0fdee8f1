package com.companya.trippipeline.model;

/**
 * Outcome of a merge batch. The status is always {@code ok}; the counters only
 * report how many records were written and how many were skipped.
 */
public record MergeResult(String status, int merged, int failed) {

    public static final String OK = "ok";

    public static MergeResult ok(int merged, int failed) {
        return new MergeResult(OK, merged, failed);
    }
}
