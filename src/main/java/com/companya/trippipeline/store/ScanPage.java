package com.companya.trippipeline.store;

import com.companya.trippipeline.model.TripRecord;

import java.util.List;

/**
 * One page of a scan. {@code nextToken} is {@code null} once the table is
 * exhausted; a page may be empty while a token is still present when the
 * filter rejected everything read.
 */
public record ScanPage(List<TripRecord> items, String nextToken) {

    public ScanPage {
        items = List.copyOf(items);
    }

    public boolean hasMore() {
        return nextToken != null;
    }
}
