package com.companya.trippipeline.store;

import com.companya.trippipeline.model.TripRecord;

/**
 * Predicate applied to items after they are read during a scan.
 */
@FunctionalInterface
public interface ScanFilter {

    ScanFilter ALL = record -> true;

    boolean matches(TripRecord record);
}
