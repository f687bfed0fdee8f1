package com.companya.trippipeline.service;

import java.time.LocalDateTime;

/**
 * How trips are bucketed before fare statistics are computed.
 */
public enum GroupingMode {

    /** One group per distinct pickup timestamp. */
    EXACT_TIMESTAMP {
        @Override
        public LocalDateTime groupKey(LocalDateTime pickup) {
            return pickup;
        }
    },

    /** One group per pickup date; the key is midnight of that date. */
    CALENDAR_DAY {
        @Override
        public LocalDateTime groupKey(LocalDateTime pickup) {
            return pickup.toLocalDate().atStartOfDay();
        }
    };

    public abstract LocalDateTime groupKey(LocalDateTime pickup);
}
