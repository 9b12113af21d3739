package com.tsa.config;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One condition collection: a time window and its condition rows.
 *
 * @param title      Collection title
 * @param timeFrom   Inclusive window start
 * @param timeUntil  Exclusive window end
 * @param conditions Condition rows in input order
 */
public record CollectionConfig(
        String title,
        LocalDateTime timeFrom,
        LocalDateTime timeUntil,
        List<ConditionRow> conditions
) {
    public CollectionConfig {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
