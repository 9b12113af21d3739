package com.tsa.store;

import com.tsa.interval.ValidityInterval;

import java.util.List;
import java.util.Set;

/**
 * Source of observation data for primary blocks.
 * Implementations must be safe for concurrent use.
 */
public interface ObservationStore {

    /**
     * Ordered, non-overlapping intervals during which the comparison of the
     * query was true or false. Times not covered have no data.
     *
     * @throws com.tsa.exception.StoreException if the data cannot be fetched
     */
    List<ValidityInterval> getIntervals(IntervalQuery query);

    /**
     * Resolve a sensor name to its id.
     *
     * @throws com.tsa.exception.StoreException if the sensor is not known
     */
    int resolveSensorId(String sensorName);

    /**
     * Relation names of the store that must not be used as identifiers.
     */
    Set<String> reservedIdentifiers();
}
