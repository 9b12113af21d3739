package com.tsa.store;

import com.tsa.condition.Operator;
import com.tsa.interval.TimeWindow;

import java.time.Duration;

/**
 * Request for the validity intervals of one primary block.
 *
 * @param stationId    station number
 * @param sensorId     resolved sensor id
 * @param operator     comparison operator
 * @param value        value text, a parenthesized tuple for {@code in}
 * @param window       analysis window
 * @param gapTolerance longest time an observation stays valid without a successor
 */
public record IntervalQuery(int stationId,
                            int sensorId,
                            Operator operator,
                            String value,
                            TimeWindow window,
                            Duration gapTolerance) {
}
