package com.tsa.store;

import java.time.LocalDateTime;

/**
 * One raw sensor reading.
 *
 * @param stationId station number
 * @param sensorId  sensor id
 * @param time      observation time
 * @param value     observed value as text
 */
public record Observation(int stationId, int sensorId, LocalDateTime time, String value) {
}
