package com.tsa.store;

import com.tsa.condition.Operator;
import com.tsa.exception.StoreException;
import com.tsa.identifier.IdentifierPolicy;
import com.tsa.interval.ValidityInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observation store kept in memory.
 * <p>
 * Intervals are formed per station and sensor: each observation is valid
 * until the next one, but for at most the gap tolerance. The last
 * observation has no successor and is dropped. Observations whose value
 * cannot be compared count as no data. Adjacent intervals with the same
 * value are merged.
 */
public class InMemoryObservationStore implements ObservationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryObservationStore.class);

    private final Map<String, Integer> sensorIds = new ConcurrentHashMap<>();
    private final Map<SeriesKey, List<Observation>> series = new ConcurrentHashMap<>();
    private final Set<String> reservedIdentifiers;

    public InMemoryObservationStore() {
        this(IdentifierPolicy.DEFAULT_RESERVED_WORDS);
    }

    public InMemoryObservationStore(Set<String> reservedIdentifiers) {
        this.reservedIdentifiers = Set.copyOf(reservedIdentifiers);
    }

    public void registerSensor(String name, int id) {
        sensorIds.put(name.trim().toLowerCase(Locale.ROOT), id);
    }

    public void add(Observation observation) {
        series.computeIfAbsent(new SeriesKey(observation.stationId(), observation.sensorId()),
                        k -> Collections.synchronizedList(new ArrayList<>()))
                .add(observation);
    }

    /**
     * Add an observation for a registered sensor name.
     *
     * @throws StoreException if the sensor is not registered
     */
    public void add(int stationId, String sensorName, LocalDateTime time, String value) {
        add(new Observation(stationId, resolveSensorId(sensorName), time, value));
    }

    public int size() {
        return series.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public int resolveSensorId(String sensorName) {
        Integer id = sensorIds.get(sensorName.trim().toLowerCase(Locale.ROOT));
        if (id == null) {
            throw new StoreException("Sensor '" + sensorName + "' not found in database");
        }
        return id;
    }

    @Override
    public Set<String> reservedIdentifiers() {
        return reservedIdentifiers;
    }

    @Override
    public List<ValidityInterval> getIntervals(IntervalQuery query) {
        List<Observation> observations = snapshot(new SeriesKey(query.stationId(), query.sensorId()));
        List<ValidityInterval> intervals = new ArrayList<>();

        for (int i = 0; i < observations.size() - 1; i++) {
            Observation current = observations.get(i);
            LocalDateTime from = current.time();
            LocalDateTime next = observations.get(i + 1).time();
            if (!from.isBefore(next)) {
                continue;
            }
            LocalDateTime limit = from.plus(query.gapTolerance());
            LocalDateTime until = next.isAfter(limit) ? limit : next;

            if (!until.isAfter(query.window().from()) || !from.isBefore(query.window().until())) {
                continue;
            }

            Boolean value = compare(current.value(), query.operator(), query.value());
            if (value == null) {
                continue;
            }
            append(intervals, new ValidityInterval(from, until, value));
        }

        log.debug("Station {} sensor {} '{} {}': {} observations, {} intervals",
                query.stationId(), query.sensorId(), query.operator(), query.value(),
                observations.size(), intervals.size());
        return intervals;
    }

    private List<Observation> snapshot(SeriesKey key) {
        List<Observation> stored = series.get(key);
        if (stored == null) {
            return List.of();
        }
        List<Observation> copy;
        synchronized (stored) {
            copy = new ArrayList<>(stored);
        }
        copy.sort(Comparator.comparing(Observation::time));
        return copy;
    }

    private static void append(List<ValidityInterval> intervals, ValidityInterval interval) {
        if (!intervals.isEmpty()) {
            ValidityInterval last = intervals.get(intervals.size() - 1);
            if (last.value() == interval.value() && last.until().equals(interval.from())) {
                intervals.set(intervals.size() - 1,
                        new ValidityInterval(last.from(), interval.until(), last.value()));
                return;
            }
        }
        intervals.add(interval);
    }

    /**
     * Compare an observed value against the reference of a block.
     * Numbers compare numerically, other values only by (in)equality.
     *
     * @return comparison result, or null if the values cannot be compared
     */
    static Boolean compare(String observed, Operator operator, String reference) {
        if (observed == null || observed.isBlank()) {
            return null;
        }
        String value = observed.trim();

        if (operator == Operator.IN) {
            for (String member : tupleMembers(reference)) {
                if (valuesEqual(value, member)) {
                    return Boolean.TRUE;
                }
            }
            return Boolean.FALSE;
        }

        BigDecimal observedNumber = toNumber(value);
        BigDecimal referenceNumber = toNumber(reference);
        if (observedNumber != null && referenceNumber != null) {
            return operator.accepts(observedNumber.compareTo(referenceNumber));
        }
        if (referenceNumber != null) {
            return null;
        }
        if (operator == Operator.EQUALS) {
            return value.equalsIgnoreCase(reference);
        }
        if (operator == Operator.NOT_EQUALS) {
            return !value.equalsIgnoreCase(reference);
        }
        return null;
    }

    static List<String> tupleMembers(String tuple) {
        String inner = tuple.trim();
        if (inner.startsWith("(")) {
            inner = inner.substring(1);
        }
        if (inner.endsWith(")")) {
            inner = inner.substring(0, inner.length() - 1);
        }
        List<String> members = new ArrayList<>();
        for (String part : inner.split(",")) {
            String member = unquote(part.trim());
            if (!member.isEmpty()) {
                members.add(member);
            }
        }
        return members;
    }

    private static boolean valuesEqual(String observed, String member) {
        BigDecimal a = toNumber(observed);
        BigDecimal b = toNumber(member);
        if (a != null && b != null) {
            return a.compareTo(b) == 0;
        }
        return observed.equalsIgnoreCase(member);
    }

    private static String unquote(String text) {
        if (text.length() >= 2
                && (text.startsWith("'") && text.endsWith("'") || text.startsWith("\"") && text.endsWith("\""))) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static BigDecimal toNumber(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record SeriesKey(int stationId, int sensorId) {
    }
}
