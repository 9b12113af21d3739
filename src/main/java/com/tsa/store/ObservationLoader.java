package com.tsa.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsa.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads observations from JSON into an {@link InMemoryObservationStore}.
 * <p>
 * Format:
 * <pre>
 * {
 *   "sensors": { "kitka3_luku": 27, "nakyvyys_metria": 58 },
 *   "observations": [
 *     { "station": 1122, "sensor": "kitka3_luku", "time": "2018-01-01T00:00:00", "value": "0.35" }
 *   ]
 * }
 * </pre>
 * {@code sensor} may be a registered name or a numeric id.
 */
public class ObservationLoader {

    private static final Logger log = LoggerFactory.getLogger(ObservationLoader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Load observations from a path.
     * Supports classpath: prefix for classpath resources.
     */
    public static InMemoryObservationStore load(String path) {
        log.info("Loading observations from: {}", path);

        try (InputStream inputStream = getResource(path).getInputStream()) {
            InMemoryObservationStore store = read(inputStream);
            log.info("Loaded {} observations from {}", store.size(), path);
            return store;
        } catch (IOException e) {
            throw new StoreException("Failed to load observations from: " + path, e);
        }
    }

    public static InMemoryObservationStore read(InputStream inputStream) throws IOException {
        JsonNode root = objectMapper.readTree(inputStream);
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new StoreException("Observation file is empty");
        }

        InMemoryObservationStore store = new InMemoryObservationStore();

        JsonNode sensors = root.path("sensors");
        Iterator<Map.Entry<String, JsonNode>> fields = sensors.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            store.registerSensor(entry.getKey(), entry.getValue().asInt());
        }

        int index = 0;
        for (JsonNode node : root.path("observations")) {
            store.add(toObservation(store, node, index++));
        }
        return store;
    }

    private static Observation toObservation(InMemoryObservationStore store, JsonNode node, int index) {
        JsonNode sensor = node.path("sensor");
        JsonNode time = node.path("time");
        if (!node.has("station") || sensor.isMissingNode() || time.isMissingNode()) {
            throw new StoreException("Observation " + index + " needs station, sensor and time: " + node);
        }

        int sensorId = sensor.isNumber() ? sensor.asInt() : store.resolveSensorId(sensor.asText());
        JsonNode value = node.path("value");
        try {
            return new Observation(node.get("station").asInt(), sensorId,
                    LocalDateTime.parse(time.asText()),
                    value.isNull() || value.isMissingNode() ? null : value.asText());
        } catch (DateTimeParseException e) {
            throw new StoreException("Observation " + index + " has an invalid time: " + time.asText(), e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }
}
