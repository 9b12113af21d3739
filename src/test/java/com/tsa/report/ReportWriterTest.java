package com.tsa.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tsa.condition.Condition;
import com.tsa.condition.ConditionCompiler;
import com.tsa.core.CollectionResult;
import com.tsa.core.CondCollection;
import com.tsa.core.ConditionResult;
import com.tsa.exception.ErrorKind;
import com.tsa.expression.TruthValue;
import com.tsa.interval.PartitionSlice;
import com.tsa.interval.SummaryAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportWriter.
 */
class ReportWriterTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2018, 1, 1, 0, 0);

    private ReportWriter writer;
    private CollectionResult result;

    @BeforeEach
    void setUp() {
        writer = new ReportWriter();

        CondCollection collection = new CondCollection("ylojarvi", T0, T0.plusHours(1), new ConditionCompiler());
        collection.addCondition("tie", "c1", "s1122#kitka3_luku >= 0.30 and s1115#kitka3_luku >= 0.30");
        collection.getErrors().add(ErrorKind.STORE, "tie_c2", 2, "Sensor 'lumi' not found in database");

        Condition condition = collection.getCondition("tie_c1");
        Map<String, TruthValue> first = new LinkedHashMap<>();
        first.put("c1_0", TruthValue.TRUE);
        first.put("c1_1", TruthValue.TRUE);
        Map<String, TruthValue> second = new LinkedHashMap<>();
        second.put("c1_0", TruthValue.TRUE);
        second.put("c1_1", TruthValue.UNKNOWN);
        List<PartitionSlice> slices = List.of(
                new PartitionSlice(T0, T0.plusMinutes(45), first, TruthValue.TRUE),
                new PartitionSlice(T0.plusMinutes(45), T0.plusHours(1), second, TruthValue.UNKNOWN));

        ConditionResult conditionResult = new ConditionResult(condition, slices,
                SummaryAggregator.summarize(collection.getWindow(), slices));
        result = new CollectionResult(collection, Map.of(condition.getId(), conditionResult));
    }

    @Test
    @DisplayName("Collection report contains conditions, summaries, slices and errors")
    void collectionReport() {
        ObjectNode node = writer.toJson(result);

        assertEquals("ylojarvi", node.get("title").asText());
        assertEquals("2018-01-01T00:00", node.get("timeFrom").asText());
        assertEquals("2018-01-01T01:00", node.get("timeUntil").asText());

        JsonNode condition = node.get("conditions").get(0);
        assertEquals("tie_c1", condition.get("id").asText());
        assertEquals("c1_0 and c1_1", condition.get("aliasExpression").asText());
        assertFalse(condition.get("secondary").asBoolean());

        JsonNode summary = condition.get("summary");
        assertEquals(3600, summary.get("totalSeconds").asLong());
        assertEquals(2700, summary.get("validSeconds").asLong());
        assertEquals(900, summary.get("nodataSeconds").asLong());
        assertEquals(75.0, summary.get("validPercentage").asDouble(), 1e-9);
        assertEquals(2, summary.get("slices").asInt());

        JsonNode slice = condition.get("slices").get(1);
        assertTrue(slice.get("blocks").get("c1_0").asBoolean());
        assertTrue(slice.get("blocks").get("c1_1").isNull());
        assertTrue(slice.get("master").isNull());

        JsonNode error = node.get("errors").get(0);
        assertEquals("STORE", error.get("kind").asText());
        assertEquals(2, error.get("row").asInt());
        assertEquals(0, error.get("moreSimilar").asInt());
    }

    @Test
    @DisplayName("Report is written to a file, creating directories")
    void writesFile(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("reports").resolve("report.json");

        writer.write("winter", List.of(result), path);

        assertTrue(Files.exists(path));
        JsonNode root = new ObjectMapper().readTree(path.toFile());
        assertEquals("winter", root.get("analysis").asText());
        assertEquals(1, root.get("collections").size());
        assertTrue(root.has("generatedAt"));
    }
}
