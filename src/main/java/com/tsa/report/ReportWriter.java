package com.tsa.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tsa.condition.Condition;
import com.tsa.core.CollectionResult;
import com.tsa.core.CondCollection;
import com.tsa.core.ConditionResult;
import com.tsa.core.ErrorCollection;
import com.tsa.expression.TruthValue;
import com.tsa.interval.PartitionSlice;
import com.tsa.interval.Summary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Writes analysis results as JSON.
 * <p>
 * Per collection: title, window and errors; per condition: id, condition
 * text, alias expression, summary (durations in seconds) and slices with
 * block and master values ({@code true}, {@code false} or {@code null}).
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this(new ObjectMapper());
    }

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJson(String analysisName, List<CollectionResult> results) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("analysis", analysisName);
        root.put("generatedAt", LocalDateTime.now().toString());
        ArrayNode collections = root.putArray("collections");
        for (CollectionResult result : results) {
            collections.add(toJson(result));
        }
        return root;
    }

    public ObjectNode toJson(CollectionResult result) {
        CondCollection collection = result.getCollection();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("title", collection.getTitle());
        node.put("timeFrom", collection.getWindow().from().toString());
        node.put("timeUntil", collection.getWindow().until().toString());

        ArrayNode conditions = node.putArray("conditions");
        for (ConditionResult conditionResult : result.getResults()) {
            conditions.add(toJson(conditionResult));
        }
        node.set("errors", toJson(collection.getErrors()));
        return node;
    }

    public ObjectNode toJson(ConditionResult result) {
        Condition condition = result.getCondition();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", condition.getId().key());
        node.put("site", condition.getSite());
        node.put("alias", condition.getMasterAlias());
        node.put("secondary", condition.isSecondary());
        node.put("condition", condition.getCondition());
        node.put("aliasExpression", condition.getAliasExpression());
        node.set("summary", toJson(result.getSummary()));

        ArrayNode slices = node.putArray("slices");
        for (PartitionSlice slice : result.getSlices()) {
            ObjectNode sliceNode = slices.addObject();
            sliceNode.put("from", slice.from().toString());
            sliceNode.put("until", slice.until().toString());
            ObjectNode blocks = sliceNode.putObject("blocks");
            for (Map.Entry<String, TruthValue> entry : slice.blockValues().entrySet()) {
                blocks.put(entry.getKey(), entry.getValue().toBoolean());
            }
            sliceNode.put("master", slice.master().toBoolean());
        }
        return node;
    }

    private ObjectNode toJson(Summary summary) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("totalSeconds", summary.total().getSeconds());
        node.put("validSeconds", summary.valid().getSeconds());
        node.put("invalidSeconds", summary.invalid().getSeconds());
        node.put("nodataSeconds", summary.nodata().getSeconds());
        node.put("validPercentage", summary.validPercentage());
        node.put("invalidPercentage", summary.invalidPercentage());
        node.put("nodataPercentage", summary.nodataPercentage());
        node.put("dataFrom", summary.dataFrom() == null ? null : summary.dataFrom().toString());
        node.put("dataUntil", summary.dataUntil() == null ? null : summary.dataUntil().toString());
        node.put("slices", summary.sliceCount());
        return node;
    }

    private ArrayNode toJson(ErrorCollection errors) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ErrorCollection.Entry entry : errors.entries()) {
            ObjectNode node = array.addObject();
            node.put("kind", entry.getError().kind().name());
            node.put("context", entry.getError().context());
            node.put("row", entry.getError().sourceRow());
            node.put("message", entry.getError().message());
            node.put("moreSimilar", entry.getMoreCount());
        }
        return array;
    }

    public void write(String analysisName, List<CollectionResult> results, OutputStream out) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, toJson(analysisName, results));
    }

    /**
     * Write the report to a file, creating parent directories.
     */
    public void write(String analysisName, List<CollectionResult> results, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            write(analysisName, results, out);
        }
        log.info("Report written to {}", path);
    }
}
