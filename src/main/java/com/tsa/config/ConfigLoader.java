package com.tsa.config;

import com.tsa.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads analysis configuration from YAML files.
 * <p>
 * Dates are given as ISO dates ({@code 2018-01-31}), ISO date-times
 * ({@code 2018-01-31T06:00}) or {@code d.M.yyyy} ({@code 31.1.2018}). A
 * date-only {@code time-from} starts at midnight; a date-only
 * {@code time-until} includes that whole day.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final DateTimeFormatter FINNISH_DATE = DateTimeFormatter.ofPattern("d.M.yyyy");

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static TsaConfig load(String path) {
        log.info("Loading analysis configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from YAML text.
     */
    public static TsaConfig parse(String yamlText) {
        return parseYaml(new ByteArrayInputStream(yamlText.getBytes(StandardCharsets.UTF_8)));
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static TsaConfig parseYaml(InputStream inputStream) {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        Yaml yaml = new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new PlainDateResolver());
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The tsa section may be at root or under 'tsa' key
        Map<String, Object> tsaConfig = root.containsKey("tsa")
                ? (Map<String, Object>) root.get("tsa")
                : root;

        String name = getString(tsaConfig, "name", "tsa-analysis");
        String version = getString(tsaConfig, "version", "1.0");

        ParserSettings parser = parseParserSettings((Map<String, Object>) tsaConfig.get("parser"));
        EvaluationSettings evaluation = parseEvaluationSettings((Map<String, Object>) tsaConfig.get("evaluation"));
        List<CollectionConfig> collections = parseCollections((List<Map<String, Object>>) tsaConfig.get("collections"));

        if (collections.isEmpty()) {
            log.warn("No collections configured");
        }

        TsaConfig config = new TsaConfig(name, version, parser, evaluation, collections);

        log.info("Loaded analysis configuration: {} v{} with {} collections, {} conditions, gap tolerance {} min, {} threads",
                name, version, collections.size(),
                collections.stream().mapToInt(c -> c.conditions().size()).sum(),
                evaluation.gapToleranceMinutes(), evaluation.threads());

        return config;
    }

    @SuppressWarnings("unchecked")
    private static ParserSettings parseParserSettings(Map<String, Object> map) {
        if (map == null) {
            return ParserSettings.defaults();
        }
        ParserSettings defaults = ParserSettings.defaults();
        int maxLength = getInt(map, "max-identifier-length", defaults.maxIdentifierLength());
        if (maxLength <= 0) {
            throw new ConfigurationException("parser.max-identifier-length must be positive, got: " + maxLength);
        }
        boolean numericOnly = getBoolean(map, "numeric-values-only", defaults.numericValuesOnly());

        Set<String> reserved = new LinkedHashSet<>();
        Object list = map.get("reserved-identifiers");
        if (list instanceof List<?> items) {
            for (Object item : items) {
                if (item != null) {
                    reserved.add(item.toString().trim().toLowerCase(Locale.ROOT));
                }
            }
        } else if (list != null) {
            throw new ConfigurationException("parser.reserved-identifiers must be a list");
        }
        return new ParserSettings(maxLength, numericOnly, reserved);
    }

    private static EvaluationSettings parseEvaluationSettings(Map<String, Object> map) {
        EvaluationSettings defaults = EvaluationSettings.defaults();
        if (map == null) {
            return defaults;
        }
        int gap = getInt(map, "gap-tolerance-minutes", defaults.gapToleranceMinutes());
        int threads = getInt(map, "threads", defaults.threads());
        if (gap <= 0) {
            throw new ConfigurationException("evaluation.gap-tolerance-minutes must be positive, got: " + gap);
        }
        if (threads <= 0) {
            throw new ConfigurationException("evaluation.threads must be positive, got: " + threads);
        }
        return new EvaluationSettings(gap, threads);
    }

    @SuppressWarnings("unchecked")
    private static List<CollectionConfig> parseCollections(List<Map<String, Object>> list) {
        List<CollectionConfig> collections = new ArrayList<>();
        if (list == null) {
            return collections;
        }

        Set<String> titles = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> map = list.get(i);
            String title = getString(map, "title", "collection-" + (i + 1));
            if (!titles.add(title)) {
                throw new ConfigurationException("Duplicate collection title: " + title);
            }

            LocalDateTime from = parseTime(map.get("time-from"), false, title, "time-from");
            LocalDateTime until = parseTime(map.get("time-until"), true, title, "time-until");
            if (!from.isBefore(until)) {
                throw new ConfigurationException("Collection '" + title + "': time-from " + from
                        + " must be before time-until " + until);
            }

            List<ConditionRow> rows = new ArrayList<>();
            List<Map<String, Object>> conditions = (List<Map<String, Object>>) map.get("conditions");
            if (conditions != null) {
                for (int r = 0; r < conditions.size(); r++) {
                    Map<String, Object> row = conditions.get(r);
                    rows.add(new ConditionRow(
                            r + 1,
                            getString(row, "site", null),
                            getString(row, "alias", null),
                            getString(row, "condition", null)));
                }
            }

            collections.add(new CollectionConfig(title, from, until, rows));
        }
        return collections;
    }

    /**
     * Parse a configured time.
     *
     * @param endOfRange whether a date-only value means the end of that day
     */
    static LocalDateTime parseTime(Object value, boolean endOfRange, String title, String key) {
        if (value == null) {
            throw new ConfigurationException("Collection '" + title + "': " + key + " is missing");
        }
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneOffset.UTC).toLocalDateTime();
        }

        String text = value.toString().trim();
        try {
            if (text.contains("T") || text.contains(":")) {
                return LocalDateTime.parse(text.replace(' ', 'T'));
            }
            LocalDate date = text.contains(".")
                    ? LocalDate.parse(text, FINNISH_DATE)
                    : LocalDate.parse(text);
            return endOfRange ? date.plusDays(1).atStartOfDay() : date.atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Collection '" + title + "': cannot parse " + key + " '" + text + "'", e);
        }
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on":
                return true;
            case "false", "no", "off":
                return false;
            default:
                throw new ConfigurationException("'" + key + "' must be a boolean, got: " + value);
        }
    }

    /**
     * Keeps timestamps as plain strings so that date-only values can be told
     * apart from midnight date-times. Only {@code true} and {@code false} are
     * booleans; {@code yes}, {@code no}, {@code on} and {@code off} stay strings
     * so that sites and aliases with those names keep them.
     */
    private static final class PlainDateResolver extends Resolver {

        @Override
        public Tag resolve(NodeId kind, String value, boolean implicit) {
            Tag tag = super.resolve(kind, value, implicit);
            if (Tag.TIMESTAMP.equals(tag)) {
                return Tag.STR;
            }
            if (Tag.BOOL.equals(tag) && !"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                return Tag.STR;
            }
            return tag;
        }
    }
}
