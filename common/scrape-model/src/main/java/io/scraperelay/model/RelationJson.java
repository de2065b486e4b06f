package io.scraperelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.scraperelay.errors.MalformedFragmentException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical JSON codec for the string values stored in relation data.
 */
public final class RelationJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .findAndAddModules()
        .build()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final ObjectMapper SORTED_MAPPER = JsonMapper.builder()
        .findAndAddModules()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final TypeReference<List<ScrapeJob>> JOBS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> RAW_JOBS_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private RelationJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String write(Object value, String label) {
        return write(MAPPER, value, label);
    }

    /**
     * Serializes with sorted keys so that unchanged content always produces the same
     * string and does not trigger a spurious relation-changed notification.
     */
    public static String writeSorted(Object value, String label) {
        return write(SORTED_MAPPER, value, label);
    }

    public static String writeJobs(List<ScrapeJob> jobs) {
        return write(jobs == null ? List.of() : jobs, "scrape jobs");
    }

    public static String writeRuleSet(AlertRuleSet rules) {
        return write(rules == null ? AlertRuleSet.EMPTY : rules, "alert rules");
    }

    public static String writeMetadata(Map<String, String> metadata) {
        return write(metadata == null ? Map.of() : metadata, "scrape metadata");
    }

    /** Decodes {@code scrape_jobs}; unknown job fields are dropped. */
    public static List<ScrapeJob> readJobs(String json) {
        if (isBlank(json)) {
            return List.of();
        }
        return read(json, JOBS_TYPE, "scrape_jobs");
    }

    /** Decodes {@code scrape_jobs} keeping every field, for callers that sanitize themselves. */
    public static List<Map<String, Object>> readRawJobs(String json) {
        if (isBlank(json)) {
            return List.of();
        }
        return read(json, RAW_JOBS_TYPE, "scrape_jobs");
    }

    public static AlertRuleSet readRuleSet(String json) {
        if (isBlank(json)) {
            return AlertRuleSet.EMPTY;
        }
        AlertRuleSet rules = read(json, AlertRuleSet.class, "alert_rules");
        return rules == null ? AlertRuleSet.EMPTY : rules;
    }

    public static Map<String, String> readMetadata(String json) {
        if (isBlank(json)) {
            return Map.of();
        }
        Map<String, String> metadata = read(json, METADATA_TYPE, "scrape_metadata");
        return metadata == null ? Map.of() : metadata;
    }

    private static String write(ObjectMapper mapper, Object value, String label) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(label, "label");
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + label, e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type, String key) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new MalformedFragmentException("Failed to parse " + key + ": " + e.getOriginalMessage(), e);
        }
    }

    private static <T> T read(String json, Class<T> type, String key) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new MalformedFragmentException("Failed to parse " + key + ": " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
