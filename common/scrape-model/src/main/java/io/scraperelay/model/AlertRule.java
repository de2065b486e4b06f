package io.scraperelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.scraperelay.topology.TopologyDefaults;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertRule(
    String alert,
    String expr,
    @JsonProperty("for") String forDuration,
    Map<String, String> labels,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> annotations) {

    public AlertRule {
        labels = ordered(labels);
        annotations = ordered(annotations);
    }

    public AlertRule(String alert, String expr) {
        this(alert, expr, null, null, null);
    }

    public AlertRule withExpr(String expression) {
        return new AlertRule(alert, expression, forDuration, labels, annotations);
    }

    /**
     * Returns a copy whose labels are {@code labels} overlaid with {@code overrides}; keys in
     * {@code overrides} win.
     */
    public AlertRule withLabels(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(labels);
        merged.putAll(overrides);
        return new AlertRule(alert, expr, forDuration, merged, annotations);
    }

    public String unitLabel() {
        return labels.get(TopologyDefaults.UNIT_LABEL);
    }

    private static Map<String, String> ordered(Map<String, String> values) {
        return values == null || values.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
