package io.scraperelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.scraperelay.topology.TopologyDefaults;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One Prometheus static target group: a list of {@code host:port} targets sharing a label set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StaticConfig(List<String> targets, Map<String, String> labels) {
    public StaticConfig {
        targets = targets == null ? List.of() : List.copyOf(targets);
        labels = labels == null || labels.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public static StaticConfig of(String... targets) {
        return new StaticConfig(List.of(targets), null);
    }

    /** Value of the {@code juju_unit} label, or {@code null} for peer-level groups. */
    public String unitLabel() {
        return labels.get(TopologyDefaults.UNIT_LABEL);
    }
}
