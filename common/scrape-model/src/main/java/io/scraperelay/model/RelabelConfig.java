package io.scraperelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelabelConfig(
    @JsonProperty("source_labels") List<String> sourceLabels,
    String separator,
    @JsonProperty("target_label") String targetLabel,
    String regex,
    Integer modulus,
    String replacement,
    String action) {

    public RelabelConfig {
        sourceLabels = sourceLabels == null ? null : List.copyOf(sourceLabels);
    }

    /**
     * Rule deriving the {@code instance} label from the given topology labels so that it
     * survives unit re-creation.
     */
    public static RelabelConfig instanceFrom(List<String> sourceLabels) {
        return new RelabelConfig(sourceLabels, "_", "instance", "(.*)", null, null, null);
    }
}
