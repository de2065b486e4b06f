package io.scraperelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Standard Prometheus rule file: {@code {"groups": [...]}}. An empty set is written as
 * {@code {}} so that "no rules" can be told apart from "rules present".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlertRuleSet(@JsonInclude(JsonInclude.Include.NON_EMPTY) List<AlertRuleGroup> groups) {

    public static final AlertRuleSet EMPTY = new AlertRuleSet(List.of());

    public AlertRuleSet {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
