package io.scraperelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertRuleGroup(String name, String interval, List<AlertRule> rules) {
    public AlertRuleGroup {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public AlertRuleGroup(String name, List<AlertRule> rules) {
        this(name, null, rules);
    }

    public AlertRuleGroup withName(String groupName) {
        return new AlertRuleGroup(groupName, interval, rules);
    }

    public AlertRuleGroup withRules(List<AlertRule> groupRules) {
        return new AlertRuleGroup(name, interval, groupRules);
    }
}
