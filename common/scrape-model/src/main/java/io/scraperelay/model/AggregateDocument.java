package io.scraperelay.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merged scrape jobs and alert rule groups published towards the monitoring side.
 * <p>
 * Fragments are keyed by name. Replacing a fragment keeps its position, so folding the
 * same fragment in again leaves the encoded document byte-for-byte unchanged. Instances
 * are not thread-safe; each notification handler works on its own copy.
 */
public final class AggregateDocument {

    private final Map<String, ScrapeJob> jobs = new LinkedHashMap<>();
    private final Map<String, AlertRuleGroup> ruleGroups = new LinkedHashMap<>();

    public static AggregateDocument empty() {
        return new AggregateDocument();
    }

    public static AggregateDocument of(List<ScrapeJob> jobs, AlertRuleSet rules) {
        AggregateDocument document = new AggregateDocument();
        if (jobs != null) {
            jobs.forEach(document::upsertJob);
        }
        if (rules != null) {
            rules.groups().forEach(document::upsertRuleGroup);
        }
        return document;
    }

    /**
     * Rebuilds a document from the {@code scrape_jobs} and {@code alert_rules} values
     * previously published by {@link #encodeJobs()} and {@link #encodeRules()}.
     */
    public static AggregateDocument decode(String scrapeJobs, String alertRules) {
        return of(RelationJson.readJobs(scrapeJobs), RelationJson.readRuleSet(alertRules));
    }

    /**
     * Adds {@code job} or replaces the job of the same name in place.
     *
     * @return whether the document changed
     */
    public boolean upsertJob(ScrapeJob job) {
        Objects.requireNonNull(job, "job");
        return !job.equals(jobs.put(requireName(job.jobName(), "job_name"), job));
    }

    /**
     * Adds {@code group} or replaces the group of the same name in place.
     *
     * @return whether the document changed
     */
    public boolean upsertRuleGroup(AlertRuleGroup group) {
        Objects.requireNonNull(group, "group");
        return !group.equals(ruleGroups.put(requireName(group.name(), "group name"), group));
    }

    /**
     * Drops the static target groups labelled with {@code unit} from the named job. The job
     * itself is removed once no group is left.
     *
     * @return whether the document changed
     */
    public boolean removeUnitFromJob(String jobName, String unit) {
        ScrapeJob job = jobs.get(jobName);
        if (job == null) {
            return false;
        }
        List<StaticConfig> kept = new ArrayList<>();
        for (StaticConfig config : job.staticConfigsOrEmpty()) {
            if (!Objects.equals(config.unitLabel(), unit)) {
                kept.add(config);
            }
        }
        if (kept.size() == job.staticConfigsOrEmpty().size()) {
            return false;
        }
        if (kept.isEmpty()) {
            jobs.remove(jobName);
        } else {
            jobs.put(jobName, job.withStaticConfigs(kept));
        }
        return true;
    }

    /**
     * Drops the rules labelled with {@code unit} from the named group. The group itself is
     * removed once no rule is left.
     *
     * @return whether the document changed
     */
    public boolean removeUnitFromRuleGroup(String groupName, String unit) {
        AlertRuleGroup group = ruleGroups.get(groupName);
        if (group == null) {
            return false;
        }
        List<AlertRule> kept = new ArrayList<>();
        for (AlertRule rule : group.rules()) {
            if (!Objects.equals(rule.unitLabel(), unit)) {
                kept.add(rule);
            }
        }
        if (kept.size() == group.rules().size()) {
            return false;
        }
        if (kept.isEmpty()) {
            ruleGroups.remove(groupName);
        } else {
            ruleGroups.put(groupName, group.withRules(kept));
        }
        return true;
    }

    public Optional<ScrapeJob> job(String jobName) {
        return Optional.ofNullable(jobs.get(jobName));
    }

    public Optional<AlertRuleGroup> ruleGroup(String groupName) {
        return Optional.ofNullable(ruleGroups.get(groupName));
    }

    public List<ScrapeJob> jobs() {
        return List.copyOf(jobs.values());
    }

    public AlertRuleSet ruleSet() {
        return new AlertRuleSet(List.copyOf(ruleGroups.values()));
    }

    public boolean isEmpty() {
        return jobs.isEmpty() && ruleGroups.isEmpty();
    }

    public String encodeJobs() {
        return RelationJson.writeJobs(jobs());
    }

    /** Encodes the rule groups, or {@code {}} when there are none. */
    public String encodeRules() {
        return RelationJson.writeRuleSet(ruleSet());
    }

    public AggregateDocument copy() {
        return of(jobs(), ruleSet());
    }

    private static String requireName(String name, String field) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateDocument other)) {
            return false;
        }
        return jobs.equals(other.jobs) && ruleGroups.equals(other.ruleGroups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobs, ruleGroups);
    }

    @Override
    public String toString() {
        return "AggregateDocument{jobs=" + jobs.keySet() + ", ruleGroups=" + ruleGroups.keySet() + "}";
    }
}
