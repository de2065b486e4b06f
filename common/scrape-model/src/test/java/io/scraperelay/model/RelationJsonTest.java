package io.scraperelay.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scraperelay.errors.MalformedFragmentException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RelationJsonTest {

    @Test
    void decodesJobsDroppingUnknownFields() {
        String json = "[{\"job_name\":\"api\",\"honor_labels\":true,"
            + "\"static_configs\":[{\"targets\":[\"*:8080\"]}]}]";

        List<ScrapeJob> jobs = RelationJson.readJobs(json);

        assertThat(jobs).hasSize(1);
        assertThat(RelationJson.writeJobs(jobs)).doesNotContain("honor_labels");
        assertThat(jobs.get(0).staticConfigs().get(0).targets()).containsExactly("*:8080");
    }

    @Test
    void blankValuesDecodeToEmptyFragments() {
        assertThat(RelationJson.readJobs(null)).isEmpty();
        assertThat(RelationJson.readRuleSet("")).isEqualTo(AlertRuleSet.EMPTY);
        assertThat(RelationJson.readRuleSet("{}").isEmpty()).isTrue();
        assertThat(RelationJson.readMetadata(" ")).isEmpty();
    }

    @Test
    void malformedJsonIsReportedAsMalformedFragment() {
        assertThatThrownBy(() -> RelationJson.readJobs("[{"))
            .isInstanceOf(MalformedFragmentException.class)
            .hasMessageStartingWith("Failed to parse scrape_jobs");
    }

    @Test
    void alertRuleFieldsUsePrometheusNames() {
        AlertRule rule = new AlertRule("HighLatency", "latency > 1", "10m", Map.of("severity", "page"),
            Map.of("summary", "slow"));

        String json = RelationJson.write(new AlertRuleSet(List.of(new AlertRuleGroup("g", List.of(rule)))), "rules");

        assertThat(json).contains("\"for\":\"10m\"").contains("\"annotations\":{\"summary\":\"slow\"}");
    }

    @Test
    void sortedWriteIsIndependentOfInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 1);
        first.put("a", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", 2);
        second.put("b", 1);

        assertThat(RelationJson.writeSorted(first, "value")).isEqualTo(RelationJson.writeSorted(second, "value"));
    }

    @Test
    void metadataKeepsFieldOrder() {
        Map<String, String> metadata = RelationJson.readMetadata(
            "{\"model\":\"lma\",\"model_uuid\":\"abc\",\"application\":\"api\"}");

        assertThat(metadata.keySet()).containsExactly("model", "model_uuid", "application");
    }
}
