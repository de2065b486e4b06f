package io.scraperelay.sdk.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import io.scraperelay.model.RelationDataKeys;
import io.scraperelay.sdk.ports.UnitContext;
import io.scraperelay.sdk.ports.UnitContextPort;
import io.scraperelay.sdk.runtime.InMemoryRelationData.FakeRelation;
import io.scraperelay.topology.RelationRole;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PrometheusRulesProviderTest {

  private static final UnitContext LEADER =
      new UnitContext("lma", "2d8bcb5c-2a5b", "rules", "rules/0", null, true, null);

  @TempDir
  Path baseDir;

  private final InMemoryRelationData data =
      new InMemoryRelationData().declare("metrics-endpoint", RelationRole.PROVIDES);

  @Test
  void forwardsRulesUnlabelledWithSortedKeys() throws IOException {
    Path rules = Files.createDirectories(baseDir.resolve("rules"));
    Files.writeString(rules.resolve("global.rules"),
        "groups:\n  - name: global\n    rules:\n      - expr: up < 1\n        alert: AnyDown\n");
    FakeRelation relation = data.relate("metrics-endpoint", "prometheus");
    PrometheusRulesProvider provider = new PrometheusRulesProvider(
        data, UnitContextPort.fixed(LEADER), "metrics-endpoint", baseDir, "rules", true);

    provider.onJoined(RelationEvent.of(relation));

    assertThat(relation.localApplicationData().get(RelationDataKeys.ALERT_RULES)).isEqualTo(
        "{\"groups\":[{\"name\":\"global_alerts\",\"rules\":[{\"alert\":\"AnyDown\",\"expr\":\"up < 1\",\"labels\":{}}]}]}");
  }

  @Test
  void followerDoesNotWrite() {
    FakeRelation relation = data.relate("metrics-endpoint", "prometheus");
    PrometheusRulesProvider provider = new PrometheusRulesProvider(
        data, UnitContextPort.fixed(LEADER.withLeader(false)), "metrics-endpoint", baseDir, "missing", true);

    provider.publish();

    assertThat(relation.localApplicationData()).isEmpty();
  }
}
