package io.scraperelay.sdk.ports;

import io.scraperelay.topology.Topology;
import java.util.Objects;

/**
 * Identity of the local unit.
 *
 * @param charmName   may be {@code null}
 * @param bindAddress address the unit publishes for its metrics endpoint; may be {@code null}
 */
public record UnitContext(
    String model,
    String modelUuid,
    String application,
    String unit,
    String charmName,
    boolean leader,
    String bindAddress) {

  public UnitContext {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(modelUuid, "modelUuid");
    Objects.requireNonNull(application, "application");
    Objects.requireNonNull(unit, "unit");
  }

  public Topology topology() {
    return Topology.forProvider(model, modelUuid, application, unit, charmName);
  }

  public UnitContext withLeader(boolean isLeader) {
    return new UnitContext(model, modelUuid, application, unit, charmName, isLeader, bindAddress);
  }
}
