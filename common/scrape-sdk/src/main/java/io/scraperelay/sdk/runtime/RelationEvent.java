package io.scraperelay.sdk.runtime;

import io.scraperelay.sdk.ports.RelationView;
import java.util.Objects;
import java.util.Optional;

/**
 * A relation notification delivered by the dispatcher.
 *
 * @param departingUnit unit leaving the relation; only set for departures
 */
public record RelationEvent(String relationName, RelationView relation, String departingUnit) {

  public RelationEvent {
    Objects.requireNonNull(relationName, "relationName");
    Objects.requireNonNull(relation, "relation");
  }

  public static RelationEvent of(RelationView relation) {
    return new RelationEvent(relation.name(), relation, null);
  }

  public static RelationEvent departed(RelationView relation, String unit) {
    return new RelationEvent(relation.name(), relation, Objects.requireNonNull(unit, "unit"));
  }

  public Optional<String> departing() {
    return Optional.ofNullable(departingUnit);
  }
}
