package io.scraperelay.sdk.ports;

import java.util.List;
import java.util.Optional;

/**
 * Port giving the runtime access to the relations of the local unit and to the metadata
 * that declares them.
 */
public interface RelationDataPort {

  /**
   * Currently established relations with the given endpoint name.
   *
   * @param relationName endpoint name as declared in the unit metadata
   * @return the relations, possibly empty, never {@code null}
   */
  List<RelationView> relations(String relationName);

  /**
   * Declaration of an endpoint, or empty when the unit metadata does not declare it.
   *
   * @param relationName endpoint name as declared in the unit metadata
   */
  Optional<RelationMetadata> metadata(String relationName);
}
