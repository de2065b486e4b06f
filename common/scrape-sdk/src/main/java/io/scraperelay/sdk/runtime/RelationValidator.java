package io.scraperelay.sdk.runtime;

import io.scraperelay.errors.RelationInterfaceMismatchException;
import io.scraperelay.errors.RelationNotFoundException;
import io.scraperelay.errors.RelationRoleMismatchException;
import io.scraperelay.sdk.ports.RelationDataPort;
import io.scraperelay.sdk.ports.RelationMetadata;
import io.scraperelay.topology.RelationRole;
import java.util.Objects;

final class RelationValidator {

  private RelationValidator() {
  }

  /**
   * Checks that {@code relationName} is declared with {@code expectedInterface} and
   * {@code expectedRole}.
   *
   * @throws RelationNotFoundException          when the endpoint is not declared
   * @throws RelationInterfaceMismatchException when it uses another interface
   * @throws RelationRoleMismatchException      when it is declared with the opposite role
   */
  static RelationMetadata validate(RelationDataPort relations, String relationName,
      String expectedInterface, RelationRole expectedRole) {
    Objects.requireNonNull(relations, "relations");
    Objects.requireNonNull(relationName, "relationName");
    RelationMetadata metadata = relations.metadata(relationName)
        .orElseThrow(() -> new RelationNotFoundException(relationName));
    if (!expectedInterface.equals(metadata.interfaceName())) {
      throw new RelationInterfaceMismatchException(relationName, expectedInterface,
          metadata.interfaceName());
    }
    if (metadata.role() != expectedRole) {
      throw new RelationRoleMismatchException(relationName, expectedRole, metadata.role());
    }
    return metadata;
  }
}
