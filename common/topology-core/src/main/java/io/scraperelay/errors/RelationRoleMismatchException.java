package io.scraperelay.errors;

import io.scraperelay.topology.RelationRole;

public class RelationRoleMismatchException extends ConfigMismatchException {

  private final RelationRole expectedRole;
  private final RelationRole actualRole;

  public RelationRoleMismatchException(String relationName, RelationRole expectedRole,
      RelationRole actualRole) {
    super(relationName, "The '" + relationName + "' relation has role '" + actualRole.metadataName()
        + "' rather than the expected '" + expectedRole.metadataName() + "'");
    this.expectedRole = expectedRole;
    this.actualRole = actualRole;
  }

  public RelationRole expectedRole() {
    return expectedRole;
  }

  public RelationRole actualRole() {
    return actualRole;
  }
}
