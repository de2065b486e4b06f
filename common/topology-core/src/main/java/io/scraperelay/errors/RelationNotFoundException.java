package io.scraperelay.errors;

public class RelationNotFoundException extends ConfigMismatchException {

  public RelationNotFoundException(String relationName) {
    super(relationName, "No relation named '" + relationName + "' found");
  }
}
