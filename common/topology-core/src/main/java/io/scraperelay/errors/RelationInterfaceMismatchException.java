package io.scraperelay.errors;

public class RelationInterfaceMismatchException extends ConfigMismatchException {

  private final String expectedInterface;
  private final String actualInterface;

  public RelationInterfaceMismatchException(String relationName, String expectedInterface,
      String actualInterface) {
    super(relationName, "The '" + relationName + "' relation has '" + actualInterface
        + "' as interface rather than the expected '" + expectedInterface + "'");
    this.expectedInterface = expectedInterface;
    this.actualInterface = actualInterface;
  }

  public String expectedInterface() {
    return expectedInterface;
  }

  public String actualInterface() {
    return actualInterface;
  }
}
