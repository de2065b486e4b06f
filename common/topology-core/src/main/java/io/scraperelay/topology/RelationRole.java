package io.scraperelay.topology;

/**
 * Direction of a relation endpoint as declared in the unit's metadata.
 */
public enum RelationRole {
  PROVIDES("provides"),
  REQUIRES("requires");

  private final String metadataName;

  RelationRole(String metadataName) {
    this.metadataName = metadataName;
  }

  public String metadataName() {
    return metadataName;
  }
}
