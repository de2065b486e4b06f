package io.scraperelay.sdk.ports;

import io.scraperelay.topology.RelationRole;
import java.util.Objects;

/**
 * Endpoint declaration: its name, interface and whether the unit provides or requires it.
 */
public record RelationMetadata(String name, String interfaceName, RelationRole role) {

  public RelationMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(interfaceName, "interfaceName");
    Objects.requireNonNull(role, "role");
  }
}
