package io.scraperelay.sdk.ports;

import java.util.List;
import java.util.Optional;

/**
 * One established relation as seen from the local unit. Remote data is read-only; writes
 * go to the local application bag (leader only) or the local unit bag.
 */
public interface RelationView {

  int id();

  String name();

  /** Remote application name; empty while the relation is being torn down. */
  Optional<String> remoteApplication();

  /** Names of the remote units currently in the relation, in a stable order. */
  List<String> remoteUnits();

  Optional<String> remoteApplicationValue(String key);

  Optional<String> remoteUnitValue(String unit, String key);

  Optional<String> localApplicationValue(String key);

  void setLocalApplicationValue(String key, String value);

  void setLocalUnitValue(String key, String value);
}
