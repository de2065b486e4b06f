package io.scraperelay.sdk.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lifecycle of each peer application as observed through notifications. Kept for
 * diagnostics only; merge decisions are always taken from relation data.
 */
public final class PeerStateTracker {

  public enum PeerState {
    ABSENT,
    JOINED,
    ACTIVE,
    DEPARTED
  }

  private final Map<String, PeerState> states = new ConcurrentHashMap<>();

  void joined(String relationName, int relationId) {
    states.put(key(relationName, relationId), PeerState.JOINED);
  }

  void changed(String relationName, int relationId) {
    states.put(key(relationName, relationId), PeerState.ACTIVE);
  }

  void departed(String relationName, int relationId, boolean lastUnit) {
    if (lastUnit) {
      states.put(key(relationName, relationId), PeerState.DEPARTED);
    }
  }

  public PeerState state(String relationName, int relationId) {
    return states.getOrDefault(key(relationName, relationId), PeerState.ABSENT);
  }

  private static String key(String relationName, int relationId) {
    return relationName + ":" + relationId;
  }
}
