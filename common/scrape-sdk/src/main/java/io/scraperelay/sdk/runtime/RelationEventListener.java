package io.scraperelay.sdk.runtime;

/**
 * Receives relation notifications. Handlers run one at a time on the dispatcher thread and
 * may be called again with the same notification; implementations must be idempotent.
 */
public interface RelationEventListener {

  default void onJoined(RelationEvent event) {
  }

  default void onChanged(RelationEvent event) {
  }

  default void onDeparted(RelationEvent event) {
  }
}
