package io.scraperelay.topology;

/**
 * Label-set variants derived from a {@link Topology}.
 */
public enum LabelScope {

  /** Every present field, unit included. */
  FULL,

  /**
   * Scope used when stamping alert rules: the unit is dropped so alerts fire per
   * application rather than per unit.
   */
  RULE,

  /**
   * Aggregator variant. The model uuid is truncated to
   * {@link TopologyDefaults#SHORT_MODEL_UUID_LENGTH} characters, which makes it a weaker
   * identity than {@link #FULL}.
   */
  AGGREGATOR
}
