package io.scraperelay.sdk.ports;

/**
 * Supplies the current identity of the local unit. Read on every notification because
 * leadership and the bind address can change between notifications.
 */
public interface UnitContextPort {

  UnitContext current();

  static UnitContextPort fixed(UnitContext context) {
    return () -> context;
  }
}
