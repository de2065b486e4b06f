package io.scraperelay.model;

import io.scraperelay.errors.TargetFormatException;

/**
 * A {@code host:port} scrape target. A host of {@code *} stands for every unit of the
 * publishing application.
 */
public record ScrapeTarget(String host, String port) {

    public static final String WILDCARD_HOST = "*";

    /**
     * @throws TargetFormatException when {@code target} does not contain exactly one {@code :}
     */
    public static ScrapeTarget parse(String target) {
        if (target == null) {
            throw new TargetFormatException(String.valueOf(target));
        }
        int separator = target.indexOf(':');
        if (separator < 0 || separator != target.lastIndexOf(':')) {
            throw new TargetFormatException(target);
        }
        return new ScrapeTarget(target.substring(0, separator).trim(), target.substring(separator + 1).trim());
    }

    public boolean isWildcard() {
        return WILDCARD_HOST.equals(host);
    }
}
