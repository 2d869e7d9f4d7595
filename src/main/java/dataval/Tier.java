package dataval;

/**
 * Storage tiers in priority order: the first declared is the most trusted backup location.
 */
public enum Tier {
    ARCHIVE,
    STAGING,
    LOCAL,
    OTHER
}
