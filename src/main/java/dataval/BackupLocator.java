package dataval;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Knows where a session file is expected to live on each tier. Existence is not checked.
 */
public interface BackupLocator {

    Optional<String> locate(FileRecord record, Tier tier);

    /**
     * @return the tier at whose expected path the record itself sits, or null
     */
    default @Nullable Tier tierOf(FileRecord record) {
        for (Tier tier : Tier.values()) {
            Optional<String> expected = locate(record, tier);
            if (expected.isPresent() && Locations.sameLocation(expected.get(), record.location())) {
                return tier;
            }
        }
        return null;
    }
}
