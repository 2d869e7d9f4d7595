package dataval;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * How one file record relates to another.
 */
public enum MatchKind {
    SELF,
    SELF_MISSING_SELF,
    SELF_MISSING_OTHER,
    SELF_CHECKSUM_TYPE_MISMATCH,
    SELF_PREVIOUS_VERSION,
    POSSIBLE_COPY_RENAMED,
    COPY_MISSING_BOTH,
    COPY_MISSING_SELF,
    COPY_MISSING_OTHER,
    COPY_CHECKSUM_TYPE_MISMATCH,
    COPY_UNSYNCED_CHECKSUM,
    COPY_UNSYNCED_DATA,
    COPY_UNSYNCED_OR_CORRUPT_DATA,
    VALID_COPY,
    VALID_COPY_RENAMED,
    CHECKSUM_COLLISION,
    UNRELATED,
    UNKNOWN,
    UNKNOWN_CHECKSUM_TYPE_MISMATCH;

    public static final Set<MatchKind> SELF_SET = Collections.unmodifiableSet(EnumSet.of(
            SELF, SELF_MISSING_SELF, SELF_MISSING_OTHER, SELF_CHECKSUM_TYPE_MISMATCH));

    public static final Set<MatchKind> VALID_SET = Collections.unmodifiableSet(EnumSet.of(
            VALID_COPY, VALID_COPY_RENAMED));

    public static final Set<MatchKind> UNCONFIRMED_SET = Collections.unmodifiableSet(EnumSet.of(
            COPY_MISSING_BOTH, COPY_MISSING_SELF, COPY_MISSING_OTHER, COPY_CHECKSUM_TYPE_MISMATCH, POSSIBLE_COPY_RENAMED));

    public static final Set<MatchKind> INVALID_SET = Collections.unmodifiableSet(EnumSet.of(
            COPY_UNSYNCED_CHECKSUM, COPY_UNSYNCED_OR_CORRUPT_DATA, COPY_UNSYNCED_DATA));

    public static final Set<MatchKind> IGNORED_SET = Collections.unmodifiableSet(EnumSet.of(
            UNRELATED, UNKNOWN, UNKNOWN_CHECKSUM_TYPE_MISMATCH, CHECKSUM_COLLISION, SELF_PREVIOUS_VERSION));

    public boolean isSelf() {
        return SELF_SET.contains(this);
    }

    public boolean isValidCopy() {
        return VALID_SET.contains(this);
    }

    public boolean isUnconfirmedCopy() {
        return UNCONFIRMED_SET.contains(this);
    }

    public boolean isInvalidCopy() {
        return INVALID_SET.contains(this);
    }

    public boolean isIgnored() {
        return IGNORED_SET.contains(this);
    }
}
