package dataval;

import org.jetbrains.annotations.Nullable;

public enum BackupStatus {
    VALID_ON_ARCHIVE(Tier.ARCHIVE, true),
    VALID_ON_STAGING(Tier.STAGING, true),
    VALID_ON_LOCAL(Tier.LOCAL, true),
    VALID_ON_OTHER(Tier.OTHER, true),
    UNCONFIRMED_ON_ARCHIVE(Tier.ARCHIVE, false),
    UNCONFIRMED_ON_STAGING(Tier.STAGING, false),
    UNCONFIRMED_ON_LOCAL(Tier.LOCAL, false),
    UNCONFIRMED_ON_OTHER(Tier.OTHER, false),
    POSSIBLE_UNSYNCED(null, false),
    NO_MATCHES(null, false),
    NO_COPIES_IN_STORE(null, false),
    NO_BACKUPS_IN_FILESYSTEM(null, false),
    NO_CHECKSUMS(null, false);

    private final @Nullable Tier tier;
    private final boolean valid;

    BackupStatus(@Nullable Tier tier, boolean valid) {
        this.tier = tier;
        this.valid = valid;
    }

    public @Nullable Tier tier() {
        return tier;
    }

    public boolean isDeletable() {
        return valid;
    }

    public boolean isUnconfirmed() {
        return tier != null && !valid;
    }

    public static BackupStatus validOn(Tier tier) {
        return switch (tier) {
            case ARCHIVE -> VALID_ON_ARCHIVE;
            case STAGING -> VALID_ON_STAGING;
            case LOCAL -> VALID_ON_LOCAL;
            case OTHER -> VALID_ON_OTHER;
        };
    }

    public static BackupStatus unconfirmedOn(Tier tier) {
        return switch (tier) {
            case ARCHIVE -> UNCONFIRMED_ON_ARCHIVE;
            case STAGING -> UNCONFIRMED_ON_STAGING;
            case LOCAL -> UNCONFIRMED_ON_LOCAL;
            case OTHER -> UNCONFIRMED_ON_OTHER;
        };
    }
}
