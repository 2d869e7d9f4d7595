package dataval;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable description of one file: where it is, how large it is and, once known,
 * its checksum. The algorithm is always set, even before the checksum is computed.
 * <p>
 * Two records are equal when checksum, size and location (ignoring case) are equal.
 */
public record FileRecord(@Nullable String location,
                         @Nullable Long size,
                         @Nullable String checksum,
                         String algorithm,
                         @Nullable Session session,
                         @Nullable String subgroupTag) {

    public FileRecord {
        if (location == null && checksum == null) {
            throw new IllegalArgumentException("a file record needs a location or a checksum");
        }
        Objects.requireNonNull(algorithm, "algorithm");
        if (location != null) {
            location = Locations.normalize(location);
        }
    }

    /**
     * Derives session and subgroup tag from the location. No format validation, see
     * {@link FileRecordFactory} for that.
     */
    public static FileRecord of(@Nullable String location, @Nullable Long size, @Nullable String checksum, String algorithm) {
        Session session = location == null ? null : Session.find(location);
        String tag = location == null ? null : Locations.subgroupTag(location);
        return new FileRecord(location, size, checksum, algorithm, session, tag);
    }

    public @Nullable String name() {
        return location == null ? null : Locations.name(location);
    }

    public @Nullable Path path() {
        return location == null ? null : Path.of(location);
    }

    public boolean hasChecksum() {
        return checksum != null;
    }

    public boolean isOrphan() {
        return session == null;
    }

    public @Nullable String sessionRelativePath() {
        if (location == null || session == null) {
            return null;
        }
        return Locations.sessionRelativePath(location, session);
    }

    public FileRecord withChecksum(String checksum, String algorithm) {
        return new FileRecord(location, size, checksum, algorithm, session, subgroupTag);
    }

    public FileRecord withSize(long size) {
        return new FileRecord(location, size, checksum, algorithm, session, subgroupTag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FileRecord other)) {
            return false;
        }
        return Objects.equals(lowerCase(checksum), lowerCase(other.checksum))
                && Objects.equals(size, other.size)
                && Objects.equals(lowerCase(location), lowerCase(other.location));
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerCase(checksum), size, lowerCase(location));
    }

    private static @Nullable String lowerCase(@Nullable String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
