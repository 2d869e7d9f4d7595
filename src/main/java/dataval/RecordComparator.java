package dataval;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Classifies the relationship of one file record to another.
 * <p>
 * The checks run in a fixed order and the first that applies wins. The result is not
 * symmetric: swapping the operands swaps {@code *_MISSING_SELF} and {@code *_MISSING_OTHER}.
 */
public class RecordComparator {

    private static final Logger logger = LoggerFactory.getLogger("dataval");

    public static MatchKind classify(FileRecord self, FileRecord other) {
        Boolean sameFile = sameFile(self, other);
        boolean notDifferentFile = sameFile != Boolean.FALSE;
        boolean notSameFile = sameFile != Boolean.TRUE;

        boolean selfHasChecksum = self.hasChecksum();
        boolean otherHasChecksum = other.hasChecksum();
        boolean bothChecksums = selfHasChecksum && otherHasChecksum;
        boolean sameAlgorithm = self.algorithm().equalsIgnoreCase(other.algorithm());
        boolean checksumsEqual = bothChecksums && sameAlgorithm && self.checksum().equalsIgnoreCase(other.checksum());
        boolean sizesEqual = Objects.equals(self.size(), other.size());
        boolean locationsEqual = Locations.sameLocation(self.location(), other.location());
        boolean sameLocation = locationsEqual || sameFile == Boolean.TRUE;
        boolean namesEqual = Objects.equals(lowerCase(self.name()), lowerCase(other.name()));
        boolean tagsEqual = Objects.equals(self.subgroupTag(), other.subgroupTag());

        if (self.equals(other)
                || (checksumsEqual && sizesEqual && sameLocation && notDifferentFile)
                || (sameFile == Boolean.TRUE && !selfHasChecksum && !otherHasChecksum && sizesEqual)) {
            return MatchKind.SELF;
        }
        if (sizesEqual && sameLocation && notDifferentFile) {
            if (!selfHasChecksum && otherHasChecksum) {
                return MatchKind.SELF_MISSING_SELF;
            }
            if (selfHasChecksum && !otherHasChecksum) {
                return MatchKind.SELF_MISSING_OTHER;
            }
            if (bothChecksums && !sameAlgorithm) {
                return MatchKind.SELF_CHECKSUM_TYPE_MISMATCH;
            }
        }
        if ((!sizesEqual || (bothChecksums && !checksumsEqual && sameAlgorithm)) && sameLocation && notDifferentFile) {
            return MatchKind.SELF_PREVIOUS_VERSION;
        }

        boolean copyCandidate = !locationsEqual && notSameFile && tagsEqual;
        if (copyCandidate && sizesEqual) {
            if (namesEqual) {
                if (!selfHasChecksum && !otherHasChecksum) {
                    return MatchKind.COPY_MISSING_BOTH;
                }
                if (selfHasChecksum && !otherHasChecksum) {
                    return MatchKind.COPY_MISSING_OTHER;
                }
                if (!selfHasChecksum) {
                    return MatchKind.COPY_MISSING_SELF;
                }
                if (!sameAlgorithm) {
                    return MatchKind.COPY_CHECKSUM_TYPE_MISMATCH;
                }
            } else if (!bothChecksums || !sameAlgorithm) {
                return MatchKind.POSSIBLE_COPY_RENAMED;
            }
            if (checksumsEqual) {
                return namesEqual ? MatchKind.VALID_COPY : MatchKind.VALID_COPY_RENAMED;
            }
        }
        if (copyCandidate && bothChecksums && sameAlgorithm && namesEqual) {
            if (!sizesEqual && !checksumsEqual) {
                return MatchKind.COPY_UNSYNCED_DATA;
            }
            if (!sizesEqual) {
                return MatchKind.COPY_UNSYNCED_CHECKSUM;
            }
            if (!checksumsEqual) {
                return MatchKind.COPY_UNSYNCED_OR_CORRUPT_DATA;
            }
        }
        if (bothChecksums && sameAlgorithm && !sizesEqual && !namesEqual && notSameFile) {
            return checksumsEqual ? MatchKind.CHECKSUM_COLLISION : MatchKind.UNRELATED;
        }
        if (!sameAlgorithm) {
            return MatchKind.UNKNOWN_CHECKSUM_TYPE_MISMATCH;
        }
        return MatchKind.UNKNOWN;
    }

    /**
     * @return null when it can't be determined, e.g. one of the files doesn't exist
     */
    static @Nullable Boolean sameFile(FileRecord a, FileRecord b) {
        Path pathA = a.path();
        Path pathB = b.path();
        if (pathA == null || pathB == null || !Files.exists(pathA) || !Files.exists(pathB)) {
            return null;
        }
        try {
            return Files.isSameFile(pathA, pathB);
        } catch (IOException e) {
            logger.debug("can't compare file identity of {} and {}", pathA, pathB, e);
            return null;
        }
    }

    private static @Nullable String lowerCase(@Nullable String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
