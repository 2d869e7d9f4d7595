package dataval;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dataval.RecordComparator.classify;
import static org.assertj.core.api.Assertions.assertThat;

public class RecordComparatorTest {

    static final String CRC32 = Crc32ChecksumProvider.NAME;
    static final String SHA3 = Sha3ChecksumProvider.NAME;

    static FileRecord record(String location, long size, String checksum) {
        return FileRecord.of(location, size, checksum, CRC32);
    }

    static FileRecord record(String location, long size, String checksum, String algorithm) {
        return FileRecord.of(location, size, checksum, algorithm);
    }

    final FileRecord subject = record("//tmp/tmp/test.txt", 10, "12345678");

    @Test
    void sameRecordIsSelf() {
        assertThat(classify(subject, record("//tmp/tmp/test.txt", 10, "12345678"))).isEqualTo(MatchKind.SELF);
    }

    @Test
    void locationIsComparedIgnoringCaseAndSeparator() {
        assertThat(classify(subject, record("\\\\tmp\\TMP\\Test.txt", 10, "12345678"))).isEqualTo(MatchKind.SELF);
    }

    @Test
    void copies() {
        assertThat(classify(subject, record("//tmp2/tmp/test.txt", 10, "12345678"))).isEqualTo(MatchKind.VALID_COPY);
        assertThat(classify(subject, record("//tmp2/tmp/test2.txt", 10, "12345678"))).isEqualTo(MatchKind.VALID_COPY_RENAMED);
        assertThat(classify(subject, record("//tmp2/tmp/test.txt", 20, "87654321"))).isEqualTo(MatchKind.COPY_UNSYNCED_DATA);
        assertThat(classify(subject, record("//tmp2/tmp/test.txt", 20, "12345678"))).isEqualTo(MatchKind.COPY_UNSYNCED_CHECKSUM);
        assertThat(classify(subject, record("//tmp2/tmp/test.txt", 10, "87654321"))).isEqualTo(MatchKind.COPY_UNSYNCED_OR_CORRUPT_DATA);
    }

    @Test
    void unrelatedFilesInSameFolder() {
        assertThat(classify(subject, record("//tmp/tmp/test2.txt", 20, "12345678"))).isEqualTo(MatchKind.CHECKSUM_COLLISION);
        assertThat(classify(subject, record("//tmp/tmp/test2.txt", 20, "87654321"))).isEqualTo(MatchKind.UNRELATED);
    }

    @Test
    void scenarios() {
        FileRecord original = record("/orig/x.bin", 100, "AA");
        assertThat(classify(original, record("/backup/x.bin", 100, "AA"))).isEqualTo(MatchKind.VALID_COPY);
        assertThat(classify(original, record("/backup/y.bin", 100, "AA"))).isEqualTo(MatchKind.VALID_COPY_RENAMED);
        assertThat(classify(original, record("/backup/x.bin", 100, "BB"))).isEqualTo(MatchKind.COPY_UNSYNCED_OR_CORRUPT_DATA);
        assertThat(classify(original, record("/backup/y.bin", 200, "AA"))).isEqualTo(MatchKind.CHECKSUM_COLLISION);
    }

    @Test
    void selfWithMissingChecksum() {
        FileRecord withoutChecksum = record("/data/x.bin", 100, null);
        FileRecord withChecksum = record("/data/x.bin", 100, "AA");
        assertThat(classify(withoutChecksum, withChecksum)).isEqualTo(MatchKind.SELF_MISSING_SELF);
        assertThat(classify(withChecksum, withoutChecksum)).isEqualTo(MatchKind.SELF_MISSING_OTHER);
    }

    @Test
    void selfWithOtherAlgorithm() {
        FileRecord crc = record("/data/x.bin", 100, "8C736521");
        FileRecord sha3 = record("/data/x.bin", 100, "76d3bc41c9f588f7fcd0d5bf4718f8f84b1c41b20882703100b9eb9413807c01", SHA3);
        assertThat(classify(crc, sha3)).isEqualTo(MatchKind.SELF_CHECKSUM_TYPE_MISMATCH);
    }

    @Test
    void previousVersion() {
        FileRecord current = record("/data/x.bin", 100, "AA");
        assertThat(classify(current, record("/data/x.bin", 50, "AA"))).isEqualTo(MatchKind.SELF_PREVIOUS_VERSION);
        assertThat(classify(current, record("/data/x.bin", 100, "BB"))).isEqualTo(MatchKind.SELF_PREVIOUS_VERSION);
    }

    @Test
    void copiesWithMissingChecksums() {
        assertThat(classify(record("/a/x.bin", 100, null), record("/b/x.bin", 100, null))).isEqualTo(MatchKind.COPY_MISSING_BOTH);
        assertThat(classify(record("/a/x.bin", 100, "AA"), record("/b/x.bin", 100, null))).isEqualTo(MatchKind.COPY_MISSING_OTHER);
        assertThat(classify(record("/a/x.bin", 100, null), record("/b/x.bin", 100, "AA"))).isEqualTo(MatchKind.COPY_MISSING_SELF);
        assertThat(classify(record("/a/x.bin", 100, "AA"), record("/b/x.bin", 100, "aa", SHA3)))
                .isEqualTo(MatchKind.COPY_CHECKSUM_TYPE_MISMATCH);
        assertThat(classify(record("/a/x.bin", 100, "AA"), record("/b/y.bin", 100, null))).isEqualTo(MatchKind.POSSIBLE_COPY_RENAMED);
    }

    @Test
    void differentProbesAreNotCopies() {
        FileRecord probeA = record("/a/1234567890_366122_20220618_probeA/continuous.dat", 100, "AA");
        FileRecord probeB = record("/b/1234567890_366122_20220618_probeB/continuous.dat", 100, "AA");
        FileRecord probeASorted = record("/b/1234567890_366122_20220618_probeA_sorted/continuous.dat", 100, "AA");
        assertThat(classify(probeA, probeB)).isEqualTo(MatchKind.UNKNOWN);
        assertThat(classify(probeA, probeASorted)).isEqualTo(MatchKind.VALID_COPY);
    }

    @Test
    void unknownWithDifferentAlgorithms() {
        FileRecord a = record("/a/x.bin", 100, "AA");
        FileRecord b = record("/b/y.bin", 200, "aa", SHA3);
        assertThat(classify(a, b)).isEqualTo(MatchKind.UNKNOWN_CHECKSUM_TYPE_MISMATCH);
    }

    @Test
    void classificationIsDeterministic() {
        FileRecord a = record("/orig/x.bin", 100, "AA");
        FileRecord b = record("/backup/x.bin", 100, "AA");
        MatchKind first = classify(a, b);
        for (int i = 0; i < 10; i++) {
            assertThat(classify(a, b)).isEqualTo(first);
        }
    }

    @Test
    void swappingOperandsOnlySwapsMissingSelfAndOther() {
        Map<MatchKind, MatchKind> swapped = Map.of(
                MatchKind.SELF_MISSING_SELF, MatchKind.SELF_MISSING_OTHER,
                MatchKind.SELF_MISSING_OTHER, MatchKind.SELF_MISSING_SELF,
                MatchKind.COPY_MISSING_SELF, MatchKind.COPY_MISSING_OTHER,
                MatchKind.COPY_MISSING_OTHER, MatchKind.COPY_MISSING_SELF);
        List<FileRecord> records = List.of(
                record("/a/x.bin", 100, "AA"),
                record("/a/x.bin", 100, null),
                record("/a/x.bin", 50, "AA"),
                record("/a/x.bin", 100, "aa", SHA3),
                record("/b/x.bin", 100, "AA"),
                record("/b/x.bin", 100, "BB"),
                record("/b/x.bin", 100, null),
                record("/b/x.bin", 200, "BB"),
                record("/b/y.bin", 100, "AA"),
                record("/b/y.bin", 200, "AA"),
                record("/b/y.bin", 200, "CC"),
                record("/b/y.bin", 100, null));
        for (FileRecord a : records) {
            for (FileRecord b : records) {
                MatchKind ab = classify(a, b);
                MatchKind ba = classify(b, a);
                assertThat(ba).as("%s vs %s", a, b).isEqualTo(swapped.getOrDefault(ab, ab));
            }
        }
    }

    @Test
    void matchKindSetsAreDisjointAndComplete() {
        List<Set<MatchKind>> sets = List.of(MatchKind.SELF_SET, MatchKind.VALID_SET, MatchKind.UNCONFIRMED_SET,
                MatchKind.INVALID_SET, MatchKind.IGNORED_SET);
        Set<MatchKind> all = EnumSet.noneOf(MatchKind.class);
        int total = 0;
        for (Set<MatchKind> set : sets) {
            all.addAll(set);
            total += set.size();
        }
        assertThat(total).isEqualTo(all.size());
        assertThat(all).containsExactlyInAnyOrder(MatchKind.values());
    }
}
