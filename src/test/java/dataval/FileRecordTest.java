package dataval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FileRecordTest {

    @Test
    void needsLocationOrChecksum() {
        assertThatThrownBy(() -> FileRecord.of(null, 10L, null, "crc32"))
                .isInstanceOf(IllegalArgumentException.class);
        FileRecord checksumOnly = FileRecord.of(null, 10L, "8C736521", "crc32");
        assertThat(checksumOnly.name()).isNull();
        assertThat(checksumOnly.isOrphan()).isTrue();
    }

    @Test
    void equalityIgnoresCaseOfLocationAndChecksum() {
        FileRecord a = FileRecord.of("/Data/x.bin", 10L, "8c736521", "crc32");
        FileRecord b = FileRecord.of("\\data\\X.bin", 10L, "8C736521", "crc32");
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(FileRecord.of("/data/x.bin", 11L, "8C736521", "crc32"));
    }

    @Test
    void derivesSessionAndTag() {
        FileRecord record = FileRecord.of("/local/1234567890_366122_20220618/1234567890_366122_20220618_probeDEF/spikes.npy",
                100L, null, "sha3_256");
        assertThat(record.session().folder()).isEqualTo("1234567890_366122_20220618");
        assertThat(record.subgroupTag()).isEqualTo("DEF");
        assertThat(record.name()).isEqualTo("spikes.npy");
        assertThat(record.sessionRelativePath())
                .isEqualTo("1234567890_366122_20220618/1234567890_366122_20220618_probeDEF/spikes.npy");
        assertThat(record.hasChecksum()).isFalse();
    }

    @Test
    void withChecksumKeepsIdentity() {
        FileRecord record = FileRecord.of("/local/1234567890_366122_20220618/a.txt", 3L, null, "sha3_256");
        FileRecord withChecksum = record.withChecksum("8C736521", "crc32");
        assertThat(withChecksum.location()).isEqualTo(record.location());
        assertThat(withChecksum.session()).isEqualTo(record.session());
        assertThat(withChecksum.algorithm()).isEqualTo("crc32");
    }
}
