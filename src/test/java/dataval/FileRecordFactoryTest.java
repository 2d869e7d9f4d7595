package dataval;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FileRecordFactoryTest {

    Path folder;

    @BeforeEach
    void setUp() throws IOException {
        folder = Files.createTempDirectory("dataval-factory");
    }

    @AfterEach
    void tearDown() throws IOException {
        Util.deleteFolderRecursively(folder);
    }

    @Test
    void smallFilesGetChecksumRightAway() throws IOException {
        FileRecordFactory factory = new FileRecordFactory(ChecksumRegistry.defaultRegistry(), new ChecksumPolicy(10, "crc32"));
        Path file = Files.writeString(folder.resolve("foo.txt"), "foo");
        FileRecord record = factory.fromPath(file);
        assertThat(record.size()).isEqualTo(3);
        assertThat(record.checksum()).isEqualTo("8C736521");
        assertThat(record.algorithm()).isEqualTo("crc32");
    }

    @Test
    void largeFilesWaitForExplicitChecksum() throws IOException {
        FileRecordFactory factory = new FileRecordFactory(ChecksumRegistry.defaultRegistry(), new ChecksumPolicy(3, "sha3_256"));
        Path file = Files.writeString(folder.resolve("foo.txt"), "foo");
        FileRecord record = factory.fromPath(file);
        assertThat(record.hasChecksum()).isFalse();
        assertThat(record.algorithm()).isEqualTo("sha3_256");

        FileRecord withChecksum = factory.withChecksum(record);
        assertThat(withChecksum.checksum()).isEqualTo("76d3bc41c9f588f7fcd0d5bf4718f8f84b1c41b20882703100b9eb9413807c01");
        assertThat(factory.withChecksum(record, "crc32").checksum()).isEqualTo("8C736521");
    }

    @Test
    void missingFile() {
        FileRecordFactory factory = new FileRecordFactory(ChecksumRegistry.defaultRegistry(), ChecksumPolicy.defaults());
        assertThatThrownBy(() -> factory.fromPath(folder.resolve("missing.txt"))).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void validatesAndNormalizesGivenChecksums() {
        FileRecordFactory factory = new FileRecordFactory(ChecksumRegistry.defaultRegistry(), ChecksumPolicy.defaults());
        assertThat(factory.create("/a/x.bin", 3L, "8c736521", "crc32").checksum()).isEqualTo("8C736521");
        assertThatThrownBy(() -> factory.create("/a/x.bin", 3L, "8c7365", "crc32"))
                .isInstanceOf(InvalidChecksumException.class);
        assertThatThrownBy(() -> factory.create("/a/x.bin", 3L, "8C736521", "sha3_256"))
                .isInstanceOf(InvalidChecksumException.class);
        assertThat(factory.create("/a/x.bin", 3L, null, "sha3_256").hasChecksum()).isFalse();
    }
}
