package dataval;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class BackupStatusEvaluatorTest {

    static final String SESSION = "1234567890_366122_20220618";

    Path root;
    Path local;
    Path staging;
    Path archive;
    InMemoryRecordStore store;
    ChecksumRegistry registry = ChecksumRegistry.defaultRegistry();
    TierRootsBackupLocator locator;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("dataval-status");
        local = Files.createDirectory(root.resolve("local"));
        staging = Files.createDirectory(root.resolve("staging"));
        archive = Files.createDirectory(root.resolve("archive"));
        store = new InMemoryRecordStore();
        locator = new TierRootsBackupLocator(Map.of(Tier.ARCHIVE, archive, Tier.STAGING, staging, Tier.LOCAL, local));
    }

    @AfterEach
    void tearDown() throws IOException {
        Util.deleteFolderRecursively(root);
    }

    BackupStatusEvaluator evaluator(long autoChecksumThreshold) {
        FileRecordFactory factory = new FileRecordFactory(registry, new ChecksumPolicy(autoChecksumThreshold, "crc32"));
        return new BackupStatusEvaluator(store, locator, factory);
    }

    static Path write(Path tierRoot, String name, String content) throws IOException {
        Path file = tierRoot.resolve(SESSION).resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    FileRecord stored(Path file) throws IOException {
        FileRecord record = FileRecord.of(Locations.normalize(file), Files.size(file), registry.compute("crc32", file), "crc32");
        store.add(record);
        return record;
    }

    @Test
    void noMatches() throws IOException {
        Path file = write(local, "a.dat", "content a");
        assertThat(evaluator(Long.MAX_VALUE).evaluate(file).status()).isEqualTo(BackupStatus.NO_MATCHES);
    }

    @Test
    void noCopiesInStore() throws IOException {
        Path file = write(local, "a.dat", "content a");
        stored(file);
        BackupEvaluation evaluation = evaluator(Long.MAX_VALUE).evaluate(file);
        assertThat(evaluation.status()).isEqualTo(BackupStatus.NO_COPIES_IN_STORE);
        assertThat(evaluation.isDeletable()).isFalse();
    }

    @Test
    void validOnArchive() throws IOException {
        Path file = write(local, "a.dat", "content a");
        stored(file);
        FileRecord copy = stored(write(archive, "a.dat", "content a"));

        BackupStatusEvaluator evaluator = evaluator(Long.MAX_VALUE);
        BackupEvaluation evaluation = evaluator.evaluate(file);
        assertThat(evaluation.status()).isEqualTo(BackupStatus.VALID_ON_ARCHIVE);
        assertThat(evaluation.bestBackup().tier()).isEqualTo(Tier.ARCHIVE);
        assertThat(evaluation.bestBackup().record()).isEqualTo(copy);
        assertThat(evaluation.bestBackup().kind()).isEqualTo(MatchKind.VALID_COPY);
        assertThat(evaluator.isDeletable(evaluation)).isTrue();
    }

    @Test
    void archiveIsPreferredOverStaging() throws IOException {
        Path file = write(local, "a.dat", "content a");
        stored(file);
        stored(write(staging, "a.dat", "content a"));
        stored(write(archive, "a.dat", "content a"));
        assertThat(evaluator(Long.MAX_VALUE).evaluate(file).status()).isEqualTo(BackupStatus.VALID_ON_ARCHIVE);
    }

    @Test
    void validCopyOnLowerTierWinsOverInvalidCopyOnHigherTier() throws IOException {
        Path file = write(local, "a.dat", "content a");
        stored(file);
        stored(write(staging, "a.dat", "content a"));
        stored(write(archive, "a.dat", "content b"));
        BackupEvaluation evaluation = evaluator(Long.MAX_VALUE).evaluate(file);
        assertThat(evaluation.status()).isEqualTo(BackupStatus.VALID_ON_STAGING);
        assertThat(evaluation.backups()).extracting(BackupEvaluation.Backup::kind)
                .containsExactly(MatchKind.COPY_UNSYNCED_OR_CORRUPT_DATA, MatchKind.VALID_COPY);
    }

    @Test
    void storedCopyMissingOnDiskDoesNotCount() throws IOException {
        Path file = write(local, "a.dat", "content a");
        stored(file);
        Path archived = write(archive, "a.dat", "content a");
        stored(archived);
        stored(write(staging, "a.dat", "content a"));
        Files.delete(archived);

        BackupStatusEvaluator evaluator = evaluator(Long.MAX_VALUE);
        assertThat(evaluator.evaluate(file).status()).isEqualTo(BackupStatus.VALID_ON_STAGING);

        Files.delete(staging.resolve(SESSION).resolve("a.dat"));
        assertThat(evaluator.evaluate(file).status()).isEqualTo(BackupStatus.NO_BACKUPS_IN_FILESYSTEM);
    }

    @Test
    void deletableOnlyWhileBackupExists() throws IOException {
        Path file = write(local, "a.dat", "content a");
        stored(file);
        Path archived = write(archive, "a.dat", "content a");
        stored(archived);
        BackupStatusEvaluator evaluator = evaluator(Long.MAX_VALUE);
        BackupEvaluation evaluation = evaluator.evaluate(file);
        assertThat(evaluator.isDeletable(evaluation)).isTrue();

        Files.delete(archived);
        assertThat(evaluator.isDeletable(evaluation)).isFalse();
    }

    @Test
    void unconfirmedUntilChecksumIsCompleted() throws IOException {
        Path file = write(local, "a.dat", "content a");
        stored(write(archive, "a.dat", "content a"));

        BackupStatusEvaluator evaluator = evaluator(0);
        BackupEvaluation evaluation = evaluator.evaluate(file);
        assertThat(evaluation.status()).isEqualTo(BackupStatus.UNCONFIRMED_ON_ARCHIVE);
        assertThat(evaluation.bestBackup().kind()).isEqualTo(MatchKind.COPY_MISSING_SELF);
        assertThat(evaluator.isDeletable(evaluation)).isFalse();

        BackupEvaluation completed = evaluator.ensureBackupChecksum(evaluation);
        assertThat(completed.status()).isEqualTo(BackupStatus.VALID_ON_ARCHIVE);
        assertThat(completed.subject().checksum()).isEqualTo(registry.compute("crc32", file));
        assertThat(evaluator.isDeletable(completed)).isTrue();
    }

    @Test
    void completingChecksumCanRevealUnsyncedCopy() throws IOException {
        Path file = write(local, "a.dat", "content a");
        write(archive, "a.dat", "content b");
        stored(file);
        // the archive copy itself has no checksum yet
        store.add(FileRecord.of(Locations.normalize(root.resolve("elsewhere").resolve(SESSION).resolve("a.dat")),
                Files.size(file), registry.compute("crc32", file), "crc32"));

        BackupStatusEvaluator evaluator = evaluator(0);
        BackupEvaluation evaluation = evaluator.evaluate(file);
        assertThat(evaluation.status()).isEqualTo(BackupStatus.UNCONFIRMED_ON_ARCHIVE);

        BackupEvaluation completed = evaluator.ensureBackupChecksum(evaluation);
        assertThat(completed.status()).isEqualTo(BackupStatus.POSSIBLE_UNSYNCED);
        assertThat(evaluator.isDeletable(completed)).isFalse();
    }

    @Test
    void noChecksumsAnywhere() throws IOException {
        Path file = write(local, "a.dat", "content a");
        write(archive, "a.dat", "content a");
        // a checksummed copy somewhere outside the tiers
        store.add(FileRecord.of(Locations.normalize(root.resolve("elsewhere").resolve(SESSION).resolve("a.dat")),
                Files.size(file), registry.compute("crc32", file), "crc32"));

        BackupEvaluation evaluation = evaluator(0).evaluate(file);
        assertThat(evaluation.status()).isEqualTo(BackupStatus.NO_CHECKSUMS);
    }

    @Test
    void fileOnArchiveIsNotBackedUpByLowerTiers() throws IOException {
        Path file = write(archive, "a.dat", "content a");
        stored(file);
        stored(write(staging, "a.dat", "content a"));
        assertThat(evaluator(Long.MAX_VALUE).evaluate(file).status()).isEqualTo(BackupStatus.NO_BACKUPS_IN_FILESYSTEM);
    }

    @Test
    void orphanFilesUseStoredCopiesOnTiers() throws IOException {
        Path orphan = Files.writeString(Files.createDirectories(root.resolve("misc")).resolve("a.dat"), "content a");
        FileRecord copy = stored(write(archive, "a.dat", "content a"));
        BackupEvaluation evaluation = evaluator(Long.MAX_VALUE).evaluate(orphan);
        assertThat(evaluation.status()).isEqualTo(BackupStatus.VALID_ON_ARCHIVE);
        assertThat(evaluation.bestBackup().record()).isEqualTo(copy);
    }

    @Test
    void conflictingSelfEntriesAreNotTrusted() throws IOException {
        Path file = write(local, "a.dat", "content a");
        Path link = Files.createLink(local.resolve(SESSION).resolve("b.dat"), file);
        store.add(FileRecord.of(Locations.normalize(file), Files.size(file), "00000001", "crc32"));
        store.add(FileRecord.of(Locations.normalize(link), Files.size(file), "00000002", "crc32"));

        BackupEvaluation evaluation = evaluator(0).evaluate(file);
        assertThat(evaluation.selves()).containsExactly(evaluation.subject());
    }
}
