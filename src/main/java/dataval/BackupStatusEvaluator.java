package dataval;

import dataval.BackupEvaluation.Backup;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a file is safely backed up, looking at the tiers in priority order.
 * Nothing is cached: every call looks at the store and the filesystem again.
 */
public class BackupStatusEvaluator {

    private final Logger logger = LoggerFactory.getLogger("dataval");

    private final RecordStore store;
    private final BackupLocator locator;
    private final FileRecordFactory factory;

    public BackupStatusEvaluator(RecordStore store, BackupLocator locator, FileRecordFactory factory) {
        this.store = store;
        this.locator = locator;
        this.factory = factory;
    }

    public BackupEvaluation evaluate(Path path) throws IOException {
        return evaluate(factory.fromPath(path));
    }

    public BackupEvaluation evaluate(FileRecord subject) throws IOException {
        List<FileRecord> matches = new ArrayList<>();
        for (FileRecord match : store.getMatches(subject)) {
            if (!RecordComparator.classify(subject, match).isIgnored()) {
                matches.add(match);
            }
        }
        List<FileRecord> selves = resolveSelves(subject, matches);

        if (matches.isEmpty()) {
            return new BackupEvaluation(subject, BackupStatus.NO_MATCHES, matches, selves, List.of(), null);
        }
        if (!hasCopies(selves, matches)) {
            return new BackupEvaluation(subject, BackupStatus.NO_COPIES_IN_STORE, matches, selves, List.of(), null);
        }

        List<Backup> backups = findBackups(subject, matches, selves);
        if (backups.isEmpty()) {
            return new BackupEvaluation(subject, BackupStatus.NO_BACKUPS_IN_FILESYSTEM, matches, selves, backups, null);
        }

        for (Backup backup : backups) {
            if (backup.kind().isValidCopy()) {
                return new BackupEvaluation(subject, BackupStatus.validOn(backup.tier()), matches, selves, backups, backup);
            }
        }
        boolean anyChecksum = selves.stream().anyMatch(FileRecord::hasChecksum)
                || backups.stream().anyMatch(backup -> backup.record().hasChecksum());
        if (!anyChecksum) {
            return new BackupEvaluation(subject, BackupStatus.NO_CHECKSUMS, matches, selves, backups, null);
        }
        for (Backup backup : backups) {
            if (backup.kind().isUnconfirmedCopy()) {
                return new BackupEvaluation(subject, BackupStatus.unconfirmedOn(backup.tier()), matches, selves, backups, backup);
            }
        }
        for (Backup backup : backups) {
            if (backup.kind().isInvalidCopy()) {
                return new BackupEvaluation(subject, BackupStatus.POSSIBLE_UNSYNCED, matches, selves, backups, backup);
            }
        }
        return new BackupEvaluation(subject, BackupStatus.NO_BACKUPS_IN_FILESYSTEM, matches, selves, backups, null);
    }

    /**
     * Store entries describing the subject itself. Entries that disagree with each other
     * about the checksum of one algorithm are not trusted and left out.
     */
    private List<FileRecord> resolveSelves(FileRecord subject, List<FileRecord> matches) {
        Map<String, List<FileRecord>> byAlgorithm = new LinkedHashMap<>();
        for (FileRecord match : matches) {
            if (RecordComparator.classify(subject, match).isSelf() && !match.equals(subject)) {
                byAlgorithm.computeIfAbsent(match.algorithm(), a -> new ArrayList<>()).add(match);
            }
        }
        List<FileRecord> selves = new ArrayList<>();
        selves.add(subject);
        byAlgorithm.forEach((algorithm, candidates) -> {
            Set<String> checksums = new LinkedHashSet<>();
            candidates.stream()
                    .filter(FileRecord::hasChecksum)
                    .forEach(candidate -> checksums.add(candidate.checksum().toLowerCase(Locale.ROOT)));
            if (checksums.size() > 1) {
                logger.warn("multiple {} entries for {} with different checksums {} ... could not determine which describes the file",
                        algorithm, subject.location(), checksums);
                return;
            }
            selves.addAll(candidates);
        });
        return selves;
    }

    private static boolean hasCopies(List<FileRecord> selves, List<FileRecord> matches) {
        for (FileRecord self : selves) {
            for (FileRecord match : matches) {
                MatchKind kind = RecordComparator.classify(self, match);
                if (kind.isValidCopy() || kind.isUnconfirmedCopy()) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<Backup> findBackups(FileRecord subject, List<FileRecord> matches, List<FileRecord> selves) throws IOException {
        List<Backup> backups = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            List<FileRecord> candidates = new ArrayList<>();
            if (subject.isOrphan()) {
                for (FileRecord match : matches) {
                    if (locator.tierOf(match) == tier) {
                        candidates.add(match);
                    }
                }
            } else {
                Optional<String> expected = locator.locate(subject, tier);
                if (expected.isEmpty()) {
                    continue;
                }
                if (Locations.sameLocation(expected.get(), subject.location())) {
                    // the subject is the copy on this tier, lower tiers don't back it up
                    break;
                }
                for (FileRecord match : matches) {
                    if (Locations.sameLocation(expected.get(), match.location())) {
                        candidates.add(match);
                    }
                }
                if (candidates.isEmpty()) {
                    FileRecord onDisk = readFromDisk(expected.get(), subject.algorithm());
                    if (onDisk != null) {
                        candidates.add(onDisk);
                    }
                }
            }
            for (FileRecord candidate : candidates) {
                Path path = candidate.path();
                if (path == null || !Files.exists(path)) {
                    logger.debug("backup {} is known but doesn't exist on disk", candidate.location());
                    continue;
                }
                if (RecordComparator.classify(subject, candidate).isSelf()) {
                    continue;
                }
                backups.add(new Backup(tier, candidate, bestKind(selves, candidate)));
            }
        }
        return backups;
    }

    private @Nullable FileRecord readFromDisk(String location, String algorithm) throws IOException {
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            return null;
        }
        try {
            return factory.fromPath(path, algorithm);
        } catch (NoSuchFileException e) {
            logger.debug("backup {} disappeared", location);
            return null;
        }
    }

    static MatchKind bestKind(List<FileRecord> selves, FileRecord backup) {
        MatchKind best = null;
        for (FileRecord self : selves) {
            MatchKind kind = RecordComparator.classify(self, backup);
            if (best == null || weight(kind) > weight(best)) {
                best = kind;
            }
        }
        return best;
    }

    // a mismatch against any self outweighs a comparison that lacked a checksum
    private static int weight(MatchKind kind) {
        if (kind.isValidCopy()) {
            return 3;
        }
        if (kind.isInvalidCopy()) {
            return 2;
        }
        if (kind.isUnconfirmedCopy()) {
            return 1;
        }
        return 0;
    }

    /**
     * Verifies at this moment that the evaluation still allows deleting the subject: the
     * chosen backup classifies as a valid copy, its checksum agrees with one of the selves
     * and it exists on disk.
     */
    public boolean isDeletable(BackupEvaluation evaluation) {
        Backup best = evaluation.bestBackup();
        if (!evaluation.status().isDeletable() || best == null || !best.kind().isValidCopy()) {
            return false;
        }
        Path path = best.record().path();
        if (path == null || !Files.exists(path)) {
            return false;
        }
        // the store may be stale, the file on disk must still have the recorded size
        if (best.record().size() != null && !best.record().size().equals(sizeOnDisk(path))) {
            return false;
        }
        String backupChecksum = best.record().checksum();
        return backupChecksum != null && evaluation.selves().stream()
                .anyMatch(self -> self.hasChecksum() && self.checksum().equalsIgnoreCase(backupChecksum));
    }

    @Nullable
    private Long sizeOnDisk(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            logger.debug("can't read size of backup {}", path, e);
            return null;
        }
    }

    /**
     * Computes the checksum missing on the subject or on its preferred unconfirmed backup
     * so the pair can be classified as valid or invalid. New checksums are added to the
     * store.
     *
     * @return a fresh evaluation, or the given one if there was nothing to complete
     */
    public BackupEvaluation ensureBackupChecksum(BackupEvaluation evaluation) throws IOException {
        if (evaluation.status().isDeletable()) {
            return evaluation;
        }
        Backup unconfirmed = evaluation.backups().stream()
                .filter(backup -> backup.kind().isUnconfirmedCopy())
                .findFirst()
                .orElse(null);
        if (unconfirmed == null) {
            return evaluation;
        }
        FileRecord subject = evaluation.subject();
        FileRecord backup = unconfirmed.record();
        List<String> selfAlgorithms = evaluation.selves().stream()
                .filter(FileRecord::hasChecksum)
                .map(FileRecord::algorithm)
                .toList();
        ChecksumRegistry registry = factory.registry();

        if (backup.hasChecksum() && !selfAlgorithms.contains(backup.algorithm())) {
            logger.info("computing {} checksum of {} to compare with backup {}", backup.algorithm(), subject.location(), backup.location());
            subject = factory.withChecksum(subject, backup.algorithm());
            store.add(subject);
        } else if (!backup.hasChecksum() && !selfAlgorithms.isEmpty()) {
            String algorithm = registry.cheapest(selfAlgorithms);
            logger.info("computing {} checksum of backup {}", algorithm, backup.location());
            store.add(factory.withChecksum(backup, algorithm));
        } else if (!backup.hasChecksum()) {
            String algorithm = registry.cheapest(List.of());
            logger.info("computing {} checksums of {} and backup {}", algorithm, subject.location(), backup.location());
            subject = factory.withChecksum(subject, algorithm);
            store.add(subject);
            store.add(factory.withChecksum(backup, algorithm));
        } else {
            logger.debug("backup {} of {} has no checksum to complete", backup.location(), subject.location());
            return evaluation;
        }
        return evaluate(subject);
    }
}
