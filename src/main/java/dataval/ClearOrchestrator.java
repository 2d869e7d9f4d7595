package dataval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static dataval.Util.DIVIDER;
import static dataval.Util.bytesToHumanReadableFormat;

/**
 * Deletes files of a folder that have a validated backup.
 * <p>
 * A file is only deleted if it is deletable when evaluated and again right before the
 * delete. Errors of one file don't stop the sweep.
 */
public class ClearOrchestrator {

    // raw capture folders carry three or more probe letters, e.g. 1234567890_366122_20220618_probeABC
    private static final Pattern RAW_DATA_FOLDER = Pattern.compile("_probe([A-F]{3,})");

    private final Logger logger = LoggerFactory.getLogger("dataval");

    private final BackupStatusEvaluator evaluator;
    private final FileRecordFactory factory;
    private final BackupLocator locator;
    private final ExecutorService executor;
    private final Clock clock;

    public ClearOrchestrator(BackupStatusEvaluator evaluator,
                             FileRecordFactory factory,
                             BackupLocator locator,
                             ExecutorService executor,
                             Clock clock) {
        this.evaluator = evaluator;
        this.factory = factory;
        this.locator = locator;
        this.executor = executor;
        this.clock = clock;
    }

    public ClearSummary clear(Path folder, ClearOptions options) throws IOException, ExecutionException, InterruptedException {
        if (!options.skipRawDataCheck() && isUnsortedRawData(folder)) {
            logger.warn("{} holds raw data and no sorted data exists on the archive tier ... not clearing", folder);
            return ClearSummary.refused(folder);
        }
        List<Path> files = options.scanner().scan(folder);
        logger.info("Start clearing {} ({} files)", folder, files.size());

        long[] freed = new long[files.size()];
        boolean[] deleted = new boolean[files.size()];
        boolean[] failed = new boolean[files.size()];
        List<CompletableFuture<?>> futures = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            int index = i;
            Path file = files.get(i);
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    if (!isOldEnough(file, options.minAgeDays())) {
                        logger.debug("{} is too recent ... skipping", file);
                        return;
                    }
                    long bytes = deleteIfValid(factory.fromPath(file), options.dryRun());
                    if (bytes >= 0) {
                        deleted[index] = true;
                        freed[index] = bytes;
                    }
                } catch (NoSuchFileException e) {
                    logger.debug("{} disappeared during clearing", file);
                } catch (AccessDeniedException e) {
                    logger.error("no permission to delete {} ... keeping it", file);
                    failed[index] = true;
                } catch (Exception e) {
                    logger.error("error clearing {}", file, e);
                    failed[index] = true;
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();

        if (!options.dryRun()) {
            removeEmptyFolders(folder);
        }

        int filesDeleted = 0;
        long bytesFreed = 0;
        int failures = 0;
        for (int i = 0; i < files.size(); i++) {
            filesDeleted += deleted[i] ? 1 : 0;
            bytesFreed += freed[i];
            failures += failed[i] ? 1 : 0;
        }
        logger.info(DIVIDER);
        logger.info("{}{} files deleted | {} recovered | {} errors", options.dryRun() ? "DRY RUN: " : "",
                filesDeleted, bytesToHumanReadableFormat(bytesFreed), failures);
        logger.info(DIVIDER);
        return new ClearSummary(folder, filesDeleted, bytesFreed, failures, false);
    }

    /**
     * Deletes the file if its backup is valid, re-checking the backup right before deleting.
     *
     * @return the number of bytes freed, or -1 if the file was kept
     */
    public long deleteIfValid(FileRecord record, boolean dryRun) throws IOException {
        Path path = record.path();
        if (path == null) {
            return -1;
        }
        BackupEvaluation evaluation = evaluator.evaluate(record);
        if (!evaluator.isDeletable(evaluation)) {
            logger.debug("{} is kept: {}", record.location(), evaluation.status());
            return -1;
        }
        if (dryRun) {
            logger.info("would delete {} ({})", record.location(), evaluation.status());
            return -1;
        }
        BackupEvaluation recheck = evaluator.evaluate(record);
        long size = Files.size(path);
        if (!evaluator.isDeletable(recheck) || record.size() == null || record.size() != size) {
            logger.warn("{} changed since it was evaluated ... keeping it", record.location());
            return -1;
        }
        Files.delete(path);
        logger.debug("deleted {} ({}, backup at {})", record.location(), recheck.status(),
                recheck.bestBackup().record().location());
        return size;
    }

    boolean isOldEnough(Path file, int minAgeDays) throws IOException {
        if (minAgeDays <= 0) {
            return true;
        }
        LocalDate today = LocalDate.now(clock);
        Session session = Session.find(Locations.normalize(file));
        if (session != null && session.date() != null) {
            return session.isOlderThan(minAgeDays, today);
        }
        Instant lastModified = Files.getLastModifiedTime(file).toInstant();
        LocalDate modified = LocalDate.ofInstant(lastModified, clock.getZone());
        return !modified.isAfter(today.minusDays(minAgeDays));
    }

    /**
     * A raw capture folder may only be cleared once sorted output for one of its probes
     * exists in the session folder on the archive tier.
     */
    boolean isUnsortedRawData(Path folder) throws IOException {
        String location = Locations.normalize(folder);
        Matcher matcher = RAW_DATA_FOLDER.matcher(Locations.name(location));
        if (!matcher.find() || location.contains("_sorted")) {
            return false;
        }
        Session session = Session.find(location);
        if (session == null) {
            return false;
        }
        Optional<String> archiveSession = locator.locate(
                FileRecord.of("/" + session.folder(), null, null, factory.policy().defaultAlgorithm()), Tier.ARCHIVE);
        if (archiveSession.isEmpty() || !Files.isDirectory(Path.of(archiveSession.get()))) {
            return true;
        }
        String letters = matcher.group(1);
        try (Stream<Path> list = Files.list(Path.of(archiveSession.get()))) {
            return list.filter(Files::isDirectory)
                    .map(dir -> dir.getFileName().toString())
                    .noneMatch(name -> letters.chars().anyMatch(letter -> name.contains("_probe" + (char) letter + "_sorted")));
        }
    }

    private void removeEmptyFolders(Path folder) throws IOException {
        List<Path> folders;
        try (Stream<Path> walk = Files.walk(folder)) {
            folders = walk.filter(Files::isDirectory)
                    .filter(dir -> !dir.equals(folder))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        }
        for (Path dir : folders) {
            try {
                if (isEmpty(dir)) {
                    Files.delete(dir);
                    logger.debug("removed empty folder {}", dir);
                }
            } catch (DirectoryNotEmptyException e) {
                logger.debug("folder {} is not empty anymore", dir);
            } catch (IOException e) {
                logger.debug("can't remove empty folder {}", dir, e);
            }
        }
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (Stream<Path> content = Files.list(dir)) {
            return content.findAny().isEmpty();
        }
    }
}
