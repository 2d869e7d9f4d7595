package dataval;

import dataval.CopyOutcome.AlreadyValid;
import dataval.CopyOutcome.Copied;
import dataval.CopyOutcome.Failed;
import dataval.CopyOutcome.Refused;
import dataval.CopyOutcome.Skipped;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Copies files to a backup location and validates the copy by checksum, retrying a
 * limited number of times.
 */
public class CopyOrchestrator {

    static final int MAX_ATTEMPTS = 3;

    private final Logger logger = LoggerFactory.getLogger("dataval");

    private final RecordStore store;
    private final FileRecordFactory factory;
    private final ExecutorService executor;

    public CopyOrchestrator(RecordStore store, FileRecordFactory factory, ExecutorService executor) {
        this.store = store;
        this.factory = factory;
        this.executor = executor;
    }

    /**
     * Copies every file of the folder, one task per file. Errors of one file end up in
     * its outcome and don't stop the others.
     */
    public List<CopyOutcome> copyFolder(Path folder, Path destination, CopyOptions options, FolderScanner scanner)
            throws IOException, ExecutionException, InterruptedException {
        List<Path> files = scanner.scan(folder);
        logger.info("Start copying {} files from {} to {}", files.size(), folder, destination);
        CopyOutcome[] outcomes = new CopyOutcome[files.size()];
        List<CompletableFuture<?>> futures = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            int index = i;
            Path file = files.get(i);
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    outcomes[index] = copy(file, destination, options);
                } catch (SessionMismatchException e) {
                    logger.warn("not copying {}: {}", file, e.getMessage());
                    outcomes[index] = new Refused(file, destination, "session mismatch");
                } catch (RuntimeException e) {
                    logger.error("error copying {} to {}", file, destination, e);
                    outcomes[index] = new Failed(file, Failed.Reason.ERROR);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        long failed = Arrays.stream(outcomes).filter(outcome -> outcome instanceof Failed).count();
        long refused = Arrays.stream(outcomes).filter(outcome -> outcome instanceof Refused).count();
        logger.info("finished copying {} files from {} ({} failed, {} refused)", files.size(), folder, failed, refused);
        return List.of(outcomes);
    }

    /**
     * @param destination a folder, or a file path if it names an existing file or has an extension
     * @throws SessionMismatchException if the destination belongs to a different session than the source
     */
    public CopyOutcome copy(Path source, Path destination, CopyOptions options) {
        if (!Files.isRegularFile(source)) {
            logger.error("source {} doesn't exist ... nothing to copy", source);
            return new Failed(source, Failed.Reason.NOT_FOUND);
        }
        try {
            return copyImpl(source, destination, options);
        } catch (NoSuchFileException e) {
            logger.error("file vanished while copying {}", source, e);
            return new Failed(source, Failed.Reason.NOT_FOUND);
        } catch (IOException e) {
            logger.error("copying {} to {} failed", source, destination, e);
            return new Failed(source, Failed.Reason.IO);
        }
    }

    private CopyOutcome copyImpl(Path source, Path destination, CopyOptions options) throws IOException {
        FileRecord subject = factory.fromPath(source);
        Path target = resolveDestination(subject, destination, options);

        String targetTag = Locations.subgroupTag(Locations.normalize(target));
        if (!Objects.equals(subject.subgroupTag(), targetTag)) {
            logger.warn("probe {} of {} doesn't match probe {} of destination {} ... not copying",
                    subject.subgroupTag(), source, targetTag, target);
            return new Refused(source, target, "subgroup tag mismatch");
        }

        List<FileRecord> selves = selves(subject);
        List<FileRecord> knownAtTarget = knownAt(subject, target);
        boolean validCopyKnown = false;
        boolean invalidCopyKnown = false;
        for (FileRecord known : knownAtTarget) {
            MatchKind kind = BackupStatusEvaluator.bestKind(selves, known);
            validCopyKnown |= kind.isValidCopy();
            invalidCopyKnown |= kind.isInvalidCopy();
        }

        boolean doCopy;
        if (options.allowRecopy()) {
            doCopy = true;
        } else if (!Files.exists(target)) {
            if (validCopyKnown && !invalidCopyKnown) {
                logger.info("{} was validated at {} before and has been cleared since ... not copying again", source, target);
                return new Skipped(source, target, "valid copy already cleared from destination");
            }
            doCopy = true;
        } else if (sameStat(source, target)) {
            if (invalidCopyKnown) {
                doCopy = true;
            } else if (!options.validate()) {
                logger.debug("{} already exists at {}", source, target);
                return new Skipped(source, target, "already exists");
            } else {
                doCopy = false;
            }
        } else {
            doCopy = true;
        }

        boolean copied = false;
        boolean validated = false;
        int attempts = 0;
        while ((doCopy || options.validate()) && attempts < MAX_ATTEMPTS) {
            attempts++;
            if (doCopy) {
                copyFile(source, target);
                copied = true;
            }
            if (!options.validate()) {
                break;
            }
            FileRecord targetRecord = doCopy ? null : knownChecksum(knownAtTarget, target);
            if (targetRecord == null) {
                String algorithm = preferredAlgorithm(selves);
                targetRecord = factory.withChecksum(FileRecord.of(Locations.normalize(target), null, null, algorithm), algorithm);
                store.add(targetRecord);
            }
            FileRecord sourceRecord = sourceChecksum(subject, selves, targetRecord.algorithm());

            MatchKind kind = RecordComparator.classify(sourceRecord, targetRecord);
            if (kind.isValidCopy()) {
                store.add(sourceRecord);
                validated = true;
                break;
            }
            if (kind.isInvalidCopy()) {
                logger.warn("copy {} doesn't match {} ({}) ... regenerating source checksum", target, source, kind);
                sourceRecord = factory.withChecksum(subject, targetRecord.algorithm());
                store.add(sourceRecord);
                if (RecordComparator.classify(sourceRecord, targetRecord).isValidCopy()) {
                    validated = true;
                    break;
                }
            }
            logger.info("copy {} of {} not valid ({}) after attempt {}", target, source, kind, attempts);
            doCopy = true;
        }

        if (options.validate() && !validated) {
            logger.error("giving up copying {} to {} after {} attempts", source, target, attempts);
            return new Failed(source, Failed.Reason.RETRY_EXHAUSTED);
        }

        boolean sourceRemoved = false;
        if (validated && options.removeSourceOnSuccess()) {
            sourceRemoved = removeSource(source);
        }
        if (copied) {
            logger.info("copied {} to {}{}", source, target, validated ? " (validated)" : "");
            return new Copied(source, target, attempts, validated, sourceRemoved);
        }
        return new AlreadyValid(source, target, sourceRemoved);
    }

    Path resolveDestination(FileRecord subject, Path destination, CopyOptions options) {
        Session session = subject.session();
        String destinationLocation = Locations.normalize(destination);
        Session destinationSession = Session.find(destinationLocation);
        if (session != null && destinationSession != null && !session.folder().equals(destinationSession.folder())) {
            throw new SessionMismatchException("destination " + destination + " belongs to session "
                    + destinationSession.folder() + " but " + subject.location() + " to " + session.folder());
        }

        boolean destinationIsFile = Files.isRegularFile(destination)
                || (!Files.exists(destination) && destination.getFileName().toString().contains("."));
        if (destinationIsFile) {
            return destination;
        }

        Path root = destination;
        if (options.addSessionSubdir() && session != null && !containsSessionFolder(root, session)) {
            root = root.resolve(session.folder());
        }
        String relative;
        if (session == null) {
            relative = subject.name();
        } else {
            String sessionRelative = Objects.requireNonNull(subject.sessionRelativePath());
            relative = containsSessionFolder(root, session)
                    ? sessionRelative.substring(sessionRelative.indexOf('/') + 1)
                    : sessionRelative;
        }
        return root.resolve(relative);
    }

    private static boolean containsSessionFolder(Path path, Session session) {
        for (Path element : path) {
            if (element.toString().contains(session.folder())) {
                return true;
            }
        }
        return false;
    }

    private List<FileRecord> selves(FileRecord subject) {
        List<FileRecord> selves = new ArrayList<>();
        selves.add(subject);
        for (FileRecord match : store.getMatches(subject, MatchKind.SELF_SET)) {
            if (!match.equals(subject)) {
                selves.add(match);
            }
        }
        return selves;
    }

    private List<FileRecord> knownAt(FileRecord subject, Path target) throws IOException {
        String targetLocation = Locations.normalize(target);
        List<FileRecord> known = new ArrayList<>();
        for (FileRecord match : store.getMatches(subject)) {
            if (Locations.sameLocation(match.location(), targetLocation)) {
                known.add(match);
            }
        }
        if (Files.exists(target)) {
            known.add(FileRecord.of(targetLocation, Files.size(target), null, subject.algorithm()));
        }
        return known;
    }

    private static @Nullable FileRecord knownChecksum(List<FileRecord> knownAtTarget, Path target) throws IOException {
        long size = Files.size(target);
        for (FileRecord known : knownAtTarget) {
            if (known.hasChecksum() && Objects.equals(known.size(), size)) {
                return known;
            }
        }
        return null;
    }

    private String preferredAlgorithm(List<FileRecord> selves) {
        List<String> withChecksum = selves.stream()
                .filter(FileRecord::hasChecksum)
                .map(FileRecord::algorithm)
                .toList();
        if (withChecksum.isEmpty()) {
            return factory.policy().defaultAlgorithm();
        }
        return factory.registry().cheapest(withChecksum);
    }

    private FileRecord sourceChecksum(FileRecord subject, List<FileRecord> selves, String algorithm) throws IOException {
        for (FileRecord self : selves) {
            if (self.hasChecksum() && self.algorithm().equals(algorithm)) {
                return self;
            }
        }
        FileRecord computed = factory.withChecksum(subject, algorithm);
        store.add(computed);
        return computed;
    }

    private static boolean sameStat(Path a, Path b) throws IOException {
        BasicFileAttributes attributesA = Files.readAttributes(a, BasicFileAttributes.class);
        BasicFileAttributes attributesB = Files.readAttributes(b, BasicFileAttributes.class);
        return attributesA.size() == attributesB.size()
                && attributesA.lastModifiedTime().equals(attributesB.lastModifiedTime());
    }

    private void copyFile(Path source, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        logger.debug("copying {} to {}", source, target);
        Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
    }

    private boolean removeSource(Path source) {
        try {
            Files.delete(source);
            logger.info("removed source {}", source);
            return true;
        } catch (AccessDeniedException e) {
            logger.error("no permission to remove source {} ... keeping it", source, e);
            return false;
        } catch (IOException e) {
            logger.error("removing source {} failed ... keeping it", source, e);
            return false;
        }
    }
}
