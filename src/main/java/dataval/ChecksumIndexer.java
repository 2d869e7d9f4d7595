package dataval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Adds the checksums of a folder's files to the record store.
 * <p>
 * Small files are always checksummed again. Larger files only when the store doesn't
 * already know a checksum for them.
 */
public class ChecksumIndexer {

    public static final long DEFAULT_REGENERATE_THRESHOLD = Util.ONE_MB;

    private final Logger logger = LoggerFactory.getLogger("dataval");

    private final RecordStore store;
    private final FileRecordFactory factory;
    private final ExecutorService executor;
    private final long regenerateThresholdBytes;

    public ChecksumIndexer(RecordStore store, FileRecordFactory factory, ExecutorService executor, long regenerateThresholdBytes) {
        this.store = store;
        this.factory = factory;
        this.executor = executor;
        this.regenerateThresholdBytes = regenerateThresholdBytes;
    }

    /**
     * @return the number of files whose checksum was computed and stored
     */
    public int index(Path folder, FolderScanner scanner) throws IOException, ExecutionException, InterruptedException {
        List<Path> files = scanner.scan(folder);
        logger.info("Start indexing {} files in {}", files.size(), folder);
        boolean[] indexed = new boolean[files.size()];
        boolean[] failed = new boolean[files.size()];
        List<CompletableFuture<?>> futures = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            int index = i;
            Path file = files.get(i);
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    indexed[index] = indexFile(file);
                } catch (NoSuchFileException e) {
                    logger.debug("{} disappeared during indexing", file);
                } catch (Exception e) {
                    logger.error("error indexing {}", file, e);
                    failed[index] = true;
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        int count = 0;
        int failures = 0;
        for (int i = 0; i < files.size(); i++) {
            count += indexed[i] ? 1 : 0;
            failures += failed[i] ? 1 : 0;
        }
        logger.info("finished indexing {}: {} checksums added | {} errors", folder, count, failures);
        return count;
    }

    boolean indexFile(Path file) throws IOException {
        String algorithm = factory.policy().defaultAlgorithm();
        FileRecord record = FileRecord.of(Locations.normalize(file), Files.size(file), null, algorithm);
        if (record.size() > regenerateThresholdBytes) {
            List<FileRecord> known = store.getMatches(record, Set.of(MatchKind.SELF_MISSING_SELF));
            if (!known.isEmpty()) {
                logger.debug("{} already has a checksum in the store", file);
                return false;
            }
        }
        store.add(factory.withChecksum(record));
        return true;
    }
}
