package dataval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static dataval.Util.DIVIDER;
import static dataval.Util.bytesToHumanReadableFormat;

/**
 * Wires the components together from a {@link ConfigProvider} and owns the worker pool
 * and the record store. Call {@link #shutdown()} when done.
 */
public class Impl {

    private final Logger logger = LoggerFactory.getLogger("dataval");

    private final ConfigProvider config;
    private final RecordStore store;
    private final ExecutorService threadPoolExecutor;
    private final TierRootsBackupLocator locator;
    private final FileRecordFactory factory;
    private final BackupStatusEvaluator evaluator;
    private final CopyOrchestrator copyOrchestrator;
    private final ClearOrchestrator clearOrchestrator;
    private final ChecksumIndexer indexer;

    public Impl() throws IOException {
        this(new PropertiesConfigProvider());
    }

    public Impl(ConfigProvider config) throws IOException {
        this(config, new JsonFileRecordStore(config.getStoreFile()), Clock.systemDefaultZone());
    }

    public Impl(ConfigProvider config, RecordStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.threadPoolExecutor = Executors.newFixedThreadPool(config.getWorkers());
        this.locator = new TierRootsBackupLocator(config.getTierRoots());
        this.factory = new FileRecordFactory(ChecksumRegistry.defaultRegistry(),
                new ChecksumPolicy(config.getAutoChecksumThresholdBytes(), config.getChecksumAlgorithm()));
        this.evaluator = new BackupStatusEvaluator(store, locator, factory);
        this.copyOrchestrator = new CopyOrchestrator(store, factory, threadPoolExecutor);
        this.clearOrchestrator = new ClearOrchestrator(evaluator, factory, locator, threadPoolExecutor, clock);
        this.indexer = new ChecksumIndexer(store, factory, threadPoolExecutor, config.getRegenerateThresholdBytes());
    }

    public void shutdown() throws IOException {
        threadPoolExecutor.shutdown();
        store.close();
    }

    public List<ClearSummary> clearFolders(List<Path> folders, ClearOptions options) throws IOException, ExecutionException, InterruptedException {
        if (options.dryRun()) {
            logger.info(DIVIDER);
            logger.info("DRY RUN ---- NOTHING will be actually deleted ---- DRY RUN");
            logger.info(DIVIDER);
        }
        List<ClearSummary> result = new ArrayList<>();
        for (Path folder : folders) {
            result.add(clearOrchestrator.clear(folder, options));
        }
        long totalFreed = result.stream().mapToLong(ClearSummary::bytesFreed).sum();
        int totalDeleted = result.stream().mapToInt(ClearSummary::filesDeleted).sum();
        logger.info("cleared {} folders: {} files deleted | {} recovered", folders.size(), totalDeleted, bytesToHumanReadableFormat(totalFreed));
        return result;
    }

    /**
     * Copies a file or every file of a folder. Without a destination the file goes to the
     * root of the given tier.
     */
    public List<CopyOutcome> copy(Path source, Path destination, CopyOptions options) throws IOException, ExecutionException, InterruptedException {
        if (Files.isDirectory(source)) {
            return copyOrchestrator.copyFolder(source, destination, options, FolderScanner.all());
        }
        return List.of(copyOrchestrator.copy(source, destination, options));
    }

    public Path tierRoot(Tier tier) {
        return locator.root(tier).orElseThrow(() -> new IllegalArgumentException("no root configured for tier " + tier));
    }

    public List<BackupEvaluation> status(List<Path> files, boolean completeChecksums) throws IOException {
        List<BackupEvaluation> result = new ArrayList<>();
        for (Path file : files) {
            BackupEvaluation evaluation = evaluator.evaluate(file);
            if (completeChecksums && evaluation.status().isUnconfirmed()) {
                evaluation = evaluator.ensureBackupChecksum(evaluation);
            }
            logger.info("{}: {}{}", file, evaluation.status(),
                    evaluation.bestBackup() == null ? "" : " (" + evaluation.bestBackup().record().location() + ")");
            result.add(evaluation);
        }
        return result;
    }

    public int index(List<Path> folders) throws IOException, ExecutionException, InterruptedException {
        int count = 0;
        for (Path folder : folders) {
            count += indexer.index(folder, FolderScanner.all());
        }
        return count;
    }

    public ConfigProvider config() {
        return config;
    }

    public RecordStore store() {
        return store;
    }

    public FileRecordFactory factory() {
        return factory;
    }
}
