package dataval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

public class PropertiesConfigProvider implements ConfigProvider {

    static final String DATAVAL_CONFIG_FILE = "dataval.config";
    private static final String DEFAULT_STORE_FILE = "dataval-store.json";

    private static final String CONFIG_TIER_ROOT = "tier.%s.root";
    private static final String CONFIG_STORE_FILE = "store.file";
    private static final String CONFIG_CHECKSUM_ALGORITHM = "checksum.algorithm";
    private static final String CONFIG_AUTO_CHECKSUM_THRESHOLD = "checksum.auto.threshold.bytes";
    private static final String CONFIG_REGENERATE_THRESHOLD = "index.regenerate.threshold.bytes";
    private static final String CONFIG_MIN_AGE_DAYS = "clear.min.age.days";
    private static final String CONFIG_INCLUDE_SUBFOLDERS = "clear.include.subfolders";
    private static final String CONFIG_INCLUDE_FILTER = "clear.include.filter";
    private static final String CONFIG_EXCLUDE_FILTER = "clear.exclude.filter";
    private static final String CONFIG_SKIP_RAW_DATA_CHECK = "clear.skip.raw.data.check";
    private static final String CONFIG_WORKERS = "workers";

    private final Logger logger = LoggerFactory.getLogger("dataval");

    private final Map<Tier, Path> tierRoots = new EnumMap<>(Tier.class);
    private Path storeFile;
    private String checksumAlgorithm;
    private long autoChecksumThresholdBytes;
    private long regenerateThresholdBytes;
    private ClearOptions clearOptions;
    private int workers;

    public PropertiesConfigProvider() throws IOException {
        this(Path.of(System.getProperty("user.home"), DATAVAL_CONFIG_FILE));
    }

    public PropertiesConfigProvider(Path configFile) throws IOException {
        readConfigFile(configFile);
    }

    private void readConfigFile(Path configFile) throws IOException {
        Properties properties = new Properties();
        InputStream inputStream;
        try {
            inputStream = new FileInputStream(configFile.toFile());
        } catch (FileNotFoundException e) {
            logger.error("{} not found or can't be read", configFile, e);
            throw new RuntimeException("Invalid config");
        }
        logger.info("Start reading config file {}", configFile);
        try (inputStream) {
            properties.load(inputStream);
        }

        for (Tier tier : Tier.values()) {
            String root = properties.getProperty(String.format(CONFIG_TIER_ROOT, tier.name().toLowerCase(Locale.ROOT)));
            if (root != null && root.length() > 0) {
                tierRoots.put(tier, Path.of(root));
                logger.info("{} tier at '{}'", tier, root);
            }
        }
        if (tierRoots.isEmpty()) {
            logger.error("Invalid config: expected at least one tier root, e.g. {}", String.format(CONFIG_TIER_ROOT, "archive"));
            throw new RuntimeException("Invalid config");
        }

        String store = properties.getProperty(CONFIG_STORE_FILE);
        storeFile = store == null || store.length() == 0
                ? Path.of(System.getProperty("user.home"), DEFAULT_STORE_FILE)
                : Path.of(store);
        logger.info("Using record store '{}'", storeFile);

        checksumAlgorithm = properties.getProperty(CONFIG_CHECKSUM_ALGORITHM, Sha3ChecksumProvider.NAME);
        if (!ChecksumRegistry.defaultRegistry().supports(checksumAlgorithm)) {
            logger.error("Invalid config: {} expected to be one of {}", CONFIG_CHECKSUM_ALGORITHM,
                    ChecksumRegistry.defaultRegistry().algorithms());
            throw new RuntimeException("Invalid config");
        }

        autoChecksumThresholdBytes = readLong(properties, CONFIG_AUTO_CHECKSUM_THRESHOLD, ChecksumPolicy.DEFAULT_AUTO_CHECKSUM_THRESHOLD);
        regenerateThresholdBytes = readLong(properties, CONFIG_REGENERATE_THRESHOLD, ChecksumIndexer.DEFAULT_REGENERATE_THRESHOLD);
        workers = (int) readLong(properties, CONFIG_WORKERS, 10);
        if (workers < 1) {
            logger.error("Invalid config: {} expected to be at least 1", CONFIG_WORKERS);
            throw new RuntimeException("Invalid config");
        }

        clearOptions = new ClearOptions(
                Boolean.parseBoolean(properties.getProperty(CONFIG_INCLUDE_SUBFOLDERS, "true")),
                Collections.unmodifiableList(FolderScanner.parseFilter(properties.getProperty(CONFIG_INCLUDE_FILTER))),
                Collections.unmodifiableList(FolderScanner.parseFilter(properties.getProperty(CONFIG_EXCLUDE_FILTER))),
                (int) readLong(properties, CONFIG_MIN_AGE_DAYS, 0),
                Boolean.parseBoolean(properties.getProperty(CONFIG_SKIP_RAW_DATA_CHECK, "false")),
                false);
    }

    private long readLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.length() == 0) {
            return defaultValue;
        }
        try {
            long result = Long.parseLong(value.trim());
            if (result < 0) {
                logger.error("Invalid config: {} expected to be positive, but found {}", key, value);
                throw new RuntimeException("Invalid config");
            }
            return result;
        } catch (NumberFormatException e) {
            logger.error("Invalid config: {} expected to be a number, but found '{}'", key, value);
            throw new RuntimeException("Invalid config");
        }
    }

    @Override
    public Map<Tier, Path> getTierRoots() {
        return tierRoots;
    }

    @Override
    public Path getStoreFile() {
        return storeFile;
    }

    @Override
    public String getChecksumAlgorithm() {
        return checksumAlgorithm;
    }

    @Override
    public long getAutoChecksumThresholdBytes() {
        return autoChecksumThresholdBytes;
    }

    @Override
    public long getRegenerateThresholdBytes() {
        return regenerateThresholdBytes;
    }

    @Override
    public ClearOptions getClearOptions() {
        return clearOptions;
    }

    @Override
    public int getWorkers() {
        return workers;
    }
}
