package dataval;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds {@link FileRecord}s from the filesystem or from stored values, validating
 * checksum formats on the way in.
 */
public class FileRecordFactory {

    private final ChecksumRegistry registry;
    private final ChecksumPolicy policy;

    public FileRecordFactory(ChecksumRegistry registry, ChecksumPolicy policy) {
        this.registry = registry;
        this.policy = policy;
    }

    public ChecksumRegistry registry() {
        return registry;
    }

    public ChecksumPolicy policy() {
        return policy;
    }

    public FileRecord fromPath(Path path) throws IOException {
        return fromPath(path, policy.defaultAlgorithm());
    }

    /**
     * Reads the size (following symlinks) and computes the checksum right away when the
     * file is below the auto checksum threshold.
     *
     * @throws java.nio.file.NoSuchFileException if the file doesn't exist
     */
    public FileRecord fromPath(Path path, String algorithm) throws IOException {
        long size = Files.size(path);
        String checksum = null;
        if (policy.shouldAutoCompute(size)) {
            checksum = registry.compute(algorithm, path);
        }
        return FileRecord.of(Locations.normalize(path), size, checksum, algorithm);
    }

    public FileRecord create(@Nullable String location, @Nullable Long size, @Nullable String checksum, String algorithm) {
        String normalized = null;
        if (checksum != null) {
            ChecksumProvider provider = registry.get(algorithm);
            if (!provider.validateFormat(checksum)) {
                throw new InvalidChecksumException(checksum, algorithm);
            }
            normalized = provider.normalize(checksum);
        }
        return FileRecord.of(location, size, normalized, algorithm);
    }

    public FileRecord withChecksum(FileRecord record) throws IOException {
        return withChecksum(record, record.algorithm());
    }

    /**
     * Computes a fresh checksum from the file on disk, also refreshing the size.
     */
    public FileRecord withChecksum(FileRecord record, String algorithm) throws IOException {
        Path path = record.path();
        if (path == null) {
            throw new IllegalArgumentException("can't compute a checksum without a location");
        }
        long size = Files.size(path);
        String checksum = registry.compute(algorithm, path);
        return record.withSize(size).withChecksum(checksum, algorithm);
    }
}
