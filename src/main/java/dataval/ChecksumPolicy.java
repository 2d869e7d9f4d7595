package dataval;

/**
 * @param autoChecksumThresholdBytes files smaller than this get their checksum computed when the record is built
 * @param defaultAlgorithm           algorithm for new records
 */
public record ChecksumPolicy(long autoChecksumThresholdBytes, String defaultAlgorithm) {

    public static final long DEFAULT_AUTO_CHECKSUM_THRESHOLD = 50 * Util.ONE_MB;

    public static ChecksumPolicy defaults() {
        return new ChecksumPolicy(DEFAULT_AUTO_CHECKSUM_THRESHOLD, Sha3ChecksumProvider.NAME);
    }

    public boolean shouldAutoCompute(long size) {
        return size < autoChecksumThresholdBytes;
    }
}
