package dataval;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public interface ChecksumProvider {

    int CHUNK_SIZE = 64 * 1024;

    String algorithmName();

    String compute(Path path) throws IOException;

    String compute(byte[] data);

    boolean validateFormat(String checksum);

    /**
     * Brings a checksum string into the canonical case of this algorithm.
     */
    String normalize(String checksum);

    /**
     * @return the expected checksum of the three bytes {@code foo}
     */
    String knownAnswer();

    default boolean selfTest() {
        return knownAnswer().equals(compute("foo".getBytes(StandardCharsets.US_ASCII)));
    }
}
