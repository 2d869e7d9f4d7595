package dataval;

import org.bouncycastle.crypto.digests.SHA3Digest;
import org.bouncycastle.util.encoders.Hex;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * SHA3-256 via BouncyCastle, which also works in native images.
 */
public class Sha3ChecksumProvider implements ChecksumProvider {

    public static final String NAME = "sha3_256";

    @Override
    public String algorithmName() {
        return NAME;
    }

    @Override
    public String compute(Path path) throws IOException {
        SHA3Digest digest = new SHA3Digest(256);
        try (InputStream is = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int bytesRead;
            while ((bytesRead = is.read(buffer, 0, buffer.length)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
        }
        return finish(digest);
    }

    @Override
    public String compute(byte[] data) {
        SHA3Digest digest = new SHA3Digest(256);
        digest.update(data, 0, data.length);
        return finish(digest);
    }

    @Override
    public boolean validateFormat(String checksum) {
        return Sha256ChecksumProvider.SHA_FORMAT.matcher(checksum).matches();
    }

    @Override
    public String normalize(String checksum) {
        return checksum.toLowerCase(Locale.ROOT);
    }

    @Override
    public String knownAnswer() {
        return "76d3bc41c9f588f7fcd0d5bf4718f8f84b1c41b20882703100b9eb9413807c01";
    }

    private static String finish(SHA3Digest digest) {
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }
}
