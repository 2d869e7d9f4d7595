package dataval;

import org.bouncycastle.util.encoders.Hex;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.regex.Pattern;

public class Sha256ChecksumProvider implements ChecksumProvider {

    public static final String NAME = "sha256";

    static final Pattern SHA_FORMAT = Pattern.compile("[0-9a-fA-F]{64}");

    @Override
    public String algorithmName() {
        return NAME;
    }

    @Override
    public String compute(Path path) throws IOException {
        MessageDigest messageDigest = newDigest();
        try (InputStream is = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int bytesRead;
            while ((bytesRead = is.read(buffer, 0, buffer.length)) != -1) {
                messageDigest.update(buffer, 0, bytesRead);
            }
        }
        return Hex.toHexString(messageDigest.digest());
    }

    @Override
    public String compute(byte[] data) {
        return Hex.toHexString(newDigest().digest(data));
    }

    @Override
    public boolean validateFormat(String checksum) {
        return SHA_FORMAT.matcher(checksum).matches();
    }

    @Override
    public String normalize(String checksum) {
        return checksum.toLowerCase(Locale.ROOT);
    }

    @Override
    public String knownAnswer() {
        return "2c26b46b68ffc68ff99b453c1d30413413422d706483bfa0f98a5e886266e7ae";
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }
}
