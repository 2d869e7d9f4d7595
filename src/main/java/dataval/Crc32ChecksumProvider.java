package dataval;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

public class Crc32ChecksumProvider implements ChecksumProvider {

    public static final String NAME = "crc32";

    private static final Pattern FORMAT = Pattern.compile("[0-9a-fA-F]{8}");

    @Override
    public String algorithmName() {
        return NAME;
    }

    @Override
    public String compute(Path path) throws IOException {
        CRC32 crc32 = new CRC32();
        try (InputStream is = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int bytesRead;
            while ((bytesRead = is.read(buffer, 0, buffer.length)) != -1) {
                crc32.update(buffer, 0, bytesRead);
            }
        }
        return format(crc32.getValue());
    }

    @Override
    public String compute(byte[] data) {
        CRC32 crc32 = new CRC32();
        crc32.update(data);
        return format(crc32.getValue());
    }

    @Override
    public boolean validateFormat(String checksum) {
        return FORMAT.matcher(checksum).matches();
    }

    @Override
    public String normalize(String checksum) {
        return checksum.toUpperCase(Locale.ROOT);
    }

    @Override
    public String knownAnswer() {
        return "8C736521";
    }

    private static String format(long value) {
        return String.format("%08X", value);
    }
}
