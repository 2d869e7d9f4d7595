package dataval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Record store persisted as a single JSON file. The whole file is rewritten after every
 * change; writes are serialized.
 */
public class JsonFileRecordStore extends InMemoryRecordStore {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public record StoredEntry(String path,
                              String checksum,
                              String type,
                              @Nullable Long size,
                              @Nullable String sessionId,
                              @Nullable String hostname) {
    }

    private final Path file;
    private final FileRecordFactory factory;
    private final String hostname;

    public JsonFileRecordStore(Path file) throws IOException {
        this(file, ChecksumRegistry.defaultRegistry());
    }

    public JsonFileRecordStore(Path file, ChecksumRegistry registry) throws IOException {
        this.file = file;
        this.factory = new FileRecordFactory(registry, ChecksumPolicy.defaults());
        this.hostname = localHostname();
        load();
    }

    private void load() throws IOException {
        if (!Files.exists(file)) {
            logger.info("record store {} doesn't exist yet ... starting empty", file);
            return;
        }
        List<StoredEntry> stored;
        try {
            stored = OBJECT_MAPPER.readValue(file.toFile(), new TypeReference<List<StoredEntry>>() {
            });
        } catch (IOException e) {
            throw new IOException("can't read record store " + file, e);
        }
        for (StoredEntry entry : stored) {
            if (entry.type() == null) {
                logger.warn("skipping entry {} without checksum type in record store {}", entry, file);
                continue;
            }
            try {
                put(factory.create(entry.path(), entry.size(), entry.checksum(), entry.type()));
            } catch (IllegalArgumentException e) {
                logger.warn("skipping invalid entry {} in record store {}: {}", entry, file, e.getMessage());
            }
        }
        logger.info("loaded {} entries from record store {}", size(), file);
    }

    @Override
    public void add(FileRecord record) throws IOException {
        if (put(record)) {
            save();
        }
    }

    synchronized void save() throws IOException {
        List<StoredEntry> stored = entries().stream()
                .map(record -> new StoredEntry(
                        record.location(),
                        record.checksum(),
                        record.algorithm(),
                        record.size(),
                        record.session() == null ? null : record.session().id(),
                        hostname))
                .toList();
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            OBJECT_MAPPER.writeValue(tmp.toFile(), stored);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IOException("can't write record store " + file, e);
        }
    }

    @Override
    public void close() throws IOException {
        save();
    }

    private String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("can't determine local hostname, storing entries without it", e);
            return "unknown";
        }
    }
}
