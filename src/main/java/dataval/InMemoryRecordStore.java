package dataval;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

public class InMemoryRecordStore implements RecordStore {

    // the smallest size for which a size-only match of an orphan file is meaningful
    private static final long MIN_SIZE_FOR_SIZE_MATCH = 10;

    protected final Logger logger = LoggerFactory.getLogger("dataval");

    private final Map<String, FileRecord> entries = new ConcurrentHashMap<>();

    static String key(FileRecord record) {
        return Locations.key(Objects.requireNonNull(record.location())) + "|" + record.algorithm();
    }

    @Override
    public void add(FileRecord record) throws IOException {
        put(record);
    }

    /**
     * @return true if the store content changed
     */
    protected boolean put(FileRecord record) {
        if (record.location() == null || !record.hasChecksum()) {
            logger.debug("not storing {} without location or checksum", record);
            return false;
        }
        FileRecord previous = entries.put(key(record), record);
        return previous == null || !previous.equals(record) || !previous.algorithm().equals(record.algorithm());
    }

    protected Collection<FileRecord> entries() {
        return entries.values();
    }

    @Override
    public List<FileRecord> getMatches(FileRecord subject, @Nullable Set<MatchKind> kinds) {
        List<FileRecord> candidates = subject.isOrphan() ? orphanCandidates(subject) : sessionCandidates(subject, kinds);
        List<FileRecord> result = new ArrayList<>();
        for (FileRecord candidate : candidates) {
            MatchKind kind = RecordComparator.classify(subject, candidate);
            if (kinds == null ? !kind.isIgnored() : kinds.contains(kind)) {
                result.add(candidate);
            }
        }
        return result;
    }

    private List<FileRecord> sessionCandidates(FileRecord subject, @Nullable Set<MatchKind> kinds) {
        String sessionId = subject.session().id();
        Predicate<FileRecord> filter = entry -> entry.session() != null && entry.session().id().equals(sessionId);
        if (kinds != null && !kinds.isEmpty() && MatchKind.SELF_SET.containsAll(kinds)) {
            filter = filter.and(entry -> Objects.equals(entry.size(), subject.size()) || sameChecksum(entry, subject));
        } else if (kinds != null && !kinds.isEmpty() && MatchKind.VALID_SET.containsAll(kinds)) {
            filter = filter.and(entry -> Objects.equals(entry.size(), subject.size()) && sameChecksum(entry, subject));
        }
        return entries.values().stream().filter(filter).toList();
    }

    private List<FileRecord> orphanCandidates(FileRecord subject) {
        List<FileRecord> result = entries.values().stream()
                .filter(entry -> Locations.sameLocation(entry.location(), subject.location()) || sameChecksum(entry, subject))
                .toList();
        if (result.isEmpty() && subject.size() != null && subject.size() > MIN_SIZE_FOR_SIZE_MATCH) {
            result = entries.values().stream()
                    .filter(entry -> Objects.equals(entry.size(), subject.size()))
                    .toList();
        }
        return result;
    }

    private static boolean sameChecksum(FileRecord a, FileRecord b) {
        return a.checksum() != null && b.checksum() != null && a.checksum().equalsIgnoreCase(b.checksum());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void close() throws IOException {
    }
}
