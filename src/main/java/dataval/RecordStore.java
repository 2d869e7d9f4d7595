package dataval;

import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Persistent index of known file records.
 * <p>
 * Matches are only candidates: the store filters coarsely and callers classify the
 * returned records themselves before acting on them.
 */
public interface RecordStore extends Closeable {

    /**
     * Inserts or replaces the entry for (location, algorithm). Records without a checksum
     * or without a location are not stored.
     */
    void add(FileRecord record) throws IOException;

    /**
     * @param kinds only return candidates classifying as one of these; null means
     *              everything outside {@link MatchKind#IGNORED_SET}
     */
    List<FileRecord> getMatches(FileRecord subject, @Nullable Set<MatchKind> kinds);

    default List<FileRecord> getMatches(FileRecord subject) {
        return getMatches(subject, null);
    }

    int size();
}
