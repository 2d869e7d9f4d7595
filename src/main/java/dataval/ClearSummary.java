package dataval;

import java.nio.file.Path;

/**
 * @param refused true if the folder guard stopped the sweep before any file was looked at
 */
public record ClearSummary(Path folder, int filesDeleted, long bytesFreed, int failures, boolean refused) {

    static ClearSummary refused(Path folder) {
        return new ClearSummary(folder, 0, 0, 0, true);
    }
}
