package dataval;

import java.util.List;

/**
 * @param minAgeDays       files of sessions younger than this are kept
 * @param skipRawDataCheck clear raw capture folders even if no sorted data exists on the archive tier
 * @param dryRun           evaluate and report, but delete nothing
 */
public record ClearOptions(boolean includeSubfolders,
                           List<String> includeFilters,
                           List<String> excludeFilters,
                           int minAgeDays,
                           boolean skipRawDataCheck,
                           boolean dryRun) {

    public static ClearOptions defaults() {
        return new ClearOptions(true, List.of(), List.of(), 0, false, false);
    }

    public ClearOptions withMinAgeDays(int minAgeDays) {
        return new ClearOptions(includeSubfolders, includeFilters, excludeFilters, minAgeDays, skipRawDataCheck, dryRun);
    }

    public ClearOptions withSkipRawDataCheck(boolean skipRawDataCheck) {
        return new ClearOptions(includeSubfolders, includeFilters, excludeFilters, minAgeDays, skipRawDataCheck, dryRun);
    }

    public ClearOptions withDryRun(boolean dryRun) {
        return new ClearOptions(includeSubfolders, includeFilters, excludeFilters, minAgeDays, skipRawDataCheck, dryRun);
    }

    public FolderScanner scanner() {
        return new FolderScanner(includeSubfolders, includeFilters, excludeFilters);
    }
}
