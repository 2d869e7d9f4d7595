package dataval;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Expected path = tier root + path relative to (and including) the session folder.
 */
public class TierRootsBackupLocator implements BackupLocator {

    private final Map<Tier, String> roots = new EnumMap<>(Tier.class);

    public TierRootsBackupLocator(Map<Tier, Path> roots) {
        roots.forEach((tier, root) -> this.roots.put(tier, stripTrailingSlash(Locations.normalize(root))));
    }

    public Optional<Path> root(Tier tier) {
        String root = roots.get(tier);
        return root == null ? Optional.empty() : Optional.of(Path.of(root));
    }

    @Override
    public Optional<String> locate(FileRecord record, Tier tier) {
        String root = roots.get(tier);
        String relative = record.sessionRelativePath();
        if (root == null || relative == null) {
            return Optional.empty();
        }
        return Optional.of(root + "/" + relative);
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") && s.length() > 1 ? s.substring(0, s.length() - 1) : s;
    }
}
