package dataval;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Lists the files of a folder that a sweep should look at.
 * <p>
 * Filters are {@code |}-separated name fragments; {@code *} is ignored, so {@code *.npx2|*.dat}
 * matches every name containing {@code .npx2} or {@code .dat}.
 */
public class FolderScanner {

    static final List<Pattern> filePatternsToIgnore = List.of(
            Pattern.compile("(.*/)?.DS_Store"),
            Pattern.compile("(.*/)?Thumbs.db"));

    private final boolean includeSubfolders;
    private final List<String> includeFilters;
    private final List<String> excludeFilters;

    public FolderScanner(boolean includeSubfolders, List<String> includeFilters, List<String> excludeFilters) {
        this.includeSubfolders = includeSubfolders;
        this.includeFilters = includeFilters;
        this.excludeFilters = excludeFilters;
    }

    public static FolderScanner all() {
        return new FolderScanner(true, List.of(), List.of());
    }

    public static List<String> parseFilter(@Nullable String filter) {
        List<String> result = new ArrayList<>();
        if (filter == null) {
            return result;
        }
        for (String part : filter.split("\\|")) {
            String fragment = part.replace("*", "").trim();
            if (!fragment.isEmpty()) {
                result.add(fragment);
            }
        }
        return result;
    }

    public List<Path> scan(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Must be a folder " + folder);
        }
        int depth = includeSubfolders ? Integer.MAX_VALUE : 1;
        try (Stream<Path> walk = Files.walk(folder, depth)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(file -> !shouldIgnoreFile(Locations.normalize(file.toString())))
                    .filter(file -> matchesFilters(file.getFileName().toString()))
                    .toList();
        }
    }

    boolean matchesFilters(String name) {
        if (!includeFilters.isEmpty() && includeFilters.stream().noneMatch(name::contains)) {
            return false;
        }
        return excludeFilters.stream().noneMatch(name::contains);
    }

    static boolean shouldIgnoreFile(String file) {
        return filePatternsToIgnore.stream().anyMatch(pattern -> pattern.matcher(file).matches());
    }
}
