package dataval;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the normalized string form of file locations.
 * <p>
 * Locations always use {@code /} as separator and are compared ignoring case.
 */
public class Locations {

    private static final Pattern SUBGROUP_TAG = Pattern.compile("(?<=_probe)_?(([A-F]+)|([0-5]))");

    public static String normalize(String location) {
        return location.replace('\\', '/');
    }

    public static String normalize(Path path) {
        return normalize(path.toAbsolutePath().normalize().toString());
    }

    public static String key(String location) {
        return normalize(location).toLowerCase(Locale.ROOT);
    }

    public static boolean sameLocation(@Nullable String a, @Nullable String b) {
        if (a == null || b == null) {
            return false;
        }
        return key(a).equals(key(b));
    }

    public static String name(String location) {
        String normalized = normalize(location);
        int idx = normalized.lastIndexOf('/');
        return idx < 0 ? normalized : normalized.substring(idx + 1);
    }

    public static String parent(String location) {
        String normalized = normalize(location);
        int idx = normalized.lastIndexOf('/');
        return idx < 0 ? "" : normalized.substring(0, idx);
    }

    /**
     * The probe group letters found in the folders above the file, e.g. {@code ABC} for
     * {@code .../session_probeABC/file.dat}. A single digit 0-5 maps to the letters A-F.
     */
    public static @Nullable String subgroupTag(String location) {
        Matcher matcher = SUBGROUP_TAG.matcher(parent(location));
        if (!matcher.find()) {
            return null;
        }
        if (matcher.group(2) != null) {
            return matcher.group(2);
        }
        int digit = Integer.parseInt(matcher.group(3));
        return String.valueOf((char) ('A' + digit));
    }

    /**
     * The part of the location starting at the session folder. When the first element
     * carrying the session string is not the session folder itself (a probe folder or a
     * flat file named after the session) the session folder is prepended.
     */
    public static @Nullable String sessionRelativePath(String location, Session session) {
        String[] elements = normalize(location).split("/");
        for (int i = 0; i < elements.length; i++) {
            if (!elements[i].contains(session.folder())) {
                continue;
            }
            StringBuilder sb = new StringBuilder();
            if (!elements[i].equals(session.folder())) {
                sb.append(session.folder()).append('/');
            }
            for (int j = i; j < elements.length; j++) {
                sb.append(elements[j]);
                if (j < elements.length - 1) {
                    sb.append('/');
                }
            }
            return sb.toString();
        }
        return null;
    }
}
