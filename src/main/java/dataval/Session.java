package dataval;

import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A recording session identified by a folder name of the form {@code <id>_<subject>_<yyyyMMdd>}.
 */
public record Session(String folder, String id, String subjectId, @Nullable LocalDate date) {

    static final Pattern SESSION_PATTERN = Pattern.compile("[0-9]{8,}_[0-9]{6}_[0-9]{8}");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    /**
     * @return the first session found in the path or null for orphan files
     */
    public static @Nullable Session find(@Nullable String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = SESSION_PATTERN.matcher(path);
        if (!matcher.find()) {
            return null;
        }
        return parse(matcher.group());
    }

    static Session parse(String folder) {
        String[] parts = folder.split("_");
        LocalDate date;
        try {
            date = LocalDate.parse(parts[2], DATE_FORMAT);
        } catch (DateTimeParseException e) {
            // eight digits that are not a calendar date
            date = null;
        }
        return new Session(folder, parts[0], parts[1], date);
    }

    public boolean isOlderThan(int days, LocalDate today) {
        if (date == null) {
            return false;
        }
        return !date.isAfter(today.minusDays(days));
    }
}
