package gr.imsi.athenarc.tsview.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;


public class DateTimeUtil {

    public static final ZoneId UTC = ZoneId.of("UTC");
    public final static String DEFAULT_FORMAT = "yyyy-MM-dd[ HH:mm:ss[.SSS]]";
    public final static DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern(DEFAULT_FORMAT);

    // Tried in order when sniffing a text value for a timestamp
    private static final List<DateTimeFormatter> LOCAL_FORMATTERS = List.of(
            DEFAULT_FORMATTER,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy/MM/dd[ HH:mm:ss[.SSS]]"));

    private DateTimeUtil() {}

    public static long parseDateTimeString(String s) {
        return parseDateTimeStringInternal(s, DEFAULT_FORMATTER, UTC);
    }

    private static long parseDateTimeStringInternal(String s, DateTimeFormatter formatter, ZoneId zoneId) {
        try {
            // Try parsing as LocalDateTime
            return LocalDateTime.parse(s, formatter).atZone(zoneId).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            // If parsing as LocalDateTime fails, try parsing as LocalDate
            return LocalDate.parse(s, formatter).atStartOfDay(zoneId).toInstant().toEpochMilli();
        }
    }

    /**
     * Attempts to read a text value as a timestamp, accepting dates, local date-times in a few
     * common layouts and offset date-times. Local values are taken to be UTC.
     *
     * @param s the text to parse
     * @return epoch milliseconds, or {@code null} if the text is not a timestamp
     */
    public static Long tryParse(String s) {
        if (s == null || s.isEmpty() || !Character.isDigit(s.charAt(0))) {
            return null;
        }
        for (DateTimeFormatter formatter : LOCAL_FORMATTERS) {
            try {
                return parseDateTimeStringInternal(s, formatter, UTC);
            } catch (DateTimeParseException e) {
                // next layout
            }
        }
        try {
            return OffsetDateTime.parse(s).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String format(final long timeStamp) {
        return format(timeStamp, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"));
    }

    public static String format(final long timeStamp, final DateTimeFormatter formatter) {
        return Instant.ofEpochMilli(timeStamp)
                .atZone(UTC)
                .format(formatter);
    }
}
