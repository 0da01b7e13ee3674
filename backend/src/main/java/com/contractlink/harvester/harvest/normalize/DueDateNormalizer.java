package com.contractlink.harvester.harvest.normalize;

import com.contractlink.harvester.harvest.model.ContractRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DueDateNormalizer {
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        formatter("uuuu-MM-dd"),
        formatter("MM/dd/uuuu"),
        formatter("M/d/uuuu"),
        formatter("MM-dd-uuuu"),
        formatter("M-d-uuuu"),
        formatter("uuuu/MM/dd"),
        formatter("uuuu/M/d"),
        formatter("MMM d, uuuu"),
        formatter("MMMM d, uuuu"),
        formatter("MMM. d, uuuu"),
        formatter("MMM d uuuu"),
        formatter("MMMM d uuuu"),
        formatter("d MMM uuuu"),
        formatter("d MMMM uuuu"),
        formatter("dd-MMM-uuuu"),
        formatter("d-MMM-uuuu")
    );
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        formatter("MM/dd/uuuu h:mm a"),
        formatter("M/d/uuuu h:mm a"),
        formatter("MM/dd/uuuu hh:mm a"),
        formatter("MM/dd/uuuu HH:mm")
    );
    private static final List<Pattern> DATE_TOKENS = List.of(
        Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d{1,9})?)?(?:Z|[+-]\\d{2}:?\\d{2})?"),
        Pattern.compile("\\d{1,2}/\\d{1,2}/\\d{4}\\s+\\d{1,2}:\\d{2}\\s*[AaPp][Mm]"),
        Pattern.compile("\\d{4}[-/]\\d{1,2}[-/]\\d{1,2}"),
        Pattern.compile("\\d{1,2}[/-]\\d{1,2}[/-]\\d{4}"),
        Pattern.compile("\\d{1,2}-[A-Za-z]{3}-\\d{4}"),
        Pattern.compile("[A-Za-z]{3,9}\\.?\\s+\\d{1,2},?\\s+\\d{4}"),
        Pattern.compile("\\d{1,2}\\s+[A-Za-z]{3,9}\\.?\\s+\\d{4}")
    );
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SEPT = Pattern.compile("(?i)\\bsept\\b");
    private static final Pattern MERIDIEM = Pattern.compile("(\\d)\\s*([AaPp])\\.?[Mm]\\.?(?![A-Za-z])");

    private DueDateNormalizer() {
    }

    /**
     * Returns the calendar date in {@code raw}, or null when no supported format is found. Never throws.
     */
    public static LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String candidate = cleanup(raw);
        LocalDate whole = parseWhole(candidate);
        if (whole != null) {
            return whole;
        }
        for (Pattern token : DATE_TOKENS) {
            Matcher matcher = token.matcher(candidate);
            while (matcher.find()) {
                LocalDate parsed = parseWhole(cleanup(matcher.group()));
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        return null;
    }

    public static String toIso(String raw) {
        LocalDate parsed = parse(raw);
        return parsed == null ? ContractRecord.UNKNOWN_DUE_DATE : parsed.toString();
    }

    private static LocalDate parseWhole(String candidate) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(candidate, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(candidate, format).toLocalDate();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return OffsetDateTime.parse(candidate, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // not an offset timestamp
        }
        try {
            return LocalDateTime.parse(candidate, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // not a local timestamp
        }
        try {
            return ZonedDateTime.parse(candidate, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static String cleanup(String raw) {
        String collapsed = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        collapsed = SEPT.matcher(collapsed).replaceAll("Sep");
        return MERIDIEM.matcher(collapsed).replaceAll("$1 $2M");
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
