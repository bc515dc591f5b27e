package json.message;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/// Text forms of `Timestamp` and `Duration`: RFC 3339 in UTC with a `Z`
/// suffix, and signed seconds with an `s` suffix.
///
/// Both print a fraction of exactly 3, 6 or 9 digits, or none when the
/// nanoseconds are zero.
final class TimeFormats {

    static final int NANOS_PER_SECOND = 1_000_000_000;
    private static final int NANOS_PER_MILLISECOND = 1_000_000;
    private static final int NANOS_PER_MICROSECOND = 1_000;

    // 0001-01-01T00:00:00Z and 9999-12-31T23:59:59Z
    static final long MIN_TIMESTAMP_SECONDS = -62_135_596_800L;
    static final long MAX_TIMESTAMP_SECONDS = 253_402_300_799L;

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss", Locale.ROOT);

    private TimeFormats() {}

    /// Seconds and nanoseconds after normalization.
    record SecondsAndNanos(long seconds, int nanos) {}

    /// Folds whole seconds out of `nanos` and makes `nanos` non-negative.
    ///
    /// @throws ArithmeticException if the seconds overflow a `long`
    static SecondsAndNanos normalizeTimestamp(long seconds, int nanos) {
        final long extraSeconds = nanos / NANOS_PER_SECOND;
        seconds = Math.addExact(seconds, extraSeconds);
        nanos -= (int) (extraSeconds * NANOS_PER_SECOND);
        if (nanos < 0) {
            nanos += NANOS_PER_SECOND;
            seconds = Math.subtractExact(seconds, 1);
        }
        return new SecondsAndNanos(seconds, nanos);
    }

    /// Folds whole seconds out of `nanos` and gives `nanos` the sign of `seconds`.
    ///
    /// @throws ArithmeticException if the seconds overflow a `long`
    static SecondsAndNanos normalizeDuration(long seconds, int nanos) {
        final long extraSeconds = nanos / NANOS_PER_SECOND;
        seconds = Math.addExact(seconds, extraSeconds);
        nanos -= (int) (extraSeconds * NANOS_PER_SECOND);
        if (seconds < 0 && nanos > 0) {
            seconds += 1;
            nanos -= NANOS_PER_SECOND;
        } else if (seconds > 0 && nanos < 0) {
            seconds -= 1;
            nanos += NANOS_PER_SECOND;
        }
        return new SecondsAndNanos(seconds, nanos);
    }

    /// @throws JsonFormatException if the instant falls outside years 0001 to 9999
    static void appendTimestamp(StringBuilder builder, long seconds, int nanos) {
        final SecondsAndNanos normalized;
        try {
            normalized = normalizeTimestamp(seconds, nanos);
        } catch (ArithmeticException e) {
            throw outOfRange("Timestamp", seconds, nanos);
        }
        if (normalized.seconds() < MIN_TIMESTAMP_SECONDS || normalized.seconds() > MAX_TIMESTAMP_SECONDS) {
            throw outOfRange("Timestamp", seconds, nanos);
        }
        final var dateTime = LocalDateTime.ofEpochSecond(normalized.seconds(), 0, ZoneOffset.UTC);
        DATE_TIME.formatTo(dateTime, builder);
        appendNanos(builder, normalized.nanos());
        builder.append('Z');
    }

    /// @throws JsonFormatException if normalizing overflows the seconds
    static void appendDuration(StringBuilder builder, long seconds, int nanos) {
        final SecondsAndNanos normalized;
        try {
            normalized = normalizeDuration(seconds, nanos);
        } catch (ArithmeticException e) {
            throw outOfRange("Duration", seconds, nanos);
        }
        // zero seconds carries no sign of its own
        if (normalized.seconds() == 0 && normalized.nanos() < 0) {
            builder.append('-');
        }
        builder.append(normalized.seconds());
        appendNanos(builder, Math.abs(normalized.nanos()));
        builder.append('s');
    }

    private static JsonFormatException outOfRange(String type, long seconds, int nanos) {
        return new JsonFormatException(JsonFormatException.Error.MALFORMED_WELL_KNOWN_TYPE,
                type, "out of range: seconds=" + seconds + " nanos=" + nanos);
    }

    /// Appends `.` and 3, 6 or 9 digits; appends nothing for zero.
    static void appendNanos(StringBuilder builder, int nanos) {
        if (nanos == 0) {
            return;
        }
        builder.append('.');
        if (nanos % NANOS_PER_MILLISECOND == 0) {
            appendPadded(builder, nanos / NANOS_PER_MILLISECOND, 3);
        } else if (nanos % NANOS_PER_MICROSECOND == 0) {
            appendPadded(builder, nanos / NANOS_PER_MICROSECOND, 6);
        } else {
            appendPadded(builder, nanos, 9);
        }
    }

    private static void appendPadded(StringBuilder builder, int value, int width) {
        final var digits = Integer.toString(value);
        for (int i = digits.length(); i < width; i++) {
            builder.append('0');
        }
        builder.append(digits);
    }
}
