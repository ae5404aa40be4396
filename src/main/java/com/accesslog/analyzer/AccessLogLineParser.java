package com.accesslog.analyzer;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Parses individual access log lines into {@link LogRecord}s.
 * Thread-safe; holds no per-line state.
 */
public class AccessLogLineParser {

    // 31/Jul/2025:17:03:16, the zone offset that follows is dropped
    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("dd/MMM/uuuu:HH:mm:ss")
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    private final List<LineFormat> formats;

    public AccessLogLineParser() {
        this(LineFormat.defaults());
    }

    public AccessLogLineParser(List<LineFormat> formats) {
        if (formats == null || formats.isEmpty()) {
            throw new IllegalArgumentException("At least one line format is required");
        }
        this.formats = Collections.unmodifiableList(new ArrayList<>(formats));
    }

    public ParseResult parse(String line) {
        if (line == null) {
            return ParseResult.failure(ParseFailure.MALFORMED);
        }
        String trimmed = line.strip();

        for (LineFormat format : formats) {
            Matcher m = format.match(trimmed);
            if (m != null) {
                return extract(format, m);
            }
        }
        return ParseResult.failure(ParseFailure.MALFORMED);
    }

    private ParseResult extract(LineFormat format, Matcher m) {
        String rawTimestamp = m.group(LineFormat.GROUP_TIMESTAMP);
        LocalDateTime occurredAt = parseTimestamp(rawTimestamp);
        if (occurredAt == null) {
            return ParseResult.failure(ParseFailure.BAD_TIMESTAMP);
        }

        int status;
        try {
            status = Integer.parseInt(m.group(LineFormat.GROUP_STATUS));
        } catch (NumberFormatException e) {
            // digits only, so this is an overflow
            return ParseResult.failure(ParseFailure.MALFORMED);
        }

        String referer = SoftwareFamily.ABSENT;
        String userAgent = SoftwareFamily.ABSENT;
        if (format.hasClientFields()) {
            referer = m.group(LineFormat.GROUP_REFERER);
            userAgent = m.group(LineFormat.GROUP_USER_AGENT);
        }

        LogRecord record = new LogRecord(
                m.group(LineFormat.GROUP_ADDRESS),
                rawTimestamp,
                occurredAt,
                m.group(LineFormat.GROUP_METHOD),
                m.group(LineFormat.GROUP_PATH),
                m.group(LineFormat.GROUP_PROTOCOL),
                status,
                m.group(LineFormat.GROUP_SIZE),
                referer,
                userAgent,
                "");
        return ParseResult.success(record);
    }

    /**
     * Parses the date/time token of a bracketed timestamp, ignoring anything
     * after the first space. Returns null if the token is not valid.
     */
    static LocalDateTime parseTimestamp(String rawTimestamp) {
        if (rawTimestamp == null) {
            return null;
        }
        int space = rawTimestamp.indexOf(' ');
        String token = space >= 0 ? rawTimestamp.substring(0, space) : rawTimestamp;
        try {
            return LocalDateTime.parse(token, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public List<LineFormat> getFormats() {
        return formats;
    }
}
