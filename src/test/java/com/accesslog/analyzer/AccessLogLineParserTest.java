package com.accesslog.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class AccessLogLineParserTest {

    private final AccessLogLineParser parser = new AccessLogLineParser();

    @Test
    public void testParseFullLine() {
        String line = "173.252.95.18 - - [31/Jul/2025:17:03:16 -0700] \"GET /rental HTTP/1.1\" 301 292 \"-\" \"facebookexternalhit/1.1\"";
        ParseResult result = parser.parse(line);

        assertTrue(result.isSuccess());
        LogRecord record = result.getRecord();
        assertEquals("173.252.95.18", record.getClientAddress());
        assertEquals("31/Jul/2025:17:03:16 -0700", record.getRawTimestamp());
        assertEquals("GET", record.getMethod());
        assertEquals("/rental", record.getPath());
        assertEquals("HTTP/1.1", record.getProtocolVersion());
        assertEquals(301, record.getStatusCode());
        assertEquals("292", record.getResponseSize());
        assertEquals("-", record.getReferer());
        assertEquals("facebookexternalhit/1.1", record.getUserAgent());
        assertEquals(LocalDateTime.of(2025, 7, 31, 17, 3, 16), record.getOccurredAt());
        assertEquals(SoftwareFamily.FACEBOOK_BOT, record.getSoftwareFamily());
        assertEquals("", record.getSourceFile());
    }

    @Test
    public void testParseMinimalLine() {
        String line = "199.72.81.55 - - [01/Jul/1995:00:00:01 -0400] \"GET /history/apollo/ HTTP/1.0\" 200 6245";
        ParseResult result = parser.parse(line);

        assertTrue(result.isSuccess());
        LogRecord record = result.getRecord();
        assertEquals("199.72.81.55", record.getClientAddress());
        assertEquals("/history/apollo/", record.getPath());
        assertEquals(200, record.getStatusCode());
        assertEquals("6245", record.getResponseSize());
        assertEquals("-", record.getReferer());
        assertEquals("-", record.getUserAgent());
        assertEquals(SoftwareFamily.UNKNOWN, record.getSoftwareFamily());
        assertEquals(LocalDateTime.of(1995, 7, 1, 0, 0, 1), record.getOccurredAt());
    }

    @Test
    public void testInvalidTimestamp() {
        String line = "10.0.0.1 - - [invalid-timestamp] \"GET / HTTP/1.1\" 200 10 \"-\" \"curl/8.0\"";
        ParseResult result = parser.parse(line);

        assertFalse(result.isSuccess());
        assertEquals(ParseFailure.BAD_TIMESTAMP, result.getFailure());
        assertThrows(IllegalStateException.class, result::getRecord);
    }

    @Test
    public void testImpossibleDateIsBadTimestamp() {
        String line = "10.0.0.1 - - [31/Feb/2025:10:00:00 +0000] \"GET / HTTP/1.1\" 200 10";
        assertEquals(ParseFailure.BAD_TIMESTAMP, parser.parse(line).getFailure());
    }

    @Test
    public void testMalformedLines() {
        assertEquals(ParseFailure.MALFORMED, parser.parse("this is not a log line").getFailure());
        assertEquals(ParseFailure.MALFORMED, parser.parse("").getFailure());
        assertEquals(ParseFailure.MALFORMED, parser.parse(null).getFailure());
        // minimal shape must cover the whole line
        assertEquals(ParseFailure.MALFORMED,
                parser.parse("10.0.0.1 - - [01/Jul/1995:00:00:01 -0400] \"GET / HTTP/1.0\" 200 10 trailing").getFailure());
        assertEquals(ParseFailure.MALFORMED,
                parser.parse("10.0.0.1 - - [01/Jul/1995:00:00:01 -0400] \"GET / HTTP/1.0\" abc 10").getFailure());
    }

    @Test
    public void testFullLineToleratesTrailingText() {
        String line = "10.0.0.1 - - [01/Aug/2025:08:15:00 -0700] \"POST /api HTTP/2.0\" 201 - \"https://example.com/\" \""
                + TestRecords.CHROME_UA + "\" 0.123";
        ParseResult result = parser.parse(line);

        assertTrue(result.isSuccess());
        assertEquals("-", result.getRecord().getResponseSize());
        assertEquals("https://example.com/", result.getRecord().getReferer());
        assertEquals(SoftwareFamily.CHROME, result.getRecord().getSoftwareFamily());
    }

    @Test
    public void testSurroundingWhitespaceIsTrimmed() {
        String line = "  199.72.81.55 - - [01/Jul/1995:00:00:01 -0400] \"GET / HTTP/1.0\" 200 6245 \n";
        assertTrue(parser.parse(line).isSuccess());
    }

    @Test
    public void testMonthIsCaseInsensitive() {
        assertEquals(LocalDateTime.of(2025, 7, 31, 17, 3, 16),
                AccessLogLineParser.parseTimestamp("31/JUL/2025:17:03:16 -0700"));
        assertNull(AccessLogLineParser.parseTimestamp("2025-07-31T17:03:16"));
        assertNull(AccessLogLineParser.parseTimestamp(null));
    }

    @Test
    public void testCustomFormatList() {
        AccessLogLineParser minimalOnly = new AccessLogLineParser(List.of(LineFormat.MINIMAL));
        String full = TestRecords.line("10.0.0.1", "01/Aug/2025:08:15:00", "/", TestRecords.CHROME_UA);
        assertFalse(minimalOnly.parse(full).isSuccess());

        assertThrows(IllegalArgumentException.class, () -> new AccessLogLineParser(Collections.emptyList()));
    }
}
