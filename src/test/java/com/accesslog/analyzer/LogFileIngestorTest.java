package com.accesslog.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.accesslog.filter.FileSelectionConfig;

public class LogFileIngestorTest {

    private static final String THREE_VALID_ONE_MALFORMED = """
            10.0.0.1 - - [31/Jul/2025:17:03:16 -0700] "GET /a HTTP/1.1" 200 10 "-" "curl/8.0"
            10.0.0.2 - - [31/Jul/2025:17:04:16 -0700] "GET /b HTTP/1.1" 200 20 "-" "curl/8.0"
            garbage line that matches nothing
            10.0.0.3 - - [31/Jul/2025:17:05:16 -0700] "GET /c HTTP/1.1" 404 - "-" "curl/8.0"
            """;

    @TempDir
    Path dir;

    private final LogFileIngestor ingestor = new LogFileIngestor();

    @Test
    public void testValidAndMalformedLines() throws IOException {
        Files.writeString(dir.resolve("access.log"), THREE_VALID_ONE_MALFORMED);

        IngestResult result = ingestor.ingestWithStats(dir, null);
        List<LogRecord> records = result.getRecords();

        assertEquals(3, records.size());
        assertEquals("/a", records.get(0).getPath());
        assertEquals("/b", records.get(1).getPath());
        assertEquals("/c", records.get(2).getPath());
        assertEquals("access.log", records.get(0).getSourceFile());

        IngestStats stats = result.getStats();
        assertEquals(1, stats.filesFound);
        assertEquals(1, stats.filesRead);
        assertEquals(4, stats.linesRead);
        assertEquals(1, stats.malformedLines);
        assertEquals(0, stats.badTimestampLines);
        assertFalse(stats.capReached);
    }

    @Test
    public void testBadTimestampCounted() throws IOException {
        Files.writeString(dir.resolve("access.log"),
                "10.0.0.1 - - [invalid-timestamp] \"GET / HTTP/1.1\" 200 1 \"-\" \"curl/8.0\"\n"
                        + TestRecords.line("10.0.0.2", "01/Aug/2025:10:00:00", "/", "curl/8.0") + "\n");

        IngestResult result = ingestor.ingestWithStats(dir, 0);
        assertEquals(1, result.getRecords().size());
        assertEquals(1, result.getStats().badTimestampLines);
        assertEquals(1, result.getStats().getSkippedLines());
    }

    @Test
    public void testCapReturnsFirstRecordsInOrder() throws IOException {
        Files.writeString(dir.resolve("access.log"), THREE_VALID_ONE_MALFORMED);

        List<LogRecord> records = ingestor.ingest(dir, 2);

        assertEquals(2, records.size());
        assertEquals("10.0.0.1", records.get(0).getClientAddress());
        assertEquals("10.0.0.2", records.get(1).getClientAddress());
    }

    @Test
    public void testCapStopsBeforeLaterFiles() throws IOException {
        Files.writeString(dir.resolve("a-access.log"), THREE_VALID_ONE_MALFORMED);
        // would count as a failed file if it were ever opened
        Files.write(dir.resolve("b-access.log.gz"), "not gzip".getBytes(StandardCharsets.UTF_8));

        IngestResult result = ingestor.ingestWithStats(dir, 3);

        assertEquals(3, result.getRecords().size());
        assertEquals(2, result.getStats().filesFound);
        assertEquals(1, result.getStats().filesRead);
        assertEquals(0, result.getStats().filesFailed);
        assertTrue(result.getStats().capReached);
    }

    @Test
    public void testUnreadableFileDoesNotAbortIngestion() throws IOException {
        Files.write(dir.resolve("a-access.log.gz"), "not gzip".getBytes(StandardCharsets.UTF_8));
        Files.writeString(dir.resolve("b-access.log"), THREE_VALID_ONE_MALFORMED);

        IngestResult result = ingestor.ingestWithStats(dir, null);

        assertEquals(3, result.getRecords().size());
        assertEquals(1, result.getStats().filesFailed);
        assertEquals(1, result.getStats().filesRead);
    }

    @Test
    public void testFilesReadInNameOrder() throws IOException {
        Files.writeString(dir.resolve("rental-2.log"),
                TestRecords.line("10.0.0.2", "02/Aug/2025:10:00:00", "/two", "curl/8.0") + "\n");
        Files.writeString(dir.resolve("rental-1.log"),
                TestRecords.line("10.0.0.1", "01/Aug/2025:10:00:00", "/one", "curl/8.0") + "\n");

        List<LogRecord> records = ingestor.ingest(dir, null);

        assertEquals(List.of("/one", "/two"), records.stream().map(LogRecord::getPath).collect(Collectors.toList()));
        assertEquals("rental-1.log", records.get(0).getSourceFile());
    }

    @Test
    public void testGzipFile() throws IOException {
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(dir.resolve("access.log.gz")))) {
            out.write(THREE_VALID_ONE_MALFORMED.getBytes(StandardCharsets.UTF_8));
        }

        assertEquals(3, ingestor.ingest(dir, null).size());
    }

    @Test
    public void testInvalidUtf8BytesAreDropped() throws IOException {
        byte[] prefix = TestRecords.line("10.0.0.1", "01/Aug/2025:10:00:00", "/caf", "curl/8.0")
                .replace("/caf", "/caf\u0000").getBytes(StandardCharsets.UTF_8);
        // replace the marker with a lone continuation byte
        for (int i = 0; i < prefix.length; i++) {
            if (prefix[i] == 0) {
                prefix[i] = (byte) 0x80;
            }
        }
        Files.write(dir.resolve("access.log"), prefix);

        List<LogRecord> records = ingestor.ingest(dir, null);
        assertEquals(1, records.size());
        assertEquals("/caf", records.get(0).getPath());
    }

    @Test
    public void testNonCandidateFilesIgnored() throws IOException {
        Files.writeString(dir.resolve("notes.txt"), THREE_VALID_ONE_MALFORMED);
        Files.createDirectory(dir.resolve("access-archive"));

        assertTrue(ingestor.findLogFiles(dir).isEmpty());
        assertTrue(ingestor.ingest(dir, null).isEmpty());
    }

    @Test
    public void testConfiguredPatterns() throws IOException {
        Files.writeString(dir.resolve("notes.txt"), THREE_VALID_ONE_MALFORMED);
        Properties props = new Properties();
        props.setProperty(FileSelectionConfig.ADD_KEY, "notes");
        FileSelectionConfig config = new FileSelectionConfig();
        config.loadFromProperties(props);

        LogFileIngestor custom = new LogFileIngestor(new AccessLogLineParser(), config);
        assertEquals(3, custom.ingest(dir, null).size());
    }

    @Test
    public void testMissingDirectory() {
        IngestResult result = ingestor.ingestWithStats(dir.resolve("missing"), null);

        assertTrue(result.getRecords().isEmpty());
        assertEquals(0, result.getStats().filesFound);
    }

    @Test
    public void testEmptyDirectory() {
        assertTrue(ingestor.ingest(dir, 100).isEmpty());
    }

    @Test
    public void testListingFailureMidIteration() throws IOException {
        Files.writeString(dir.resolve("access.log"), THREE_VALID_ONE_MALFORMED);
        LogFileIngestor failing = new LogFileIngestor() {
            @Override
            DirectoryStream<Path> openDirectory(Path directory) {
                return new DirectoryStream<Path>() {
                    @Override
                    public Iterator<Path> iterator() {
                        return new Iterator<Path>() {
                            @Override
                            public boolean hasNext() {
                                throw new DirectoryIteratorException(new IOException("device went away"));
                            }

                            @Override
                            public Path next() {
                                throw new NoSuchElementException();
                            }
                        };
                    }

                    @Override
                    public void close() {
                    }
                };
            }
        };

        assertTrue(failing.findLogFiles(dir).isEmpty());
        IngestResult result = failing.ingestWithStats(dir, null);
        assertTrue(result.getRecords().isEmpty());
        assertEquals(0, result.getStats().filesFound);
    }
}
