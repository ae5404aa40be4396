package com.accesslog.analyzer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.accesslog.filter.FileSelectionConfig;

/**
 * Reads every candidate log file in a directory and parses it into records.
 * Per-line and per-file failures are counted and logged, never thrown.
 */
public class LogFileIngestor {

    private static final Logger logger = LoggerFactory.getLogger(LogFileIngestor.class);

    private static final int BUFFER_SIZE = 1024 * 1024;

    private final AccessLogLineParser lineParser;
    private final FileSelectionConfig selectionConfig;

    public LogFileIngestor() {
        this(new AccessLogLineParser(), new FileSelectionConfig());
    }

    public LogFileIngestor(AccessLogLineParser lineParser, FileSelectionConfig selectionConfig) {
        this.lineParser = lineParser;
        this.selectionConfig = selectionConfig;
    }

    public List<LogRecord> ingest(Path directory, Integer maxRecords) {
        return ingestWithStats(directory, maxRecords).getRecords();
    }

    /**
     * @param maxRecords global record cap; null or non-positive means no cap
     */
    public IngestResult ingestWithStats(Path directory, Integer maxRecords) {
        List<Path> candidates = findLogFiles(directory);
        logger.info("Found {} log files in {}", candidates.size(), directory);

        int limit = (maxRecords != null && maxRecords > 0) ? maxRecords : Integer.MAX_VALUE;
        FileCounters counters = new FileCounters();
        List<LogRecord> records = new ArrayList<>();
        int filesRead = 0;
        int filesFailed = 0;
        boolean capReached = false;

        for (Path file : candidates) {
            if (records.size() >= limit) {
                capReached = true;
                logger.info("Reached max entries limit ({}), stopping parsing", limit);
                break;
            }
            try {
                List<LogRecord> fileRecords = readFile(file, limit - records.size(), counters);
                records.addAll(fileRecords);
                filesRead++;
                logger.info("Parsed {} entries from {}", fileRecords.size(), file.getFileName());
            } catch (IOException e) {
                filesFailed++;
                logger.error("Error reading {}: {}", file, e.getMessage(), e);
            }
        }
        if (!capReached && records.size() >= limit) {
            capReached = true;
            logger.info("Reached max entries limit ({}), stopping parsing", limit);
        }

        IngestStats stats = new IngestStats(candidates.size(), filesRead, filesFailed, counters.linesRead,
                records.size(), counters.malformed, counters.badTimestamp, capReached);
        logger.info("Successfully parsed {} total log entries ({})", records.size(), stats);
        return new IngestResult(records, stats);
    }

    /**
     * Candidate files directly inside the directory, sorted by name.
     * Returns an empty list if the directory is missing or cannot be listed.
     */
    public List<Path> findLogFiles(Path directory) {
        List<Path> logFiles = new ArrayList<>();
        if (directory == null || !Files.isDirectory(directory)) {
            logger.warn("Logs directory does not exist: {}", directory);
            return logFiles;
        }

        try (DirectoryStream<Path> stream = openDirectory(directory)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path) && selectionConfig.isCandidate(path.getFileName().toString())) {
                    logFiles.add(path);
                }
            }
        } catch (IOException e) {
            logger.error("Cannot list logs directory {}: {}", directory, e.getMessage(), e);
            return new ArrayList<>();
        } catch (DirectoryIteratorException e) {
            // iteration failures arrive wrapped
            logger.error("Cannot list logs directory {}: {}", directory, e.getCause().getMessage(), e);
            return new ArrayList<>();
        }

        logFiles.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return logFiles;
    }

    DirectoryStream<Path> openDirectory(Path directory) throws IOException {
        return Files.newDirectoryStream(directory);
    }

    private List<LogRecord> readFile(Path file, int remaining, FileCounters counters) throws IOException {
        String fileName = file.getFileName().toString();
        List<LogRecord> entries = new ArrayList<>();
        long lines = 0;
        long malformed = 0;
        long badTimestamp = 0;

        try (BufferedReader in = createReader(file)) {
            String line;
            while (entries.size() < remaining && (line = in.readLine()) != null) {
                lines++;
                ParseResult result = lineParser.parse(line);
                if (result.isSuccess()) {
                    entries.add(result.getRecord().withSourceFile(fileName));
                } else if (result.getFailure() == ParseFailure.BAD_TIMESTAMP) {
                    badTimestamp++;
                } else {
                    malformed++;
                }
            }
        }

        // only counted once the file was read through without an I/O error
        counters.linesRead += lines;
        counters.malformed += malformed;
        counters.badTimestamp += badTimestamp;
        if (malformed + badTimestamp > 0) {
            logger.debug("Skipped {} malformed and {} bad timestamp lines in {}", malformed, badTimestamp, fileName);
        }
        return entries;
    }

    private BufferedReader createReader(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);

        InputStream in = Files.newInputStream(file);
        try {
            if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz")) {
                in = new GZIPInputStream(in);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, decoder), BUFFER_SIZE);
    }

    private static class FileCounters {
        long linesRead;
        long malformed;
        long badTimestamp;
    }
}
