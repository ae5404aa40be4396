package com.accesslog.analyzer;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.accesslog.analyzer.model.AnalysisReport;
import com.accesslog.analyzer.model.Granularity;
import com.accesslog.analyzer.model.LogSummary;
import com.accesslog.analyzer.service.LogAnalysisService;
import com.accesslog.filter.FileSelectionConfig;
import com.accesslog.filter.FilterCriteria;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Access log analyzer: loads a directory of web server access logs and reports
 * traffic over time, the busiest client addresses and the browser mix.
 */
@Command(name = "accessLogAnalyzer", mixinStandardHelpOptions = true, version = "1.0",
         description = "Analyze web server access logs with optional filters, console tables, HTML and JSON reports")
public class AccessLogAnalyzer implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(AccessLogAnalyzer.class);

    static final int EXIT_OK = 0;
    static final int EXIT_REPORT_FAILED = 1;
    static final int EXIT_INVALID_INPUT = 2;

    @Option(names = { "-d", "--dir" }, description = "Directory containing access log files (default: logs)")
    private String logsDir;

    @Option(names = { "--max-entries" }, description = "Maximum number of log entries to load (default: 85000)")
    private Integer maxEntries;

    @Option(names = { "--config" }, description = "Configuration properties file")
    private String configFile;

    @Option(names = { "--granularity" }, description = "Traffic granularity: hourly or daily (default: hourly)")
    private String granularity = Granularity.HOURLY.getName();

    @Option(names = { "--date" }, description = "Only include requests on this date (YYYY-MM-DD)")
    private String date;

    @Option(names = { "--hour" }, description = "Only include requests in this hour of day (0-23)")
    private Integer hour;

    @Option(names = { "--ip" }, description = "Only include requests from this client address")
    private String ip;

    @Option(names = { "--browser" }, description = "Only include requests from this browser family, e.g. Chrome or 'Bot/Crawler'")
    private String browser;

    @Option(names = { "--top" }, description = "Number of client addresses to report (default: 20)")
    private Integer top;

    @Option(names = { "--html" }, description = "HTML output file for interactive report (default: report.html)")
    private String htmlOutputFile = "report.html";

    @Option(names = { "--json" }, description = "JSON output file for structured report data")
    private String jsonOutputFile;

    @Option(names = { "--json-only" }, description = "Generate only JSON output (skip HTML)")
    private boolean jsonOnly = false;

    @Option(names = { "--text" }, description = "Enable text output to console")
    private boolean textOutput = false;

    @Option(names = { "--watch" }, description = "Reload logs and regenerate reports every N seconds (default: 0, run once)")
    private int watchSeconds = 0;

    @Option(names = { "--debug" }, description = "Enable debug logging")
    private boolean debug = false;

    private Map<String, String> environment = System.getenv();

    private AnalyzerSettings settings;

    @Override
    public Integer call() throws Exception {
        Properties props = loadConfiguration();
        try {
            settings = AnalyzerSettings.load(props, environment);
            applyOptions(settings);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid settings: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }
        if (settings.isDebug()) {
            enableDebugLogging();
        }
        logger.debug("Effective settings: {}", settings);

        FilterCriteria criteria;
        try {
            criteria = buildCriteria();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid filter: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        FileSelectionConfig selectionConfig = new FileSelectionConfig();
        if (props != null) {
            selectionConfig.loadFromProperties(props);
        }
        LogFileIngestor ingestor = new LogFileIngestor(new AccessLogLineParser(), selectionConfig);
        LogRecordStore store = new LogRecordStore(ingestor, Paths.get(settings.getLogsDir()),
                settings.getMaxLogEntries());

        System.out.println("Access Log Analyzer");
        System.out.println("Processing logs in " + store.getDirectory().toAbsolutePath() + "...");

        if (watchSeconds == 0) {
            return runOnce(store, criteria);
        }
        watch(store, criteria);
        return EXIT_OK;
    }

    private Properties loadConfiguration() {
        if (configFile == null) {
            return null;
        }
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configFile)) {
            props.load(in);
            logger.info("Loaded configuration from: {}", configFile);
            return props;
        } catch (IOException e) {
            logger.warn("Could not load config file: {}. Using defaults.", configFile);
            return null;
        }
    }

    private void applyOptions(AnalyzerSettings target) {
        if (watchSeconds < 0) {
            throw new IllegalArgumentException("--watch must be 0 (run once) or a positive number of seconds: "
                    + watchSeconds);
        }
        if (logsDir != null) {
            target.setLogsDir(logsDir);
        }
        if (maxEntries != null) {
            target.setMaxLogEntries(AnalyzerSettings.parsePositiveInt("--max-entries", String.valueOf(maxEntries)));
        }
        if (top != null) {
            target.setDefaultIpLimit(AnalyzerSettings.parsePositiveInt("--top", String.valueOf(top)));
        }
        if (debug) {
            target.setDebug(true);
        }
    }

    private FilterCriteria buildCriteria() {
        SoftwareFamily family = null;
        if (browser != null && !browser.trim().isEmpty()) {
            family = SoftwareFamily.findByName(browser.trim());
            if (family == null) {
                throw new IllegalArgumentException("Unknown browser: " + browser);
            }
        }
        return new FilterCriteria(date, hour, ip, family);
    }

    private void enableDebugLogging() {
        Logger appLogger = LoggerFactory.getLogger("com.accesslog");
        if (appLogger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) appLogger).setLevel(Level.DEBUG);
            logger.debug("Debug logging enabled");
        }
    }

    int runOnce(LogRecordStore store, FilterCriteria criteria) {
        LogSnapshot snapshot = store.refresh();
        AnalysisReport report = buildReport(snapshot, criteria, Granularity.fromString(granularity),
                settings.getDefaultIpLimit());
        LogSummary summary = report.getSummary();
        logger.info("Summary: {}", summary);
        if (snapshot.getStats().getSkippedLines() > 0) {
            logger.info("Skipped {} unparseable lines", snapshot.getStats().getSkippedLines());
        }

        if (textOutput) {
            new TextReportGenerator().report(report);
        }

        try {
            if (jsonOutputFile != null) {
                System.out.println("Generating JSON report: " + jsonOutputFile);
                JsonReportGenerator.generateReport(jsonOutputFile, report);
            }
            if (!jsonOnly) {
                System.out.println("Generating HTML report: " + htmlOutputFile);
                HtmlReportGenerator.generateReport(htmlOutputFile, report);
            }
        } catch (IOException e) {
            logger.error("Failed to write report: {}", e.getMessage(), e);
            return EXIT_REPORT_FAILED;
        }

        System.out.println("Analysis complete!");
        return EXIT_OK;
    }

    /**
     * Filters the snapshot and builds every view. The summary always describes
     * the full record set; the views describe the filtered one.
     */
    static AnalysisReport buildReport(LogSnapshot snapshot, FilterCriteria criteria, Granularity requested,
            int ipLimit) {
        LogAnalysisService all = new LogAnalysisService(snapshot.getRecords());
        LogAnalysisService filtered = all.filter(criteria);
        Granularity effective = Granularity.resolve(requested, criteria);
        if (effective != requested) {
            logger.debug("Using {} granularity for filters {}", effective, criteria);
        }
        Path dir = snapshot.getSourceDirectory();
        return new AnalysisReport(dir != null ? dir.toString() : null, Instant.now(), criteria, all.summary(),
                filtered.getRecords().size(), filtered.trafficOverTime(effective),
                filtered.addressFrequency(ipLimit), filtered.softwareDistribution());
    }

    private void watch(LogRecordStore store, FilterCriteria criteria) throws InterruptedException {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(executor)));

        logger.info("Watching {} every {} seconds, press Ctrl+C to stop", store.getDirectory(), watchSeconds);
        scheduleRefresh(executor, store, criteria, watchSeconds);

        while (!executor.isTerminated()) {
            executor.awaitTermination(1, TimeUnit.MINUTES);
        }
    }

    /**
     * Runs a refresh and report cycle now and then {@code delaySeconds} after each one finishes.
     */
    ScheduledFuture<?> scheduleRefresh(ScheduledExecutorService executor, LogRecordStore store,
            FilterCriteria criteria, long delaySeconds) {
        return executor.scheduleWithFixedDelay(() -> {
            try {
                runOnce(store, criteria);
            } catch (RuntimeException e) {
                // an escaped exception would cancel the schedule
                logger.error("Refresh failed: {}", e.getMessage(), e);
            }
        }, 0, delaySeconds, TimeUnit.SECONDS);
    }

    static void shutdown(ScheduledExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("Executor did not terminate gracefully");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Executor interrupted");
            Thread.currentThread().interrupt();
        }
    }

    void setEnvironment(Map<String, String> environment) {
        this.environment = environment;
    }

    AnalyzerSettings getSettings() {
        return settings;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AccessLogAnalyzer()).execute(args);
        System.exit(exitCode);
    }
}
