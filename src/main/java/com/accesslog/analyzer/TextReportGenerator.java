package com.accesslog.analyzer;

import java.io.PrintStream;

import com.accesslog.analyzer.model.AnalysisReport;
import com.accesslog.analyzer.model.CategoryDistribution;
import com.accesslog.analyzer.model.CountEntry;
import com.accesslog.analyzer.model.FrequencyTable;
import com.accesslog.analyzer.model.Granularity;
import com.accesslog.analyzer.model.LogSummary;
import com.accesslog.analyzer.model.TrafficBucket;
import com.accesslog.analyzer.model.TrafficSeries;

/**
 * Prints the analysis as fixed-width console tables.
 */
public class TextReportGenerator {

    private static final int MAX_KEY_WIDTH = 45;

    private final PrintStream out;

    public TextReportGenerator() {
        this(System.out);
    }

    public TextReportGenerator(PrintStream out) {
        this.out = out;
    }

    public void report(AnalysisReport report) {
        reportSummary(report);
        reportTraffic(report.getTraffic());
        reportAddresses(report.getTopAddresses());
        reportSoftwareFamilies(report.getSoftwareFamilies());
    }

    private void reportSummary(AnalysisReport report) {
        LogSummary summary = report.getSummary();
        out.println();
        out.println("Summary");
        out.println("=".repeat(40));
        out.println(String.format("%-20s %s", "Source", report.getSourceDirectory()));
        out.println(String.format("%-20s %d", "Total requests", summary.getTotalEntries()));
        out.println(String.format("%-20s %d", "Unique IPs", summary.getUniqueAddresses()));
        out.println(String.format("%-20s %s", "Date range", summary.getDateRange()));
        out.println(String.format("%-20s %d", "Files processed", summary.getFilesProcessed().size()));
        if (!report.getCriteria().isEmpty()) {
            out.println(String.format("%-20s %s", "Filters", report.getCriteria()));
            out.println(String.format("%-20s %d", "Matching requests", report.getMatchingEntries()));
        }
    }

    private void reportTraffic(TrafficSeries series) {
        String keyHeader = series.getGranularity() == Granularity.HOURLY ? "Hour" : "Date";
        printHeader(series.getTitle(), keyHeader, 10);
        if (series.isEmpty()) {
            return;
        }
        for (TrafficBucket bucket : series.getBuckets()) {
            out.println(String.format("%-10s %10d", bucket.getLabel(), bucket.getCount()));
        }
    }

    private void reportAddresses(FrequencyTable table) {
        int width = table.getEntries().stream()
                .mapToInt(e -> e.getKey().length())
                .max()
                .orElse(0);
        width = Math.min(Math.max(width, "IP Address".length()), MAX_KEY_WIDTH);
        printHeader(table.getTitle(), "IP Address", width);
        for (CountEntry<String> entry : table.getEntries()) {
            out.println(String.format("%-" + width + "s %10d", truncate(entry.getKey(), width), entry.getCount()));
        }
    }

    private void reportSoftwareFamilies(CategoryDistribution distribution) {
        printHeader(distribution.getTitle(), "Browser", 15);
        long total = distribution.getTotal();
        for (CountEntry<SoftwareFamily> entry : distribution.getEntries()) {
            double pct = total > 0 ? entry.getCount() * 100.0 / total : 0;
            out.println(String.format("%-15s %10d %7.1f%%", entry.getKey().getDisplayName(), entry.getCount(), pct));
        }
    }

    private void printHeader(String title, String keyHeader, int keyWidth) {
        out.println();
        out.println(title);
        out.println(String.format("%-" + keyWidth + "s %10s", keyHeader, "Requests"));
        out.println("=".repeat(keyWidth + 11));
    }

    private static String truncate(String text, int width) {
        if (text.length() <= width) {
            return text;
        }
        return text.substring(0, width - 3) + "...";
    }
}
