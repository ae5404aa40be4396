package com.accesslog.analyzer;

import java.io.FileWriter;
import java.io.IOException;

import com.accesslog.analyzer.model.AnalysisReport;
import com.accesslog.analyzer.model.CategoryDistribution;
import com.accesslog.analyzer.model.CountEntry;
import com.accesslog.analyzer.model.FrequencyTable;
import com.accesslog.analyzer.model.LogSummary;
import com.accesslog.analyzer.model.TrafficBucket;
import com.accesslog.analyzer.model.TrafficSeries;
import com.accesslog.filter.FilterCriteria;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Generates structured JSON reports from access log analysis data
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void generateReport(String fileName, AnalysisReport report) throws IOException {
        try (FileWriter writer = new FileWriter(fileName)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, toJson(report));
        }
    }

    public static ObjectNode toJson(AnalysisReport report) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", report.getGeneratedAt() != null ? report.getGeneratedAt().toString() : null);
        metadata.put("sourceDirectory", report.getSourceDirectory());
        metadata.put("granularity", report.getTraffic().getGranularity().getName());
        metadata.set("filters", generateFiltersJson(report.getCriteria()));
        metadata.put("matchingEntries", report.getMatchingEntries());
        root.set("metadata", metadata);

        root.set("summary", generateSummaryJson(report.getSummary()));
        root.set("traffic", generateTrafficJson(report.getTraffic()));
        root.set("topAddresses", generateAddressJson(report.getTopAddresses()));
        root.set("softwareFamilies", generateSoftwareJson(report.getSoftwareFamilies()));
        return root;
    }

    private static JsonNode generateFiltersJson(FilterCriteria criteria) {
        ObjectNode filters = mapper.createObjectNode();
        filters.put("date", criteria.getDate());
        filters.put("hour", criteria.getHour());
        filters.put("ip", criteria.getClientAddress());
        filters.put("browser", criteria.getSoftwareFamily() != null ? criteria.getSoftwareFamily().getDisplayName() : null);
        return filters;
    }

    private static JsonNode generateSummaryJson(LogSummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("totalEntries", summary.getTotalEntries());
        node.put("uniqueIps", summary.getUniqueAddresses());
        node.put("dateRange", summary.getDateRange());
        ArrayNode files = node.putArray("filesProcessed");
        summary.getFilesProcessed().forEach(files::add);
        return node;
    }

    private static JsonNode generateTrafficJson(TrafficSeries series) {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", series.getTitle());
        ArrayNode dates = node.putArray("dates");
        ArrayNode counts = node.putArray("counts");
        for (TrafficBucket bucket : series.getBuckets()) {
            if (bucket.getHour() != null) {
                dates.add(bucket.getHour());
            } else {
                dates.add(bucket.getDate().toString());
            }
            counts.add(bucket.getCount());
        }
        return node;
    }

    private static JsonNode generateAddressJson(FrequencyTable table) {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", table.getTitle());
        ArrayNode ips = node.putArray("ips");
        ArrayNode counts = node.putArray("counts");
        for (CountEntry<String> entry : table.getEntries()) {
            ips.add(entry.getKey());
            counts.add(entry.getCount());
        }
        return node;
    }

    private static JsonNode generateSoftwareJson(CategoryDistribution distribution) {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", distribution.getTitle());
        ArrayNode browsers = node.putArray("browsers");
        ArrayNode counts = node.putArray("counts");
        for (CountEntry<SoftwareFamily> entry : distribution.getEntries()) {
            browsers.add(entry.getKey().getDisplayName());
            counts.add(entry.getCount());
        }
        return node;
    }
}
