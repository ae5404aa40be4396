package com.accesslog.analyzer;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.text.NumberFormat;
import java.util.Locale;

import com.accesslog.analyzer.model.AnalysisReport;
import com.accesslog.analyzer.model.CategoryDistribution;
import com.accesslog.analyzer.model.CountEntry;
import com.accesslog.analyzer.model.FrequencyTable;
import com.accesslog.analyzer.model.Granularity;
import com.accesslog.analyzer.model.LogSummary;
import com.accesslog.analyzer.model.TrafficBucket;
import com.accesslog.analyzer.model.TrafficSeries;

/**
 * Generates a self-contained HTML dashboard with sortable tables and inline bars
 */
public class HtmlReportGenerator {

	private static final NumberFormat NUMBER_FORMAT = NumberFormat.getNumberInstance(Locale.US);

	public static void generateReport(String fileName, AnalysisReport report) throws IOException {
		try (PrintWriter writer = new PrintWriter(new FileWriter(fileName))) {
			writeReport(writer, report);

			// PrintWriter swallows I/O errors, surface them here
			if (writer.checkError()) {
				throw new IOException("Error writing HTML report to " + fileName
						+ " - possible disk full or I/O error");
			}
		}
	}

	public static void writeReport(Writer out, AnalysisReport report) {
		PrintWriter writer = out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
		writeHtmlHeader(writer);
		writeNavigationHeader(writer, report);
		writeSummary(writer, report);
		writeTrafficTable(writer, report.getTraffic());
		writeAddressTable(writer, report.getTopAddresses());
		writeSoftwareTable(writer, report.getSoftwareFamilies());
		writeHtmlFooter(writer);
		writer.flush();
	}

	private static void writeHtmlHeader(PrintWriter writer) {
		writer.println("<!DOCTYPE html>");
		writer.println("<html lang=\"en\">");
		writer.println("<head>");
		writer.println("    <meta charset=\"UTF-8\">");
		writer.println("    <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">");
		writer.println("    <title>Access Log Analysis Report</title>");
		writer.println("    <style>");
		writer.println(
				"        body { font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif; margin: 0; background-color: #f8f9fa; }");
		writer.println("        .container { max-width: 95%; margin: 0 auto; padding: 20px; }");
		writer.println(
				"        h2 { color: #1b2a3a; margin-top: 40px; margin-bottom: 20px; border-bottom: 2px solid #2f6f9f; padding-bottom: 5px; scroll-margin-top: 70px; }");
		writer.println("        .table-container { margin-bottom: 40px; }");
		writer.println("        table { width: 100%; border-collapse: collapse; margin-top: 10px; font-size: 14px; }");
		writer.println("        th, td { border: 1px solid #c3ccd4; padding: 8px; text-align: left; }");
		writer.println(
				"        thead th { position: sticky; top: 0; background-color: #2f6f9f; color: white; cursor: pointer; user-select: none; }");
		writer.println("        th.sortable::after { content: ' ↕'; font-size: 12px; opacity: 0.5; }");
		writer.println("        tr:nth-child(even) { background-color: #f1f4f7; }");
		writer.println("        .number { text-align: right; width: 120px; }");
		writer.println("        .bar-cell { width: 45%; }");
		writer.println("        .bar { background-color: #5b9bd5; height: 14px; border-radius: 2px; }");
		writer.println("        .empty { color: #6b7785; font-style: italic; }");
		writer.println(
				"        .summary { background-color: #eef4f9; padding: 15px; border-radius: 5px; margin-bottom: 20px; border-left: 4px solid #2f6f9f; }");
		writer.println(
				"        .summary-grid { display: grid; grid-template-columns: repeat(auto-fit, minmax(200px, 1fr)); gap: 10px; }");
		writer.println(
				"        .summary-item { background-color: white; padding: 10px; border-radius: 4px; border-left: 4px solid #2f6f9f; }");
		writer.println("        .summary-label { font-weight: bold; color: #1b2a3a; }");
		writer.println("        .summary-value { font-size: 18px; color: #2f6f9f; }");
		writer.println("        .nav-header { background-color: #1b2a3a; color: white; padding: 15px; margin-bottom: 30px; border-radius: 8px; }");
		writer.println("        .nav-title { margin: 0 0 10px 0; font-size: 1.2em; font-weight: bold; }");
		writer.println("        .nav-links { display: flex; flex-wrap: wrap; gap: 10px; }");
		writer.println("        .nav-link { color: #ffffff; text-decoration: none; padding: 8px 12px; border-radius: 4px; background-color: #2f6f9f; font-size: 0.9em; }");
		writer.println("        .report-info { color: #c3ccd4; font-size: 0.85em; margin-top: 5px; }");
		writer.println("    </style>");
		writer.println("</head>");
		writer.println("<body>");
		writer.println("    <div class=\"container\">");
	}

	private static void writeNavigationHeader(PrintWriter writer, AnalysisReport report) {
		writer.println("    <div class=\"nav-header\">");
		writer.println("            <div class=\"nav-title\">Access Log Analysis Report</div>");
		writer.println("            <div class=\"nav-links\">");
		writer.println("                <a href=\"#traffic\" class=\"nav-link\">Traffic</a>");
		writer.println("                <a href=\"#top-addresses\" class=\"nav-link\">Top IP Addresses</a>");
		writer.println("                <a href=\"#browsers\" class=\"nav-link\">Browsers</a>");
		writer.println("            </div>");
		writer.println("            <div class=\"report-info\">Source: " + escapeHtml(report.getSourceDirectory())
				+ (report.getGeneratedAt() != null ? " | Generated: " + escapeHtml(report.getGeneratedAt().toString()) : "")
				+ "</div>");
		writer.println("    </div>");
	}

	private static void writeSummary(PrintWriter writer, AnalysisReport report) {
		LogSummary summary = report.getSummary();
		writer.println("        <div class=\"summary\">");
		writer.println("            <div class=\"summary-grid\">");
		writeSummaryItem(writer, "Total Requests", NUMBER_FORMAT.format(summary.getTotalEntries()));
		writeSummaryItem(writer, "Unique IPs", NUMBER_FORMAT.format(summary.getUniqueAddresses()));
		writeSummaryItem(writer, "Date Range", summary.getDateRange());
		writeSummaryItem(writer, "Files Processed", String.valueOf(summary.getFilesProcessed().size()));
		if (!report.getCriteria().isEmpty()) {
			writeSummaryItem(writer, "Filters", report.getCriteria().toString());
			writeSummaryItem(writer, "Matching Requests", NUMBER_FORMAT.format(report.getMatchingEntries()));
		}
		writer.println("            </div>");
		writer.println("        </div>");
	}

	private static void writeSummaryItem(PrintWriter writer, String label, String value) {
		writer.println("                <div class=\"summary-item\"><div class=\"summary-label\">" + escapeHtml(label)
				+ "</div><div class=\"summary-value\">" + escapeHtml(value) + "</div></div>");
	}

	private static void writeTrafficTable(PrintWriter writer, TrafficSeries series) {
		writer.println("        <h2 id=\"traffic\">" + escapeHtml(series.getTitle()) + "</h2>");
		if (series.isEmpty()) {
			writer.println("        <p class=\"empty\">No data available</p>");
			return;
		}
		String label = series.getGranularity() == Granularity.HOURLY ? "Hour" : "Date";
		writeTableStart(writer, "trafficTable", label);
		long max = series.getMaxCount();
		for (TrafficBucket bucket : series.getBuckets()) {
			writeRow(writer, bucket.getLabel(), bucket.getCount(), max);
		}
		writeTableEnd(writer);
	}

	private static void writeAddressTable(PrintWriter writer, FrequencyTable table) {
		writer.println("        <h2 id=\"top-addresses\">" + escapeHtml(table.getTitle()) + "</h2>");
		if (table.isEmpty()) {
			writer.println("        <p class=\"empty\">No data available</p>");
			return;
		}
		writeTableStart(writer, "addressTable", "IP Address");
		long max = table.getEntries().get(0).getCount();
		for (CountEntry<String> entry : table.getEntries()) {
			writeRow(writer, entry.getKey(), entry.getCount(), max);
		}
		writeTableEnd(writer);
	}

	private static void writeSoftwareTable(PrintWriter writer, CategoryDistribution distribution) {
		writer.println("        <h2 id=\"browsers\">" + escapeHtml(distribution.getTitle()) + "</h2>");
		if (distribution.isEmpty()) {
			writer.println("        <p class=\"empty\">No data available</p>");
			return;
		}
		writeTableStart(writer, "browserTable", "Browser");
		long max = distribution.getEntries().stream().mapToLong(CountEntry::getCount).max().orElse(0);
		for (CountEntry<SoftwareFamily> entry : distribution.getEntries()) {
			writeRow(writer, entry.getKey().getDisplayName(), entry.getCount(), max);
		}
		writeTableEnd(writer);
	}

	private static void writeTableStart(PrintWriter writer, String tableId, String keyColumn) {
		writer.println("        <div class=\"table-container\">");
		writer.println("            <table id=\"" + tableId + "\">");
		writer.println("                <thead>");
		writer.println("                    <tr>");
		writer.println("                        <th class=\"sortable\" onclick=\"sortTable('" + tableId + "', 0, 'string')\">"
				+ escapeHtml(keyColumn) + "</th>");
		writer.println("                        <th class=\"sortable\" onclick=\"sortTable('" + tableId
				+ "', 1, 'number')\">Requests</th>");
		writer.println("                        <th></th>");
		writer.println("                    </tr>");
		writer.println("                </thead>");
		writer.println("                <tbody>");
	}

	private static void writeRow(PrintWriter writer, String key, long count, long max) {
		double width = max > 0 ? (count * 100.0) / max : 0;
		writer.println("                    <tr>");
		writer.println("                        <td>" + escapeHtml(key) + "</td>");
		writer.println("                        <td class=\"number\">" + NUMBER_FORMAT.format(count) + "</td>");
		writer.println("                        <td class=\"bar-cell\"><div class=\"bar\" style=\"width: "
				+ String.format(Locale.US, "%.1f", width) + "%\"></div></td>");
		writer.println("                    </tr>");
	}

	private static void writeTableEnd(PrintWriter writer) {
		writer.println("                </tbody>");
		writer.println("            </table>");
		writer.println("        </div>");
	}

	private static void writeHtmlFooter(PrintWriter writer) {
		writer.println("    </div>");
		writer.println("    <script>");
		writer.println("        function sortTable(tableId, col, type) {");
		writer.println("            const table = document.getElementById(tableId);");
		writer.println("            const tbody = table.tBodies[0];");
		writer.println("            const rows = Array.from(tbody.rows);");
		writer.println("            const asc = table.dataset.sortCol == col && table.dataset.sortDir !== 'asc';");
		writer.println("            rows.sort((a, b) => {");
		writer.println("                let x = a.cells[col].textContent.trim();");
		writer.println("                let y = b.cells[col].textContent.trim();");
		writer.println("                if (type === 'number') {");
		writer.println("                    x = parseFloat(x.replace(/,/g, '')) || 0;");
		writer.println("                    y = parseFloat(y.replace(/,/g, '')) || 0;");
		writer.println("                    return asc ? x - y : y - x;");
		writer.println("                }");
		writer.println("                return asc ? x.localeCompare(y) : y.localeCompare(x);");
		writer.println("            });");
		writer.println("            rows.forEach(r => tbody.appendChild(r));");
		writer.println("            table.dataset.sortCol = col;");
		writer.println("            table.dataset.sortDir = asc ? 'asc' : 'desc';");
		writer.println("        }");
		writer.println("    </script>");
		writer.println("</body>");
		writer.println("</html>");
	}

	static String escapeHtml(String text) {
		if (text == null)
			return "";
		return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;")
				.replace("'", "&#x27;");
	}
}
