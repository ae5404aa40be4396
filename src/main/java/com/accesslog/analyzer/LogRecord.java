package com.accesslog.analyzer;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One successfully parsed access log line.
 */
public final class LogRecord {

    private final String clientAddress;
    private final String rawTimestamp;
    private final LocalDateTime occurredAt;
    private final String method;
    private final String path;
    private final String protocolVersion;
    private final int statusCode;
    private final String responseSize;
    private final String referer;
    private final String userAgent;
    private final SoftwareFamily softwareFamily;
    private final String sourceFile;

    public LogRecord(String clientAddress, String rawTimestamp, LocalDateTime occurredAt, String method,
            String path, String protocolVersion, int statusCode, String responseSize, String referer,
            String userAgent, String sourceFile) {
        this.clientAddress = Objects.requireNonNull(clientAddress, "clientAddress");
        this.rawTimestamp = Objects.requireNonNull(rawTimestamp, "rawTimestamp");
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
        this.method = method;
        this.path = path;
        this.protocolVersion = protocolVersion;
        this.statusCode = statusCode;
        this.responseSize = responseSize;
        this.referer = referer != null ? referer : SoftwareFamily.ABSENT;
        this.userAgent = userAgent != null ? userAgent : SoftwareFamily.ABSENT;
        this.softwareFamily = SoftwareFamily.classify(this.userAgent);
        this.sourceFile = sourceFile != null ? sourceFile : "";
    }

    /**
     * Returns a copy of this record attributed to the given file.
     */
    public LogRecord withSourceFile(String fileName) {
        return new LogRecord(clientAddress, rawTimestamp, occurredAt, method, path, protocolVersion,
                statusCode, responseSize, referer, userAgent, fileName);
    }

    public String getClientAddress() {
        return clientAddress;
    }

    public String getRawTimestamp() {
        return rawTimestamp;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseSize() {
        return responseSize;
    }

    public String getReferer() {
        return referer;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public SoftwareFamily getSoftwareFamily() {
        return softwareFamily;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogRecord other = (LogRecord) o;
        return statusCode == other.statusCode &&
               Objects.equals(clientAddress, other.clientAddress) &&
               Objects.equals(rawTimestamp, other.rawTimestamp) &&
               Objects.equals(occurredAt, other.occurredAt) &&
               Objects.equals(method, other.method) &&
               Objects.equals(path, other.path) &&
               Objects.equals(protocolVersion, other.protocolVersion) &&
               Objects.equals(responseSize, other.responseSize) &&
               Objects.equals(referer, other.referer) &&
               Objects.equals(userAgent, other.userAgent) &&
               Objects.equals(sourceFile, other.sourceFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clientAddress, rawTimestamp, occurredAt, method, path, protocolVersion,
                statusCode, responseSize, referer, userAgent, sourceFile);
    }

    @Override
    public String toString() {
        return String.format("%s [%s] \"%s %s %s\" %d %s (%s) %s",
                clientAddress, rawTimestamp, method, path, protocolVersion, statusCode, responseSize,
                softwareFamily, sourceFile);
    }
}
