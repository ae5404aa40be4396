package com.accesslog.analyzer;

/**
 * Counters collected while ingesting a logs directory.
 */
public class IngestStats {

    public final int filesFound;
    public final int filesRead;
    public final int filesFailed;
    public final long linesRead;
    public final long recordsParsed;
    public final long malformedLines;
    public final long badTimestampLines;
    public final boolean capReached;

    public IngestStats(int filesFound, int filesRead, int filesFailed, long linesRead, long recordsParsed,
            long malformedLines, long badTimestampLines, boolean capReached) {
        this.filesFound = filesFound;
        this.filesRead = filesRead;
        this.filesFailed = filesFailed;
        this.linesRead = linesRead;
        this.recordsParsed = recordsParsed;
        this.malformedLines = malformedLines;
        this.badTimestampLines = badTimestampLines;
        this.capReached = capReached;
    }

    public static IngestStats empty() {
        return new IngestStats(0, 0, 0, 0, 0, 0, 0, false);
    }

    public long getSkippedLines() {
        return malformedLines + badTimestampLines;
    }

    @Override
    public String toString() {
        return String.format("files: %d found, %d read, %d failed | lines: %d read, %d parsed, %d malformed, %d bad timestamp%s",
                filesFound, filesRead, filesFailed, linesRead, recordsParsed, malformedLines, badTimestampLines,
                capReached ? " | record cap reached" : "");
    }
}
