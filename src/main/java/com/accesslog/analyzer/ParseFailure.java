package com.accesslog.analyzer;

/**
 * Why a log line did not produce a record.
 */
public enum ParseFailure {
    /** The line matches none of the known line formats. */
    MALFORMED,
    /** A format matched but the timestamp token is not a valid date/time. */
    BAD_TIMESTAMP
}
