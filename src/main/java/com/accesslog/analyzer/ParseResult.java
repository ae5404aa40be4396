package com.accesslog.analyzer;

import java.util.Objects;

/**
 * Outcome of parsing a single line: either a record or the reason there is none.
 */
public final class ParseResult {

    private final LogRecord record;
    private final ParseFailure failure;

    private ParseResult(LogRecord record, ParseFailure failure) {
        this.record = record;
        this.failure = failure;
    }

    public static ParseResult success(LogRecord record) {
        return new ParseResult(Objects.requireNonNull(record, "record"), null);
    }

    public static ParseResult failure(ParseFailure failure) {
        return new ParseResult(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return record != null;
    }

    /**
     * @throws IllegalStateException if the parse failed
     */
    public LogRecord getRecord() {
        if (record == null) {
            throw new IllegalStateException("No record, parse failed with " + failure);
        }
        return record;
    }

    public ParseFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[" + record + "]" : "ParseResult[" + failure + "]";
    }
}
