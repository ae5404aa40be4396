package com.accesslog.analyzer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A recognizable access log line shape. Formats are tried in order by
 * {@link AccessLogLineParser}; each one only needs to say whether it matches
 * and which named groups it provides.
 */
public final class LineFormat {

    static final String GROUP_ADDRESS = "address";
    static final String GROUP_TIMESTAMP = "timestamp";
    static final String GROUP_METHOD = "method";
    static final String GROUP_PATH = "path";
    static final String GROUP_PROTOCOL = "protocol";
    static final String GROUP_STATUS = "status";
    static final String GROUP_SIZE = "size";
    static final String GROUP_REFERER = "referer";
    static final String GROUP_USER_AGENT = "agent";

    private static final String COMMON_PREFIX =
            "(?<address>\\S+) - - " +
            "\\[(?<timestamp>[^\\]]+)\\] " +
            "\"(?<method>\\S+) (?<path>\\S+) (?<protocol>[^\"]+)\" " +
            "(?<status>\\d+) (?<size>\\S+)";

    /** Combined log format, trailing text after the user agent is tolerated. */
    public static final LineFormat FULL = new LineFormat("full",
            Pattern.compile(COMMON_PREFIX + " \"(?<referer>[^\"]*)\" \"(?<agent>[^\"]*)\""),
            false, true);

    /** Common log format without referer and user agent; must span the whole line. */
    public static final LineFormat MINIMAL = new LineFormat("minimal",
            Pattern.compile(COMMON_PREFIX),
            true, false);

    private static final List<LineFormat> DEFAULTS = Collections.unmodifiableList(Arrays.asList(FULL, MINIMAL));

    private final String name;
    private final Pattern pattern;
    private final boolean wholeLine;
    private final boolean hasClientFields;

    public LineFormat(String name, Pattern pattern, boolean wholeLine, boolean hasClientFields) {
        this.name = name;
        this.pattern = pattern;
        this.wholeLine = wholeLine;
        this.hasClientFields = hasClientFields;
    }

    /**
     * The built-in formats, richest first.
     */
    public static List<LineFormat> defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a matcher positioned on a successful match, or null.
     */
    Matcher match(String line) {
        Matcher m = pattern.matcher(line);
        boolean matched = wholeLine ? m.matches() : m.lookingAt();
        return matched ? m : null;
    }

    public String getName() {
        return name;
    }

    /**
     * True if the pattern captures the {@code referer} and {@code agent} groups.
     */
    public boolean hasClientFields() {
        return hasClientFields;
    }

    @Override
    public String toString() {
        return name;
    }
}
