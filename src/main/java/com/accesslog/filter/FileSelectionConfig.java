package com.accesslog.filter;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Decides which files in the logs directory are read.
 * A file qualifies when its lowercased name contains any of the configured substrings.
 */
public class FileSelectionConfig {

    public static final String PATTERNS_KEY = "ingest.file.patterns";
    public static final String ADD_KEY = "ingest.file.add";
    public static final String REMOVE_KEY = "ingest.file.remove";

    private Set<String> namePatterns = new LinkedHashSet<>();

    public FileSelectionConfig() {
        initializeDefaults();
    }

    private void initializeDefaults() {
        namePatterns.addAll(Arrays.asList("log", "rental", "access"));
    }

    /**
     * Load patterns from properties.
     * Supports:
     * - ingest.file.patterns: comma-separated list (replaces defaults)
     * - ingest.file.add: comma-separated list (adds to defaults)
     * - ingest.file.remove: comma-separated list (removes from current set)
     */
    public void loadFromProperties(Properties props) {
        String patternList = props.getProperty(PATTERNS_KEY);
        if (patternList != null && !patternList.trim().isEmpty()) {
            namePatterns.clear();
            addPatterns(patternList);
        }

        String additionalPatterns = props.getProperty(ADD_KEY);
        if (additionalPatterns != null && !additionalPatterns.trim().isEmpty()) {
            addPatterns(additionalPatterns);
        }

        String removePatterns = props.getProperty(REMOVE_KEY);
        if (removePatterns != null && !removePatterns.trim().isEmpty()) {
            removePatterns(removePatterns);
        }
    }

    private void addPatterns(String patternList) {
        for (String pattern : patternList.split(",")) {
            String trimmed = pattern.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                namePatterns.add(trimmed);
            }
        }
    }

    private void removePatterns(String patternList) {
        for (String pattern : patternList.split(",")) {
            namePatterns.remove(pattern.trim().toLowerCase(Locale.ROOT));
        }
    }

    public Set<String> getNamePatterns() {
        return new LinkedHashSet<>(namePatterns);
    }

    public boolean isCandidate(String fileName) {
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return namePatterns.stream().anyMatch(lower::contains);
    }
}
