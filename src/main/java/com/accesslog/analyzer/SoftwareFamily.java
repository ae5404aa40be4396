package com.accesslog.analyzer;

import java.util.Locale;

/**
 * Client software family derived from the user agent of a request.
 */
public enum SoftwareFamily {
    CHROME("Chrome"),
    FIREFOX("Firefox"),
    SAFARI("Safari"),
    FACEBOOK_BOT("Facebook Bot"),
    BOT_OR_CRAWLER("Bot/Crawler"),
    OTHER("Other"),
    UNKNOWN("Unknown");

    public static final String ABSENT = "-";

    SoftwareFamily(final String pDisplayName) {
        this.displayName = pDisplayName;
    }

    private final String displayName;

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Classifies a user agent string. Substring checks are case-insensitive and
     * the first match wins, so a Chrome agent that also mentions Safari stays Chrome.
     */
    public static SoftwareFamily classify(final String userAgent) {
        if (userAgent == null || ABSENT.equals(userAgent)) {
            return UNKNOWN;
        }
        final String ua = userAgent.toLowerCase(Locale.ROOT);

        if (ua.contains("chrome")) {
            return CHROME;
        } else if (ua.contains("firefox")) {
            return FIREFOX;
        } else if (ua.contains("safari") && !ua.contains("chrome")) {
            return SAFARI;
        } else if (ua.contains("facebook")) {
            return FACEBOOK_BOT;
        } else if (ua.contains("bot") || ua.contains("crawler")) {
            return BOT_OR_CRAWLER;
        }
        return OTHER;
    }

    /**
     * Looks up a family by constant name or display name, ignoring case.
     * Returns null if nothing matches.
     */
    public static SoftwareFamily findByName(final String name) {
        if (name == null) {
            return null;
        }
        final String trimmed = name.trim();
        for (SoftwareFamily family : values()) {
            if (family.name().equalsIgnoreCase(trimmed) || family.displayName.equalsIgnoreCase(trimmed)) {
                return family;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
