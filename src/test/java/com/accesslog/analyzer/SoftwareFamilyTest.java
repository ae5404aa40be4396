package com.accesslog.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Locale;

import org.junit.jupiter.api.Test;

public class SoftwareFamilyTest {

    @Test
    public void testClassifyBrowsers() {
        assertEquals(SoftwareFamily.CHROME, SoftwareFamily.classify(TestRecords.CHROME_UA));
        assertEquals(SoftwareFamily.FIREFOX, SoftwareFamily.classify(TestRecords.FIREFOX_UA));
        assertEquals(SoftwareFamily.SAFARI, SoftwareFamily.classify(TestRecords.SAFARI_UA));
    }

    @Test
    public void testClassifyBots() {
        assertEquals(SoftwareFamily.FACEBOOK_BOT, SoftwareFamily.classify("facebookexternalhit/1.1"));
        assertEquals(SoftwareFamily.BOT_OR_CRAWLER, SoftwareFamily.classify(TestRecords.GOOGLEBOT_UA));
        assertEquals(SoftwareFamily.BOT_OR_CRAWLER, SoftwareFamily.classify("SomeCrawler/3.0"));
    }

    @Test
    public void testClassifyAbsentAndOther() {
        assertEquals(SoftwareFamily.UNKNOWN, SoftwareFamily.classify("-"));
        assertEquals(SoftwareFamily.UNKNOWN, SoftwareFamily.classify(null));
        assertEquals(SoftwareFamily.OTHER, SoftwareFamily.classify("curl/8.4.0"));
        assertEquals(SoftwareFamily.OTHER, SoftwareFamily.classify(""));
    }

    @Test
    public void testFindByName() {
        assertEquals(SoftwareFamily.BOT_OR_CRAWLER, SoftwareFamily.findByName("Bot/Crawler"));
        assertEquals(SoftwareFamily.BOT_OR_CRAWLER, SoftwareFamily.findByName("bot_or_crawler"));
        assertEquals(SoftwareFamily.FACEBOOK_BOT, SoftwareFamily.findByName(" facebook bot "));
        assertEquals(SoftwareFamily.CHROME, SoftwareFamily.findByName("chrome"));
        assertNull(SoftwareFamily.findByName("Opera"));
        assertNull(SoftwareFamily.findByName(null));
    }

    @Test
    public void testDisplayName() {
        assertEquals("Facebook Bot", SoftwareFamily.FACEBOOK_BOT.toString());
        assertEquals("Unknown", SoftwareFamily.UNKNOWN.getDisplayName());
    }

    @Test
    public void testClassifyIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals(SoftwareFamily.FIREFOX, SoftwareFamily.classify("MOZILLA FIREFOX/128.0"));
            assertEquals(SoftwareFamily.CHROME, SoftwareFamily.classify("MOZILLA/5.0 CHROME/138.0 SAFARI/537.36"));
            assertEquals(SoftwareFamily.SAFARI, SoftwareFamily.classify("MOZILLA/5.0 SAFARI/605.1.15"));
            assertEquals(SoftwareFamily.BOT_OR_CRAWLER, SoftwareFamily.classify("BINGBOT/2.0"));
        } finally {
            Locale.setDefault(original);
        }
    }
}
