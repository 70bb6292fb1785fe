package com.dailyresearch.pipeline.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UrlUtilsTest {

    @Test
    public void normalizeDropsTrackingFragmentAndTrailingSlash() {
        assertEquals("https://example.com/post?id=7",
                UrlUtils.normalize("http://www.Example.com/post/?utm_source=x&id=7&fbclid=abc#comments"));
    }

    @Test
    public void normalizeStripsTrailingPunctuation() {
        assertEquals("https://example.com/a", UrlUtils.normalize("https://example.com/a."));
        assertEquals("", UrlUtils.normalize("   "));
        assertEquals("", UrlUtils.normalize(null));
    }

    @Test
    public void equivalentUrlsNormalizeIdentically() {
        assertEquals(UrlUtils.normalize("https://x.com/a/status/1?s=20"),
                UrlUtils.normalize("https://X.com/a/status/1/"));
    }

    @Test
    public void hostStripsWww() {
        assertEquals("reddit.com", UrlUtils.host("https://www.reddit.com/r/LocalLLaMA"));
        assertEquals("", UrlUtils.host("not a url"));
    }

    @Test
    public void matchesDomainCoversSubdomainsAndPathPrefixes() {
        assertTrue(UrlUtils.matchesDomain("https://docs.anthropic.com/x", "anthropic.com"));
        assertFalse(UrlUtils.matchesDomain("https://notanthropic.com/x", "anthropic.com"));
        assertTrue(UrlUtils.matchesDomain("https://x.com/AnthropicAI/status/1", "x.com/anthropicai"));
        assertFalse(UrlUtils.matchesDomain("https://x.com/someone/status/1", "x.com/anthropicai"));
    }
}
