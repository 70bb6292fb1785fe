package com.dailyresearch.pipeline.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * URL normalization for dedup: lower-case, tracking parameters and fragment
 * removed, trailing slash and trailing punctuation dropped.
 */
public final class UrlUtils {
    private static final Set<String> TRACKING_PARAMS = Set.of(
            "fbclid", "gclid", "dclid", "msclkid", "mc_cid", "mc_eid", "igshid",
            "ref", "ref_src", "ref_url", "s", "t", "si", "share_id", "utm"
    );

    private UrlUtils() {}

    public static String normalize(String url) {
        if (url == null) return "";
        String s = url.trim().replaceAll("[.,;:!?]+$", "");
        if (s.isEmpty()) return "";
        s = s.toLowerCase(Locale.ROOT);
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);

        String base = s;
        String query = null;
        int q = s.indexOf('?');
        if (q >= 0) {
            base = s.substring(0, q);
            query = s.substring(q + 1);
        }
        if (base.startsWith("http://")) {
            base = "https://" + base.substring("http://".length());
        }
        base = base.replaceFirst("^https://www\\.", "https://");
        while (base.endsWith("/") && !base.endsWith("://")) {
            base = base.substring(0, base.length() - 1);
        }

        if (query == null || query.isEmpty()) return base;
        List<String> kept = new ArrayList<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            String name = pair.contains("=") ? pair.substring(0, pair.indexOf('=')) : pair;
            if (isTracking(name)) continue;
            kept.add(pair);
        }
        return kept.isEmpty() ? base : base + "?" + String.join("&", kept);
    }

    private static boolean isTracking(String name) {
        return name.startsWith("utm_") || TRACKING_PARAMS.contains(name);
    }

    /** Host of the URL without a leading "www.", lower-cased; empty when unparseable. */
    public static String host(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            String h = new URI(url.trim()).getHost();
            if (h == null) return "";
            h = h.toLowerCase(Locale.ROOT);
            return h.startsWith("www.") ? h.substring(4) : h;
        } catch (URISyntaxException e) {
            return "";
        }
    }

    /**
     * True when the URL's host is the domain or a subdomain of it. A domain
     * entry containing a path ("github.com/anthropics") matches as a prefix
     * of host + path.
     */
    public static boolean matchesDomain(String url, String domain) {
        if (domain == null || domain.isBlank()) return false;
        String d = domain.trim().toLowerCase(Locale.ROOT);
        String normalized = normalize(url);
        String host = host(url);
        if (host.isEmpty()) return false;
        if (d.contains("/")) {
            String hostAndPath = normalized.replaceFirst("^https?://", "");
            return hostAndPath.startsWith(d);
        }
        return host.equals(d) || host.endsWith("." + d);
    }
}
