package com.contractlink.harvester.harvest.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class ListingUrlUtils {
    private ListingUrlUtils() {
    }

    /**
     * Resolves {@code href} against {@code pageUrl}. Returns null for blank, script or fragment-only
     * links and for anything that does not end up as an absolute http(s) URL.
     */
    public static String toAbsolute(String href, String pageUrl) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || trimmed.startsWith("#")) {
            return null;
        }
        URI candidate = safeUri(trimmed.replace(" ", "%20"));
        if (candidate == null) {
            return null;
        }
        if (!candidate.isAbsolute()) {
            URI base = safeUri(pageUrl);
            if (base == null || !base.isAbsolute()) {
                return null;
            }
            candidate = base.resolve(candidate);
        }
        return isHttp(candidate) ? candidate.toString() : null;
    }

    public static boolean isHttp(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
