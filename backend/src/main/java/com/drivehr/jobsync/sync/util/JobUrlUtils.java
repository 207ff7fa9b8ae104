package com.drivehr.jobsync.sync.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class JobUrlUtils {

    private JobUrlUtils() {
    }

    /**
     * Returns the trimmed URL when it is an absolute http(s) URL with a host, otherwise null.
     */
    public static String sanitizeUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = stripControlCharacters(candidate.trim()).replace(" ", "%20");
        if (trimmed.isBlank()) {
            return null;
        }
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme();
        if (scheme == null) {
            return null;
        }
        String lowered = scheme.toLowerCase(Locale.ROOT);
        if (!"http".equals(lowered) && !"https".equals(lowered)) {
            return null;
        }
        return trimmed;
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String stripControlCharacters(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isISOControl(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }
}
