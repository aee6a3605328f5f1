package com.flowtest.engine;

import java.util.Locale;

public final class RequestUrls {

    private RequestUrls() {
    }

    /**
     * Resolves a step URL. Absolute http(s) URLs are used as is; anything else is appended to
     * {@code baseUrl}, dropping one trailing slash of the base and one leading slash of the path.
     */
    public static String resolve(String url, String baseUrl) {
        String path = url == null ? "" : url;
        if (isAbsolute(path)) {
            return path;
        }
        String base = baseUrl == null ? "" : baseUrl;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        return base + "/" + path;
    }

    static boolean isAbsolute(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
