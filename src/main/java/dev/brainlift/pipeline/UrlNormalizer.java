package dev.brainlift.pipeline;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes result URLs so that the same page reached through different queries is kept once.
 * Drops fragments, tracking parameters, a leading {@code www.} and trailing slashes.
 */
final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content", "ref", "source"
    );

    private UrlNormalizer() {
    }

    /**
     * Deduplication key for a URL. The scheme is ignored so http and https variants collapse.
     *
     * @param url the result URL
     * @return normalized key, or the trimmed lowercase input if it cannot be parsed
     */
    static String dedupeKey(String url) {
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            log.debug("Malformed result URL, using raw value as key: {}", url);
            return url.trim().toLowerCase(Locale.ROOT);
        }
        if (uri.getHost() == null) {
            return url.trim().toLowerCase(Locale.ROOT);
        }

        String host = stripWww(uri.getHost().toLowerCase(Locale.ROOT));
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = filterQueryParams(uri.getRawQuery());
        return query == null ? host + path : host + path + "?" + query;
    }

    /**
     * Host of a URL without a leading {@code www.}.
     *
     * @return the host, or an empty string when the URL has none
     */
    static String host(String url) {
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? "" : stripWww(host.toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return "";
        }
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !TRACKING_PARAMS.contains(key.toLowerCase(Locale.ROOT));
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }
}
