package com.mike.recipeimporter.service.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

@Component
@Slf4j
public class UrlNormalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "fbclid", "gclid", "ref", "source", "campaign", "mc_cid", "mc_eid"
    );

    /**
     * Canonical form used as ledger key and for dedup: lower-case scheme and host,
     * tracking parameters and blank values removed, remaining parameters sorted by name,
     * no fragment, no trailing slash. Unparseable input comes back trimmed.
     */
    public String normalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            log.debug("UrlNormalizer: cannot parse url={} ({})", trimmed, e.getMessage());
            return trimmed;
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            return trimmed;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        String host = uri.getHost() != null
                ? uri.getHost()
                : uri.getRawAuthority().replaceFirst(":\\d+$", "");
        sb.append(host.toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }

        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        sb.append(path);

        String query = normalizeQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /** Lower-case host of the url, or "" when there is none. */
    public String host(String url) {
        if (url == null) {
            return "";
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return "";
        }
    }

    public String hostWithoutWww(String url) {
        String host = host(url);
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    private String normalizeQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        // name -> values in order of appearance; names sorted
        Map<String, List<String>> params = new TreeMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = decode(eq >= 0 ? pair.substring(0, eq) : pair);
            String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
            if (value.isEmpty() || TRACKING_PARAMS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            params.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }

        StringJoiner joiner = new StringJoiner("&");
        params.forEach((name, values) -> values.forEach(v ->
                joiner.add(encode(name) + "=" + encode(v))));
        return joiner.toString();
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
