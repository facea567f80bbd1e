package com.mike.recipeimporter.service.politeness;

import com.mike.recipeimporter.config.ImporterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Paced HTTP access for discovery and the HTML fallback. Failures never propagate:
 * a page that cannot be fetched is simply absent.
 */
@Component
@Slf4j
public class PoliteFetcher {

    private final PageClient pageClient;
    private final DomainRateLimiter rateLimiter;
    private final RobotsPolicy robotsPolicy;
    private final int requestTimeoutMs;
    private final int probeTimeoutMs;

    public PoliteFetcher(PageClient pageClient,
                         DomainRateLimiter rateLimiter,
                         RobotsPolicy robotsPolicy,
                         ImporterProperties props) {
        this.pageClient = pageClient;
        this.rateLimiter = rateLimiter;
        this.robotsPolicy = robotsPolicy;
        this.requestTimeoutMs = props.getCrawling().getRequestTimeoutMs();
        this.probeTimeoutMs = props.getCrawling().getProbeTimeoutMs();
    }

    /** HEAD probe; true only for a final 200. */
    public boolean exists(String url) {
        String domain = domainOf(url);
        rateLimiter.waitBeforeRequest(domain);
        try {
            int status = pageClient.head(url, probeTimeoutMs);
            if (isRateLimit(status)) {
                rateLimiter.onRateLimited(domain);
                return false;
            }
            return status == 200;
        } catch (IOException | RuntimeException e) {
            log.debug("PoliteFetcher: probe failed url={} ({})", url, e.toString());
            return false;
        }
    }

    /** Feeds and sitemaps; robots.txt is not consulted for these. */
    public Optional<String> fetchDocument(String url) {
        String domain = domainOf(url);
        rateLimiter.waitBeforeRequest(domain);
        try {
            PageClient.FetchedPage page = pageClient.get(url, requestTimeoutMs);
            if (isRateLimit(page.statusCode())) {
                rateLimiter.onRateLimited(domain);
                return Optional.empty();
            }
            if (!page.isSuccess()) {
                log.warn("PoliteFetcher: HTTP {} for url={}", page.statusCode(), url);
                return Optional.empty();
            }
            rateLimiter.onSuccess(domain);
            return Optional.ofNullable(page.body());
        } catch (IOException | RuntimeException e) {
            log.warn("PoliteFetcher: request failed url={}: {}", url, e.toString());
            return Optional.empty();
        }
    }

    /** HTML pages; empty when robots.txt disallows the url. */
    public Optional<String> fetchPage(String url) {
        if (!robotsPolicy.isAllowed(url)) {
            log.info("PoliteFetcher: robots.txt disallows url={}", url);
            return Optional.empty();
        }
        return fetchDocument(url);
    }

    private static boolean isRateLimit(int status) {
        return status == 429 || status == 503;
    }

    static String domainOf(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
