package com.mike.recipeimporter.service.politeness;

import com.mike.recipeimporter.config.ImporterProperties;
import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * robots.txt evaluation, cached per scheme+host. When the file cannot be retrieved
 * everything is allowed.
 */
@Component
@Slf4j
public class RobotsPolicy {

    private final PageClient pageClient;
    private final String agentName;
    private final int timeoutMs;
    private final SimpleRobotRulesParser parser = new SimpleRobotRulesParser();

    private final Map<String, RobotsEntry> cache = new ConcurrentHashMap<>();

    public RobotsPolicy(PageClient pageClient, ImporterProperties props) {
        this.pageClient = pageClient;
        this.agentName = props.getCrawling().effectiveRobotsAgentName();
        this.timeoutMs = props.getCrawling().getRobotsTimeoutMs();
    }

    public boolean isAllowed(String url) {
        String origin = originOf(url);
        if (origin == null) {
            return true;
        }
        RobotsEntry entry = entryFor(origin);
        if (entry.rules() == null) {
            return true;
        }
        boolean allowed = entry.rules().isAllowed(url);
        if (!allowed) {
            log.debug("RobotsPolicy: disallowed by robots.txt url={}", url);
        }
        return allowed;
    }

    /** Sitemap: directives from the robots file of the url's host. */
    public List<String> listedSitemaps(String url) {
        String origin = originOf(url);
        if (origin == null) {
            return List.of();
        }
        return entryFor(origin).sitemaps();
    }

    private RobotsEntry entryFor(String origin) {
        RobotsEntry cached = cache.get(origin);
        if (cached != null) {
            return cached;
        }
        RobotsEntry loaded = load(origin);
        cache.put(origin, loaded);
        return loaded;
    }

    private RobotsEntry load(String origin) {
        String robotsUrl = origin + "/robots.txt";
        try {
            PageClient.FetchedPage page = pageClient.get(robotsUrl, timeoutMs);
            if (page.statusCode() != 200 || page.body() == null) {
                log.debug("RobotsPolicy: no robots.txt at {} (status={})", robotsUrl, page.statusCode());
                return RobotsEntry.NONE;
            }
            BaseRobotRules rules = parser.parseContent(
                    robotsUrl,
                    page.body().getBytes(StandardCharsets.UTF_8),
                    "text/plain",
                    List.of(agentName)
            );
            List<String> sitemaps = rules.getSitemaps() == null ? List.of() : List.copyOf(rules.getSitemaps());
            log.debug("RobotsPolicy: loaded {} ({} sitemaps)", robotsUrl, sitemaps.size());
            return new RobotsEntry(rules, sitemaps);
        } catch (IOException | RuntimeException e) {
            log.warn("RobotsPolicy: could not load {}: {}", robotsUrl, e.toString());
            return RobotsEntry.NONE;
        }
    }

    private static String originOf(String url) {
        try {
            URI uri = URI.create(url.trim());
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return null;
            }
            return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private record RobotsEntry(BaseRobotRules rules, List<String> sitemaps) {
        static final RobotsEntry NONE = new RobotsEntry(null, List.of());
    }
}
