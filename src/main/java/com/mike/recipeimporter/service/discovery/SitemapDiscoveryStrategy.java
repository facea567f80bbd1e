package com.mike.recipeimporter.service.discovery;

import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.service.politeness.PoliteFetcher;
import com.mike.recipeimporter.service.politeness.RobotsPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class SitemapDiscoveryStrategy implements DiscoveryStrategy {

    static final List<String> SITEMAP_PATHS = List.of(
            "/sitemap.xml", "/sitemap_index.xml", "/sitemap-index.xml", "/post-sitemap.xml"
    );

    static final int MAX_SUB_SITEMAPS = 5;
    static final int MAX_DEPTH = 3;

    // yyyy-MM-dd with optional time and optional offset
    private static final DateTimeFormatter LASTMOD = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private final PoliteFetcher fetcher;
    private final RobotsPolicy robotsPolicy;

    @Override
    public StrategyType type() {
        return StrategyType.SITEMAP;
    }

    @Override
    public List<CandidateUrl> discover(RecipeSource source, int remaining) {
        List<CandidateUrl> result = new ArrayList<>();
        for (String sitemapUrl : sitemapUrls(source)) {
            if (result.size() >= remaining) {
                break;
            }
            List<CandidateUrl> found = readSitemap(sitemapUrl, remaining - result.size(), 1);
            log.info("SitemapDiscovery: source={} sitemap={} urls={}", source.key(), sitemapUrl, found.size());
            result.addAll(found);
        }
        return result;
    }

    private List<String> sitemapUrls(RecipeSource source) {
        if (!source.sitemapUrls().isEmpty()) {
            return source.sitemapUrls();
        }
        List<String> fromRobots = robotsPolicy.listedSitemaps(source.baseUrl());
        if (!fromRobots.isEmpty()) {
            log.debug("SitemapDiscovery: source={} uses {} sitemaps from robots.txt", source.key(), fromRobots.size());
            return fromRobots;
        }
        URI base = URI.create(source.baseUrl());
        List<String> probed = new ArrayList<>();
        for (String path : SITEMAP_PATHS) {
            String candidate = base.resolve(path).toString();
            if (fetcher.exists(candidate)) {
                probed.add(candidate);
            }
        }
        return probed;
    }

    List<CandidateUrl> readSitemap(String sitemapUrl, int limit, int depth) {
        if (limit <= 0) {
            return List.of();
        }
        Optional<String> body = fetcher.fetchDocument(sitemapUrl);
        if (body.isEmpty()) {
            return List.of();
        }
        Document doc = Jsoup.parse(body.get(), sitemapUrl, Parser.xmlParser());

        List<Element> subSitemaps = doc.select("sitemapindex > sitemap > loc");
        if (!subSitemaps.isEmpty()) {
            if (depth >= MAX_DEPTH) {
                log.warn("SitemapDiscovery: nesting too deep at {}, not descending", sitemapUrl);
                return List.of();
            }
            List<CandidateUrl> result = new ArrayList<>();
            for (Element loc : subSitemaps.subList(0, Math.min(MAX_SUB_SITEMAPS, subSitemaps.size()))) {
                if (result.size() >= limit) {
                    break;
                }
                String subUrl = loc.text().trim();
                if (subUrl.isEmpty()) {
                    continue;
                }
                result.addAll(readSitemap(subUrl, limit - result.size(), depth + 1));
            }
            return result;
        }

        List<CandidateUrl> scanned = new ArrayList<>();
        int maxScan = limit * 2;
        for (Element url : doc.select("urlset > url")) {
            if (scanned.size() >= maxScan) {
                break;
            }
            String loc = childText(url, "loc");
            if (loc == null) {
                continue;
            }
            scanned.add(new CandidateUrl(loc, parseLastmod(childText(url, "lastmod"))));
        }

        // newest of the scanned window
        scanned.sort(Comparator.comparing(CandidateUrl::publishedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return scanned.size() > limit ? new ArrayList<>(scanned.subList(0, limit)) : scanned;
    }

    private static String childText(Element parent, String name) {
        for (Element child : parent.children()) {
            if (child.normalName().equals(name)) {
                String text = child.text().trim();
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    /** Date-only or full ISO timestamp; null when unknown or malformed. */
    static Instant parseLastmod(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = LASTMOD.parseBest(value.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            if (parsed instanceof LocalDateTime ldt) {
                return ldt.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("SitemapDiscovery: unparseable lastmod '{}'", value);
            return null;
        }
    }
}
