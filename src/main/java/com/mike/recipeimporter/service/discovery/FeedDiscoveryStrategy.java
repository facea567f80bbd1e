package com.mike.recipeimporter.service.discovery;

import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.service.politeness.PoliteFetcher;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * RSS/Atom discovery. Uses the declared feeds, otherwise the first conventional feed path that answers 200.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedDiscoveryStrategy implements DiscoveryStrategy {

    static final List<String> FEED_PATHS = List.of(
            "/feed", "/rss", "/feed.xml", "/rss.xml", "/atom.xml", "/feed/atom", "/index.xml"
    );

    private final PoliteFetcher fetcher;

    @Override
    public StrategyType type() {
        return StrategyType.FEED;
    }

    @Override
    public List<CandidateUrl> discover(RecipeSource source, int remaining) {
        List<CandidateUrl> result = new ArrayList<>();
        for (String feedUrl : feedUrls(source)) {
            if (result.size() >= remaining) {
                break;
            }
            List<CandidateUrl> entries = readFeed(feedUrl, remaining - result.size());
            log.info("FeedDiscovery: source={} feed={} entries={}", source.key(), feedUrl, entries.size());
            result.addAll(entries);
        }
        return result;
    }

    private List<String> feedUrls(RecipeSource source) {
        if (!source.feedUrls().isEmpty()) {
            return source.feedUrls();
        }
        URI base = URI.create(source.baseUrl());
        for (String path : FEED_PATHS) {
            String candidate = base.resolve(path).toString();
            if (fetcher.exists(candidate)) {
                log.debug("FeedDiscovery: probed feed for source={} at {}", source.key(), candidate);
                return List.of(candidate);
            }
        }
        return List.of();
    }

    private List<CandidateUrl> readFeed(String feedUrl, int limit) {
        Optional<String> body = fetcher.fetchDocument(feedUrl);
        if (body.isEmpty()) {
            return List.of();
        }

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(body.get()));
        } catch (FeedException | IllegalArgumentException e) {
            log.warn("FeedDiscovery: cannot parse feed={}: {}", feedUrl, e.getMessage());
            return List.of();
        }

        List<CandidateUrl> result = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            if (result.size() >= limit) {
                break;
            }
            String link = linkOf(entry);
            if (link == null) {
                continue;
            }
            result.add(new CandidateUrl(link, dateOf(entry)));
        }
        return result;
    }

    private static String linkOf(SyndEntry entry) {
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            return entry.getLink().trim();
        }
        if (entry.getLinks() != null) {
            for (SyndLink link : entry.getLinks()) {
                if (link.getHref() != null && !link.getHref().isBlank()) {
                    return link.getHref().trim();
                }
            }
        }
        return null;
    }

    private static Instant dateOf(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date == null ? null : date.toInstant();
    }
}
