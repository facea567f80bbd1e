package com.mike.recipeimporter.service.discovery;

import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.service.politeness.PoliteFetcher;
import com.mike.recipeimporter.util.DomainMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Last resort: links on the declared listing pages that stay within the source's domains.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListingPageDiscoveryStrategy implements DiscoveryStrategy {

    private final PoliteFetcher fetcher;

    @Override
    public StrategyType type() {
        return StrategyType.LISTING_PAGE;
    }

    @Override
    public List<CandidateUrl> discover(RecipeSource source, int remaining) {
        Set<String> links = new LinkedHashSet<>();
        for (String listingUrl : source.listingUrls()) {
            if (links.size() >= remaining) {
                break;
            }
            Optional<String> html = fetcher.fetchPage(listingUrl);
            if (html.isEmpty()) {
                continue;
            }
            Document doc = Jsoup.parse(html.get(), listingUrl);
            int before = links.size();
            for (Element a : doc.select("a[href]")) {
                if (links.size() >= remaining) {
                    break;
                }
                String absUrl = a.absUrl("href");
                if (isInDomain(absUrl, source.domains())) {
                    links.add(absUrl);
                }
            }
            log.info("ListingDiscovery: source={} page={} links={}", source.key(), listingUrl, links.size() - before);
        }
        return links.stream().map(CandidateUrl::undated).toList();
    }

    private static boolean isInDomain(String url, List<String> domains) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                return false;
            }
            return DomainMatcher.matchesAny(uri.getHost(), domains);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
