package com.mike.recipeimporter.service.discovery;

import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.service.filter.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
public class DiscoveryEngine {

    private final Map<StrategyType, DiscoveryStrategy> strategies = new EnumMap<>(StrategyType.class);
    private final UrlNormalizer normalizer;
    private final RecipeSchemaDetector schemaDetector;

    public DiscoveryEngine(List<DiscoveryStrategy> strategies,
                           UrlNormalizer normalizer,
                           RecipeSchemaDetector schemaDetector) {
        for (DiscoveryStrategy strategy : strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
        this.normalizer = normalizer;
        this.schemaDetector = schemaDetector;
    }

    /**
     * Up to {@code limit} normalized, distinct urls, newest first. Later strategies only run
     * while the earlier ones left the quota unfilled.
     */
    public List<String> discover(RecipeSource source, int limit) {
        List<CandidateUrl> collected = new ArrayList<>();

        for (StrategyType type : StrategyType.values()) {
            int remaining = limit - collected.size();
            if (remaining <= 0) {
                break;
            }
            DiscoveryStrategy strategy = strategies.get(type);
            if (strategy == null) {
                continue;
            }
            try {
                List<CandidateUrl> found = strategy.discover(source, remaining);
                collected.addAll(found.size() > remaining ? found.subList(0, remaining) : found);
                log.debug("DiscoveryEngine: source={} strategy={} found={}", source.key(), type, found.size());
            } catch (RuntimeException e) {
                log.warn("DiscoveryEngine: strategy {} failed for source={}: {}", type, source.key(), e.toString());
            }
        }

        List<String> urls = aggregate(collected, limit);
        log.info("DiscoveryEngine: source={} discovered {} urls (limit={})", source.key(), urls.size(), limit);
        return urls;
    }

    public boolean hasContentSchema(String url) {
        return schemaDetector.hasRecipeSchema(url);
    }

    List<String> aggregate(List<CandidateUrl> candidates, int limit) {
        List<CandidateUrl> sorted = new ArrayList<>(candidates);
        // List.sort is stable, undated entries keep strategy order at the end
        sorted.sort(Comparator.comparing(CandidateUrl::publishedAt, Comparator.nullsLast(Comparator.reverseOrder())));

        Set<String> unique = new LinkedHashSet<>();
        for (CandidateUrl candidate : sorted) {
            if (unique.size() >= limit) {
                break;
            }
            String normalized = normalizer.normalize(candidate.url());
            if (normalized != null && !normalized.isBlank()) {
                unique.add(normalized);
            }
        }
        return new ArrayList<>(unique);
    }
}
