package com.mike.recipeimporter.service;

import com.mike.recipeimporter.config.CatalogProperties;
import com.mike.recipeimporter.config.ImporterConfigurationException;
import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.util.DomainMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable view of the configured recipe sources.
 */
@Component
@Slf4j
public class SourceCatalog {

    private final List<RecipeSource> sources;

    public SourceCatalog(CatalogProperties props) {
        this.sources = List.copyOf(build(props));
        log.info("SourceCatalog: loaded {} sources ({} enabled)",
                sources.size(), enabledSources().size());
    }

    public List<RecipeSource> allSources() {
        return sources;
    }

    public List<RecipeSource> enabledSources() {
        return sources.stream().filter(RecipeSource::enabled).toList();
    }

    public Optional<RecipeSource> findByKey(String key) {
        return sources.stream().filter(s -> s.key().equals(key)).findFirst();
    }

    /** First source (in catalog order) whose domains cover the host. */
    public Optional<RecipeSource> findByHost(String host) {
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        return sources.stream()
                .filter(s -> DomainMatcher.matchesAny(host, s.domains()))
                .findFirst();
    }

    private static List<RecipeSource> build(CatalogProperties props) {
        if (props == null || props.getSites() == null || props.getSites().isEmpty()) {
            throw new ImporterConfigurationException(
                    "No recipe sources configured (recipeimporter.catalog.sites is empty)");
        }

        Set<String> seenKeys = new HashSet<>();
        List<RecipeSource> result = new ArrayList<>();

        for (CatalogProperties.Site site : props.getSites()) {
            String key = trimToNull(site.getKey());
            if (key == null) {
                throw new ImporterConfigurationException("Source without key: base=" + site.getBase());
            }
            if (!seenKeys.add(key)) {
                throw new ImporterConfigurationException("Duplicate source key: " + key);
            }

            String base = trimToNull(site.getBase());
            List<String> domains = cleanList(site.getDomains()).stream()
                    .map(d -> d.toLowerCase(Locale.ROOT))
                    .toList();
            if (domains.isEmpty()) {
                if (base == null) {
                    throw new ImporterConfigurationException(
                            "Source '" + key + "' needs a base url or at least one domain");
                }
                domains = List.of(domainOf(key, base));
            }
            if (base == null) {
                base = "https://" + stripLeadingDot(domains.get(0));
            }

            CatalogProperties.Discovery discovery = site.getDiscovery() == null
                    ? new CatalogProperties.Discovery()
                    : site.getDiscovery();

            String name = trimToNull(site.getName());

            result.add(new RecipeSource(
                    key,
                    name == null ? key : name,
                    base,
                    domains,
                    cleanList(discovery.getFeeds()),
                    cleanList(discovery.getSitemaps()),
                    cleanList(discovery.getListingPages()),
                    cleanList(site.getTags()),
                    cleanList(site.getCategories()),
                    site.isEnabled()
            ));
        }
        return result;
    }

    private static String domainOf(String key, String base) {
        try {
            String host = URI.create(base).getHost();
            if (host == null || host.isBlank()) {
                throw new ImporterConfigurationException("Source '" + key + "' has a base url without host: " + base);
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            throw new ImporterConfigurationException("Source '" + key + "' has an invalid base url: " + base, e);
        }
    }

    private static String stripLeadingDot(String domain) {
        return domain.startsWith(".") ? domain.substring(1) : domain;
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
