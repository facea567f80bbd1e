package com.mike.recipeimporter.service.filter;

import com.mike.recipeimporter.config.AllowlistProperties;
import com.mike.recipeimporter.config.ImporterConfigurationException;
import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.service.SourceCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Allow/deny policy per site. Deny always wins, nothing is accepted without an allow match.
 */
@Component
@Slf4j
public class DomainFilter {

    private final SourceCatalog catalog;
    private final UrlNormalizer normalizer;

    private final List<Pattern> commonDeny;
    private final List<Pattern> commonDenyQuery;
    private final Map<String, SiteRules> siteRules = new HashMap<>();

    public DomainFilter(AllowlistProperties props, SourceCatalog catalog, UrlNormalizer normalizer) {
        this.catalog = catalog;
        this.normalizer = normalizer;

        AllowlistProperties.Common common = props.getCommon() == null
                ? new AllowlistProperties.Common()
                : props.getCommon();
        this.commonDeny = compile("common.deny-regex", common.getDenyRegex());
        this.commonDenyQuery = compile("common.deny-query-regex", common.getDenyQueryRegex());

        if (props.getSites() != null) {
            for (AllowlistProperties.SiteRules rules : props.getSites()) {
                if (rules.getKey() == null || rules.getKey().isBlank()) {
                    throw new ImporterConfigurationException("Allowlist entry without site key");
                }
                String key = rules.getKey().trim();
                siteRules.put(key, new SiteRules(
                        compile(key + ".allow-regex", rules.getAllowRegex()),
                        compile(key + ".deny-regex", rules.getDenyRegex())
                ));
            }
        }

        log.info("DomainFilter: compiled rules for {} sites, commonDeny={}, commonDenyQuery={}",
                siteRules.size(), commonDeny.size(), commonDenyQuery.size());
    }

    /**
     * @param siteKey source key, or null to resolve it from the url host via the catalog
     */
    public boolean isValid(String url, String siteKey) {
        if (url == null || url.isBlank()) {
            return false;
        }
        if (matchesAny(commonDeny, url)) {
            log.debug("DomainFilter: common deny url={}", url);
            return false;
        }
        if (matchesAny(commonDenyQuery, url)) {
            log.debug("DomainFilter: common query deny url={}", url);
            return false;
        }

        String key = siteKey;
        if (key == null) {
            key = catalog.findByHost(normalizer.host(url))
                    .map(RecipeSource::key)
                    .orElse(null);
        }
        if (key == null) {
            log.debug("DomainFilter: unknown site for url={}", url);
            return false;
        }

        SiteRules rules = siteRules.get(key);
        if (rules == null) {
            log.debug("DomainFilter: no rules for site={} url={}", key, url);
            return false;
        }
        if (matchesAny(rules.deny(), url)) {
            log.debug("DomainFilter: site deny site={} url={}", key, url);
            return false;
        }
        if (rules.allow().isEmpty()) {
            return false;
        }
        return matchesAny(rules.allow(), url);
    }

    public boolean hasRulesFor(String siteKey) {
        return siteRules.containsKey(siteKey);
    }

    private static boolean matchesAny(List<Pattern> patterns, String url) {
        for (Pattern p : patterns) {
            if (p.matcher(url).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String where, List<String> regexes) {
        if (regexes == null) {
            return List.of();
        }
        return regexes.stream()
                .filter(Objects::nonNull)
                .map(r -> {
                    try {
                        return Pattern.compile(r, Pattern.CASE_INSENSITIVE);
                    } catch (PatternSyntaxException e) {
                        throw new ImporterConfigurationException(
                                "Invalid regex in allowlist " + where + ": " + r, e);
                    }
                })
                .toList();
    }

    private record SiteRules(List<Pattern> allow, List<Pattern> deny) {
    }
}
