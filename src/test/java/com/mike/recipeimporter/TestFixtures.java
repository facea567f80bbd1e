package com.mike.recipeimporter;

import com.mike.recipeimporter.config.CatalogProperties;
import com.mike.recipeimporter.config.ImporterProperties;
import com.mike.recipeimporter.dto.RecipeSource;

import java.util.ArrayList;
import java.util.List;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static ImporterProperties importerProperties() {
        ImporterProperties props = new ImporterProperties();
        props.getCrawling().setThrottleSeconds(0.0);
        props.setSummaryLog("");
        return props;
    }

    public static CatalogProperties.Site site(String key, String base, String... domains) {
        CatalogProperties.Site site = new CatalogProperties.Site();
        site.setKey(key);
        site.setBase(base);
        site.setDomains(new ArrayList<>(List.of(domains)));
        return site;
    }

    public static CatalogProperties catalog(CatalogProperties.Site... sites) {
        CatalogProperties props = new CatalogProperties();
        props.setSites(new ArrayList<>(List.of(sites)));
        return props;
    }

    public static RecipeSource source(String key, String baseUrl, String... domains) {
        return new RecipeSource(key, key, baseUrl, List.of(domains),
                List.of(), List.of(), List.of(), List.of(), List.of(), true);
    }

    public static RecipeSource sourceWithListing(String key, String baseUrl, List<String> listingUrls, String... domains) {
        return new RecipeSource(key, key, baseUrl, List.of(domains),
                List.of(), List.of(), listingUrls, List.of(), List.of(), true);
    }
}
