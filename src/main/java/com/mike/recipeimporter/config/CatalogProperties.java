package com.mike.recipeimporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw source catalog as bound from sources.yml. {@link com.mike.recipeimporter.service.SourceCatalog}
 * validates it and turns it into immutable sources.
 */
@Data
@ConfigurationProperties(prefix = "recipeimporter.catalog")
public class CatalogProperties {

    private List<Site> sites = new ArrayList<>();

    @Data
    public static class Site {
        private String key;
        private String name;
        private String base;
        private List<String> domains = new ArrayList<>();
        private Discovery discovery = new Discovery();
        private List<String> tags = new ArrayList<>();
        private List<String> categories = new ArrayList<>();
        private boolean enabled = true;
    }

    @Data
    public static class Discovery {
        private List<String> feeds = new ArrayList<>();
        private List<String> sitemaps = new ArrayList<>();
        private List<String> listingPages = new ArrayList<>();
    }
}
