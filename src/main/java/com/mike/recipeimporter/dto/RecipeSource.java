package com.mike.recipeimporter.dto;

import java.util.ArrayList;
import java.util.List;

public record RecipeSource(
        String key,
        String name,
        String baseUrl,
        List<String> domains,
        List<String> feedUrls,
        List<String> sitemapUrls,
        List<String> listingUrls,
        List<String> tags,
        List<String> categories,
        boolean enabled
) {
    public RecipeSource {
        domains = List.copyOf(domains);
        feedUrls = List.copyOf(feedUrls);
        sitemapUrls = List.copyOf(sitemapUrls);
        listingUrls = List.copyOf(listingUrls);
        tags = List.copyOf(tags);
        categories = List.copyOf(categories);
    }

    public String sourceTag() {
        return "source:" + key;
    }

    /** source:&lt;key&gt; first, then the declared tags (declared source:* tags are ignored). */
    public List<String> importTags() {
        List<String> result = new ArrayList<>();
        result.add(sourceTag());
        tags.stream()
                .filter(t -> !t.startsWith("source:"))
                .forEach(result::add);
        return result;
    }
}
