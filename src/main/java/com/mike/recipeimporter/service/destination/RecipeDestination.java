package com.mike.recipeimporter.service.destination;

import java.util.List;
import java.util.Optional;

/**
 * The recipe manager that imported recipes end up in. Implementations report failures
 * through {@link IngestionResult}, never by throwing.
 */
public interface RecipeDestination {

    boolean isReachable();

    /** Let the destination scrape the url itself. */
    IngestionResult createFromUrl(String url, List<String> tags, List<String> categories);

    /** Import from page content fetched by us. Never answers QUEUED. */
    IngestionResult createFromRawContent(String url, String content, List<String> tags, List<String> categories);

    Optional<String> ensureTag(String name);

    Optional<String> ensureCategory(String name);
}
