package com.mike.recipeimporter.service.destination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Mealie REST client. Tags and categories are cached by name for the lifetime of the process.
 */
@Component
@Slf4j
public class MealieRecipeDestination implements RecipeDestination {

    private static final int MAX_REASON_LENGTH = 200;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    private final Map<String, String> tagCache = new ConcurrentHashMap<>();
    private final Map<String, String> categoryCache = new ConcurrentHashMap<>();

    public MealieRecipeDestination(@Qualifier("mealieRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isReachable() {
        try {
            RawResponse response = exchange(restClient.get().uri("/api/app/about"));
            if (!response.isSuccess()) {
                log.error("Mealie: connection test failed, status={}", response.status());
                return false;
            }
            JsonNode about = readJson(response.body());
            log.info("Mealie: connected, version={}", about.path("version").asText("unknown"));
            return true;
        } catch (RestClientException e) {
            log.error("Mealie: cannot connect: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public IngestionResult createFromUrl(String url, List<String> tags, List<String> categories) {
        ObjectNode payload = objectMapper.createObjectNode()
                .put("includeTags", true)
                .put("url", url);
        try {
            RawResponse response = exchange(restClient.post()
                    .uri("/api/recipes/create/url")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload));

            return switch (response.status()) {
                case 201 -> created(response, tags, categories);
                case 202 -> IngestionResult.queued();
                case 409 -> {
                    log.info("Mealie: recipe already exists url={}", url);
                    yield IngestionResult.alreadyExists();
                }
                default -> {
                    String reason = "HTTP " + response.status() + ": " + shorten(response.body());
                    log.warn("Mealie: url import failed url={} reason={}", url, reason);
                    yield IngestionResult.rejected(reason);
                }
            };
        } catch (RestClientException e) {
            log.error("Mealie: url import error url={}: {}", url, e.getMessage());
            return IngestionResult.rejected(e.getMessage());
        }
    }

    @Override
    public IngestionResult createFromRawContent(String url, String content, List<String> tags, List<String> categories) {
        ObjectNode payload = objectMapper.createObjectNode()
                .put("includeTags", true)
                .put("data", content)
                .put("url", url);
        try {
            RawResponse response = exchange(restClient.post()
                    .uri("/api/recipes/create/html-or-json")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload));

            if (response.status() == 201) {
                return created(response, tags, categories);
            }
            if (response.status() == 409) {
                return IngestionResult.alreadyExists();
            }
            String reason = "HTTP " + response.status() + ": " + shorten(response.body());
            log.warn("Mealie: html import failed url={} reason={}", url, reason);
            return IngestionResult.rejected(reason);
        } catch (RestClientException e) {
            log.error("Mealie: html import error url={}: {}", url, e.getMessage());
            return IngestionResult.rejected(e.getMessage());
        }
    }

    @Override
    public Optional<String> ensureTag(String name) {
        return ensureOrganizer("/api/organizers/tags", name, tagCache, true);
    }

    @Override
    public Optional<String> ensureCategory(String name) {
        return ensureOrganizer("/api/organizers/categories", name, categoryCache, true);
    }

    private IngestionResult created(RawResponse response, List<String> tags, List<String> categories) {
        JsonNode body = readJson(response.body());
        String slug;
        String name;
        if (body.isTextual()) {
            // Mealie answers create/url with the bare slug
            slug = body.asText();
            name = slug;
        } else {
            slug = body.hasNonNull("slug") ? body.get("slug").asText() : body.path("id").asText("");
            name = body.path("name").asText("Unknown");
        }
        attachOrganizers(slug, tags, categories);
        return IngestionResult.created(slug.isBlank() ? null : slug, name);
    }

    private Optional<String> ensureOrganizer(String path, String name, Map<String, String> cache, boolean retryOnConflict) {
        String cached = cache.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }

        try {
            RawResponse search = exchange(restClient.get()
                    .uri(uriBuilder -> uriBuilder.path(path).queryParam("search", name).build()));
            if (search.status() == 200) {
                JsonNode data = readJson(search.body());
                JsonNode items = data.has("items") ? data.get("items") : data;
                for (JsonNode item : items) {
                    if (item.path("name").asText("").equalsIgnoreCase(name)) {
                        String id = item.path("id").asText("");
                        cache.put(name, id);
                        return Optional.of(id);
                    }
                }
            }
        } catch (RestClientException e) {
            log.debug("Mealie: organizer search failed path={} name={}: {}", path, name, e.getMessage());
        }

        try {
            RawResponse create = exchange(restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("name", name)));
            if (create.status() == 200 || create.status() == 201) {
                String id = readJson(create.body()).path("id").asText("");
                cache.put(name, id);
                log.debug("Mealie: created organizer path={} name={}", path, name);
                return Optional.of(id);
            }
            if (create.status() == 409 && retryOnConflict) {
                // created concurrently, look it up once more
                return ensureOrganizer(path, name, cache, false);
            }
            log.warn("Mealie: cannot create organizer path={} name={} status={}", path, name, create.status());
        } catch (RestClientException e) {
            log.warn("Mealie: organizer create failed path={} name={}: {}", path, name, e.getMessage());
        }
        return Optional.empty();
    }

    private void attachOrganizers(String slug, List<String> tags, List<String> categories) {
        boolean hasTags = tags != null && !tags.isEmpty();
        boolean hasCategories = categories != null && !categories.isEmpty();
        if (slug == null || slug.isBlank() || (!hasTags && !hasCategories)) {
            return;
        }

        try {
            RawResponse current = exchange(restClient.get().uri("/api/recipes/{slug}", slug));
            if (current.status() != 200) {
                return;
            }
            JsonNode recipe = readJson(current.body());

            ObjectNode update = objectMapper.createObjectNode();
            if (hasTags) {
                ArrayNode merged = merge(recipe.path("tags"), tags, this::ensureTag);
                if (merged != null) update.set("tags", merged);
            }
            if (hasCategories) {
                ArrayNode merged = merge(recipe.path("recipeCategory"), categories, this::ensureCategory);
                if (merged != null) update.set("recipeCategory", merged);
            }
            if (update.isEmpty()) {
                return;
            }

            RawResponse patched = exchange(restClient.patch()
                    .uri("/api/recipes/{slug}", slug)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(update));
            log.debug("Mealie: organizers update slug={} status={}", slug, patched.status());
        } catch (RestClientException e) {
            log.debug("Mealie: organizers update failed slug={}: {}", slug, e.getMessage());
        }
    }

    /** Existing entries plus the missing names; null when nothing is missing. */
    private ArrayNode merge(JsonNode existing, List<String> wanted,
                            Function<String, Optional<String>> resolver) {
        ArrayNode result = objectMapper.createArrayNode();
        Set<String> present = new HashSet<>();
        if (existing.isArray()) {
            for (JsonNode node : existing) {
                result.add(node);
                present.add(node.path("name").asText("").toLowerCase(Locale.ROOT));
            }
        }
        boolean added = false;
        for (String name : wanted) {
            if (present.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            Optional<String> id = resolver.apply(name);
            if (id.isPresent()) {
                result.add(objectMapper.createObjectNode().put("id", id.get()).put("name", name));
                present.add(name.toLowerCase(Locale.ROOT));
                added = true;
            }
        }
        return added ? result : null;
    }

    private RawResponse exchange(RestClient.RequestHeadersSpec<?> spec) {
        return spec.exchange((request, response) -> new RawResponse(
                response.getStatusCode().value(),
                StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)
        ));
    }

    private JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Mealie: response is not JSON: {}", shorten(body));
            return objectMapper.createObjectNode();
        }
    }

    private static String shorten(String body) {
        if (body == null || body.isBlank()) {
            return "Unknown error";
        }
        return body.length() <= MAX_REASON_LENGTH ? body : body.substring(0, MAX_REASON_LENGTH);
    }

    private record RawResponse(int status, String body) {
        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
