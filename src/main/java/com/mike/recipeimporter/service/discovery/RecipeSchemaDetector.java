package com.mike.recipeimporter.service.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.recipeimporter.service.politeness.PoliteFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Checks a page for schema.org Recipe markup (JSON-LD). Pages without any parseable
 * JSON-LD fall back to a keyword heuristic on the visible text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecipeSchemaDetector {

    private final PoliteFetcher fetcher;
    private final ObjectMapper objectMapper;

    public boolean hasRecipeSchema(String url) {
        Optional<String> html = fetcher.fetchPage(url);
        if (html.isEmpty()) {
            return false;
        }
        boolean result = containsRecipeSchema(html.get());
        log.debug("RecipeSchemaDetector: url={} recipe={}", url, result);
        return result;
    }

    boolean containsRecipeSchema(String html) {
        Document doc = Jsoup.parse(html);
        boolean anyStructuredData = false;

        for (Element script : doc.select("script[type=application/ld+json]")) {
            JsonNode node;
            try {
                node = objectMapper.readTree(script.data());
            } catch (JsonProcessingException e) {
                log.debug("RecipeSchemaDetector: skipping malformed JSON-LD block: {}", e.getOriginalMessage());
                continue;
            }
            if (node == null || node.isMissingNode()) {
                continue;
            }
            anyStructuredData = true;
            if (isRecipe(node)) {
                return true;
            }
        }

        if (anyStructuredData) {
            return false;
        }

        String text = doc.text().toLowerCase(Locale.ROOT);
        return text.contains("ingredient")
                && (text.contains("instruction") || text.contains("direction") || text.contains("method"));
    }

    private static boolean isRecipe(JsonNode node) {
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (isRecipe(item)) {
                    return true;
                }
            }
            return false;
        }
        if (!node.isObject()) {
            return false;
        }
        if (typeIsRecipe(node.get("@type"))) {
            return true;
        }
        JsonNode graph = node.get("@graph");
        return graph != null && isRecipe(graph);
    }

    private static boolean typeIsRecipe(JsonNode type) {
        if (type == null) {
            return false;
        }
        if (type.isTextual()) {
            return "Recipe".equals(type.asText());
        }
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && "Recipe".equals(t.asText())) {
                    return true;
                }
            }
        }
        return false;
    }
}
