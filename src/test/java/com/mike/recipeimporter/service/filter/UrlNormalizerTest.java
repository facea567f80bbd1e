package com.mike.recipeimporter.service.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class UrlNormalizerTest {

    private final UrlNormalizer normalizer = new UrlNormalizer();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("null -> null")
        void normalize_null() {
            assertNull(normalizer.normalize(null));
        }

        @Test
        @DisplayName("lower-cases scheme and host, keeps path case")
        void normalize_lowercases_scheme_and_host() {
            //Arrange
            String input = "HTTPS://WWW.Example.COM/Recipes/Lemon-Cake";
            //Act
            String result = normalizer.normalize(input);
            //Assert
            assertEquals("https://www.example.com/Recipes/Lemon-Cake", result);
        }

        @Test
        @DisplayName("drops tracking params and fragment, sorts the rest")
        void normalize_strips_tracking_and_sorts() {
            //Arrange
            String input = "https://example.com/recipes/cake/?utm_source=news&b=2&fbclid=abc&a=1&ref=home#comments";
            //Act
            String result = normalizer.normalize(input);
            //Assert
            assertEquals("https://example.com/recipes/cake?a=1&b=2", result);
        }

        @Test
        @DisplayName("parameter order does not matter")
        void normalize_same_for_reordered_params() {
            //Act
            String first = normalizer.normalize("https://example.com/r?x=1&y=2");
            String second = normalizer.normalize("https://example.com/r?y=2&x=1");
            //Assert
            assertEquals(first, second);
        }

        @Test
        @DisplayName("repeated parameter keeps value order")
        void normalize_repeated_param() {
            //Act
            String result = normalizer.normalize("https://example.com/r?tag=b&tag=a");
            //Assert
            assertEquals("https://example.com/r?tag=b&tag=a", result);
        }

        @Test
        @DisplayName("blank values are dropped")
        void normalize_drops_blank_values() {
            //Act
            String result = normalizer.normalize("https://example.com/r?empty=&page=2");
            //Assert
            assertEquals("https://example.com/r?page=2", result);
        }

        @Test
        @DisplayName("root url loses its slash")
        void normalize_root() {
            assertEquals("https://example.com", normalizer.normalize("https://example.com/"));
        }

        @Test
        @DisplayName("keeps explicit port")
        void normalize_keeps_port() {
            assertEquals("http://localhost:8080/a", normalizer.normalize("http://LOCALHOST:8080/a/"));
        }

        @Test
        @DisplayName("normalizing twice changes nothing")
        void normalize_is_idempotent() {
            //Arrange
            String[] inputs = {
                    "https://Example.com/a/b/?q=hello%20world&utm_medium=x",
                    "https://example.com/?b=2&a=1",
                    "http://www.example.co.uk/recipe#step-2",
            };
            for (String input : inputs) {
                //Act
                String once = normalizer.normalize(input);
                String twice = normalizer.normalize(once);
                //Assert
                assertEquals(once, twice, "not idempotent for " + input);
            }
        }

        @Test
        @DisplayName("unparseable input is returned trimmed")
        void normalize_unparseable() {
            assertEquals("not a url", normalizer.normalize("  not a url "));
        }
    }

    @Nested
    @DisplayName("host")
    class Host {

        @Test
        @DisplayName("lower-case host, with and without www")
        void host_variants() {
            //Arrange
            String url = "https://WWW.Example.com/recipes/x";
            //Act + Assert
            assertEquals("www.example.com", normalizer.host(url));
            assertEquals("example.com", normalizer.hostWithoutWww(url));
        }

        @Test
        @DisplayName("no host -> empty")
        void host_missing() {
            assertEquals("", normalizer.host("mailto:someone@example.com"));
            assertEquals("", normalizer.host("::::"));
        }
    }
}
