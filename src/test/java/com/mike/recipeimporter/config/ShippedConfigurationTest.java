package com.mike.recipeimporter.config;

import com.mike.recipeimporter.dto.RecipeSource;
import com.mike.recipeimporter.service.SourceCatalog;
import com.mike.recipeimporter.service.filter.DomainFilter;
import com.mike.recipeimporter.service.filter.UrlNormalizer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySource;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds the sources.yml and allowlist.yml that ship with the application.
 */
class ShippedConfigurationTest {

    private static final List<String> EXPECTED_KEYS = List.of(
            "ottolenghi", "guardian_food", "meerasodha", "thehappyfoodie", "akis",
            "recipetineats", "greatbritishchefs", "bbcgoodfood", "themediterraneandish", "seriouseats",
            "bonappetit", "saveur", "feastingathome", "olivemagazine", "spainonafork",
            "patijinich", "rickbayless", "hotthaikitchen", "rasamalaysia", "thewoksoflife"
    );

    private static CatalogProperties catalogProperties;
    private static AllowlistProperties allowlistProperties;
    private static SourceCatalog sourceCatalog;
    private static DomainFilter domainFilter;

    @BeforeAll
    static void load() throws IOException {
        Binder binder = binderFor("sources.yml", "allowlist.yml");
        catalogProperties = binder.bind("recipeimporter.catalog", CatalogProperties.class).get();
        allowlistProperties = binder.bind("recipeimporter.allowlist", AllowlistProperties.class).get();
        sourceCatalog = new SourceCatalog(catalogProperties);
        domainFilter = new DomainFilter(allowlistProperties, sourceCatalog, new UrlNormalizer());
    }

    private static Binder binderFor(String... resources) throws IOException {
        YamlPropertySourceLoader loader = new YamlPropertySourceLoader();
        List<ConfigurationPropertySource> sources = new ArrayList<>();
        for (String resource : resources) {
            for (PropertySource<?> propertySource : loader.load(resource, new ClassPathResource(resource))) {
                sources.add(ConfigurationPropertySource.from(propertySource));
            }
        }
        return new Binder(sources);
    }

    @Nested
    @DisplayName("sources.yml")
    class Sources {

        @Test
        @DisplayName("has the 20 expected sites with unique keys")
        void twenty_sites() {
            //Act
            List<String> keys = sourceCatalog.allSources().stream().map(RecipeSource::key).toList();
            //Assert
            assertEquals(20, keys.size());
            assertEquals(Set.copyOf(EXPECTED_KEYS), Set.copyOf(keys));
        }

        @Test
        @DisplayName("every site has a name, base url and at least one domain")
        void required_fields() {
            for (CatalogProperties.Site site : catalogProperties.getSites()) {
                assertNotNull(site.getName(), site.getKey());
                assertNotNull(site.getBase(), site.getKey());
                assertFalse(site.getDomains().isEmpty(), site.getKey());
            }
        }

        @Test
        @DisplayName("listing pages stay inside the site's domains")
        void listing_pages_in_domain() {
            for (RecipeSource source : sourceCatalog.allSources()) {
                for (String listing : source.listingUrls()) {
                    String host = new UrlNormalizer().host(listing);
                    assertTrue(sourceCatalog.findByHost(host).isPresent(), listing);
                }
            }
        }
    }

    @Nested
    @DisplayName("allowlist.yml")
    class Allowlist {

        @Test
        @DisplayName("every site has allow patterns")
        void all_sites_have_rules() {
            //Act
            Set<String> withAllow = allowlistProperties.getSites().stream()
                    .filter(r -> !r.getAllowRegex().isEmpty())
                    .map(AllowlistProperties.SiteRules::getKey)
                    .collect(Collectors.toSet());
            //Assert
            for (String key : EXPECTED_KEYS) {
                assertTrue(withAllow.contains(key), "missing allow patterns for " + key);
            }
        }

        @Test
        @DisplayName("ottolenghi recipe urls are accepted")
        void ottolenghi() {
            assertTrue(domainFilter.isValid("https://ottolenghi.co.uk/recipes/lamb-shawarma", "ottolenghi"));
            assertTrue(domainFilter.isValid("https://www.ottolenghi.co.uk/recipes/hummus", "ottolenghi"));
        }

        @Test
        @DisplayName("bbcgoodfood recipes accepted, collections rejected")
        void bbcgoodfood() {
            assertTrue(domainFilter.isValid("https://www.bbcgoodfood.com/recipes/chocolate-cake", "bbcgoodfood"));
            assertFalse(domainFilter.isValid("https://www.bbcgoodfood.com/recipes/collection/summer-recipes", "bbcgoodfood"));
        }

        @Test
        @DisplayName("common deny list rejects admin, taxonomy and media urls")
        void common_deny() {
            assertFalse(domainFilter.isValid("https://www.recipetineats.com/wp-admin/post.php", "recipetineats"));
            assertFalse(domainFilter.isValid("https://www.recipetineats.com/category/chicken", "recipetineats"));
            assertFalse(domainFilter.isValid("https://www.recipetineats.com/about", "recipetineats"));
            assertFalse(domainFilter.isValid("https://www.recipetineats.com/photo.jpg", "recipetineats"));
        }

        @Test
        @DisplayName("search query urls are rejected")
        void query_deny() {
            assertFalse(domainFilter.isValid("https://thewoksoflife.com/?s=dumplings", "thewoksoflife"));
        }

        @Test
        @DisplayName("site key is resolved from the host")
        void key_from_host() {
            assertTrue(domainFilter.isValid("https://thewoksoflife.com/scallion-pancakes", null));
        }
    }
}
