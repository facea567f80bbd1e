package com.mike.recipeimporter.service.politeness;

import com.mike.recipeimporter.TestFixtures;
import com.mike.recipeimporter.config.ImporterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PoliteFetcherTest {

    private PageClient pageClient;
    private RobotsPolicy robotsPolicy;
    private DomainRateLimiter rateLimiter;
    private PoliteFetcher fetcher;

    @BeforeEach
    void setUp() {
        ImporterProperties props = TestFixtures.importerProperties();
        pageClient = mock(PageClient.class);
        robotsPolicy = mock(RobotsPolicy.class);
        rateLimiter = new DomainRateLimiter(props);
        fetcher = new PoliteFetcher(pageClient, rateLimiter, robotsPolicy, props);
        when(robotsPolicy.isAllowed(anyString())).thenReturn(true);
    }

    @Nested
    @DisplayName("fetchDocument")
    class FetchDocument {

        @Test
        @DisplayName("2xx -> body")
        void success() throws IOException {
            //Arrange
            when(pageClient.get(eq("https://example.com/feed"), anyInt()))
                    .thenReturn(new PageClient.FetchedPage(200, "<rss/>", "application/rss+xml"));
            //Act
            Optional<String> body = fetcher.fetchDocument("https://example.com/feed");
            //Assert
            assertEquals(Optional.of("<rss/>"), body);
            assertEquals(1.0, rateLimiter.multiplier("example.com"));
        }

        @Test
        @DisplayName("429 -> empty and backoff grows")
        void rate_limited() throws IOException {
            //Arrange
            when(pageClient.get(anyString(), anyInt()))
                    .thenReturn(new PageClient.FetchedPage(429, "slow down", "text/plain"));
            //Act
            Optional<String> body = fetcher.fetchDocument("https://example.com/sitemap.xml");
            //Assert
            assertTrue(body.isEmpty());
            assertEquals(2.0, rateLimiter.multiplier("example.com"));
        }

        @Test
        @DisplayName("503 counts as rate limit")
        void unavailable() throws IOException {
            when(pageClient.get(anyString(), anyInt()))
                    .thenReturn(new PageClient.FetchedPage(503, "", "text/plain"));
            assertTrue(fetcher.fetchDocument("https://example.com/x").isEmpty());
            assertEquals(2.0, rateLimiter.multiplier("example.com"));
        }

        @Test
        @DisplayName("other HTTP errors -> empty, no backoff change")
        void http_error() throws IOException {
            when(pageClient.get(anyString(), anyInt()))
                    .thenReturn(new PageClient.FetchedPage(500, "boom", "text/plain"));
            assertTrue(fetcher.fetchDocument("https://example.com/x").isEmpty());
            assertEquals(1.0, rateLimiter.multiplier("example.com"));
        }

        @Test
        @DisplayName("connection error -> empty")
        void io_error() throws IOException {
            when(pageClient.get(anyString(), anyInt())).thenThrow(new IOException("timeout"));
            assertTrue(fetcher.fetchDocument("https://example.com/x").isEmpty());
        }
    }

    @Nested
    @DisplayName("fetchPage")
    class FetchPage {

        @Test
        @DisplayName("robots disallow -> empty without request")
        void robots_disallowed() throws IOException {
            //Arrange
            when(robotsPolicy.isAllowed("https://example.com/private")).thenReturn(false);
            //Act
            Optional<String> body = fetcher.fetchPage("https://example.com/private");
            //Assert
            assertTrue(body.isEmpty());
            verify(pageClient, never()).get(anyString(), anyInt());
        }

        @Test
        @DisplayName("robots allow -> body")
        void robots_allowed() throws IOException {
            when(pageClient.get(anyString(), anyInt()))
                    .thenReturn(new PageClient.FetchedPage(200, "<html></html>", "text/html"));
            assertEquals(Optional.of("<html></html>"), fetcher.fetchPage("https://example.com/recipes/a"));
        }
    }

    @Nested
    @DisplayName("exists")
    class Exists {

        @Test
        @DisplayName("200 -> true, 404 -> false, error -> false")
        void statuses() throws IOException {
            //Arrange
            when(pageClient.head(eq("https://example.com/feed"), anyInt())).thenReturn(200);
            when(pageClient.head(eq("https://example.com/rss"), anyInt())).thenReturn(404);
            when(pageClient.head(eq("https://example.com/atom.xml"), anyInt())).thenThrow(new IOException("reset"));
            //Act + Assert
            assertTrue(fetcher.exists("https://example.com/feed"));
            assertFalse(fetcher.exists("https://example.com/rss"));
            assertFalse(fetcher.exists("https://example.com/atom.xml"));
        }
    }
}
