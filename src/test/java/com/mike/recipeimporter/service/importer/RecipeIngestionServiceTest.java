package com.mike.recipeimporter.service.importer;

import com.mike.recipeimporter.entity.UrlStatus;
import com.mike.recipeimporter.service.destination.IngestionResult;
import com.mike.recipeimporter.service.destination.RecipeDestination;
import com.mike.recipeimporter.service.ledger.StateLedger;
import com.mike.recipeimporter.service.politeness.PoliteFetcher;
import com.mike.recipeimporter.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RecipeIngestionServiceTest {

    private static final String URL = "https://example.com/recipes/cake";
    private static final List<String> TAGS = List.of("source:example");
    private static final List<String> CATEGORIES = List.of("Dinner");

    private RecipeDestination destination;
    private PoliteFetcher fetcher;
    private StateLedger ledger;
    private RecipeIngestionService service;

    @BeforeEach
    void setUp() {
        destination = mock(RecipeDestination.class);
        fetcher = mock(PoliteFetcher.class);
        ledger = mock(StateLedger.class);
        service = new RecipeIngestionService(destination, fetcher, ledger);
    }

    @Test
    @DisplayName("dry run: nothing sent, nothing recorded")
    void dry_run() {
        UrlOutcome outcome = service.ingest(URL, "example", TAGS, CATEGORIES, true);

        assertEquals(UrlOutcome.SKIPPED, outcome);
        verifyNoInteractions(destination, fetcher, ledger);
    }

    @Test
    @DisplayName("url import created -> imported with slug, no page fetch")
    void created() {
        //Arrange
        when(destination.createFromUrl(URL, TAGS, CATEGORIES)).thenReturn(IngestionResult.created("cake", "Cake"));
        //Act
        UrlOutcome outcome = service.ingest(URL, "example", TAGS, CATEGORIES, false);
        //Assert
        assertEquals(UrlOutcome.IMPORTED, outcome);
        verify(ledger).recordImport(URL, "example", UrlStatus.IMPORTED, "cake", null, null);
        verifyNoInteractions(fetcher);
    }

    @Test
    @DisplayName("already exists -> imported without id")
    void already_exists() {
        when(destination.createFromUrl(URL, TAGS, CATEGORIES)).thenReturn(IngestionResult.alreadyExists());

        assertEquals(UrlOutcome.IMPORTED, service.ingest(URL, "example", TAGS, CATEGORIES, false));
        verify(ledger).recordImport(URL, "example", UrlStatus.IMPORTED, null, null, null);
    }

    @Test
    @DisplayName("queued -> queued status, no fallback")
    void queued() {
        when(destination.createFromUrl(URL, TAGS, CATEGORIES)).thenReturn(IngestionResult.queued());

        assertEquals(UrlOutcome.QUEUED, service.ingest(URL, "example", TAGS, CATEGORIES, false));
        verify(ledger).recordImport(URL, "example", UrlStatus.QUEUED, null, null, null);
        verifyNoInteractions(fetcher);
    }

    @Test
    @DisplayName("rejected url import, page content accepted -> imported via fallback with hash")
    void fallback_success() {
        //Arrange
        String html = "<html><body>cake</body></html>";
        when(destination.createFromUrl(URL, TAGS, CATEGORIES)).thenReturn(IngestionResult.rejected("HTTP 400: no recipe"));
        when(fetcher.fetchPage(URL)).thenReturn(Optional.of(html));
        when(destination.createFromRawContent(URL, html, TAGS, CATEGORIES)).thenReturn(IngestionResult.created("cake", "Cake"));
        //Act
        UrlOutcome outcome = service.ingest(URL, "example", TAGS, CATEGORIES, false);
        //Assert
        assertEquals(UrlOutcome.IMPORTED_VIA_FALLBACK, outcome);
        verify(ledger).recordImport(URL, "example", UrlStatus.IMPORTED_VIA_FALLBACK, "cake",
                ContentHash.shortSha256(html), null);
    }

    @Test
    @DisplayName("rejected url import, page unavailable -> failed with both reasons")
    void page_unavailable() {
        //Arrange
        when(destination.createFromUrl(URL, TAGS, CATEGORIES)).thenReturn(IngestionResult.rejected("HTTP 400: no recipe"));
        when(fetcher.fetchPage(URL)).thenReturn(Optional.empty());
        //Act
        UrlOutcome outcome = service.ingest(URL, "example", TAGS, CATEGORIES, false);
        //Assert
        assertEquals(UrlOutcome.FAILED, outcome);
        verify(ledger).recordImport(eq(URL), eq("example"), eq(UrlStatus.FAILED), isNull(), isNull(),
                eq("URL import failed: HTTP 400: no recipe; page could not be fetched"));
        verify(destination, never()).createFromRawContent(any(), any(), any(), any());
    }

    @Test
    @DisplayName("both attempts rejected -> failed with content reason")
    void both_rejected() {
        when(destination.createFromUrl(URL, TAGS, CATEGORIES)).thenReturn(IngestionResult.rejected("HTTP 400: a"));
        when(fetcher.fetchPage(URL)).thenReturn(Optional.of("<html/>"));
        when(destination.createFromRawContent(URL, "<html/>", TAGS, CATEGORIES)).thenReturn(IngestionResult.rejected("HTTP 422: b"));

        assertEquals(UrlOutcome.FAILED, service.ingest(URL, "example", TAGS, CATEGORIES, false));
        verify(ledger).recordImport(URL, "example", UrlStatus.FAILED, null, null, "HTTP 422: b");
    }
}
