package com.mike.recipeimporter.service.politeness;

import java.io.IOException;

/**
 * Raw HTTP access. Does not pace or consult robots; see {@link PoliteFetcher} for that.
 */
public interface PageClient {

    FetchedPage get(String url, int timeoutMs) throws IOException;

    /** Status code of a HEAD request with redirects followed. */
    int head(String url, int timeoutMs) throws IOException;

    record FetchedPage(int statusCode, String body, String contentType) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
