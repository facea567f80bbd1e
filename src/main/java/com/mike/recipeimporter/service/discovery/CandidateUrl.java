package com.mike.recipeimporter.service.discovery;

import java.time.Instant;

/**
 * @param publishedAt publish or modification time when the source exposes one; only used for ordering
 */
public record CandidateUrl(String url, Instant publishedAt) {

    public static CandidateUrl undated(String url) {
        return new CandidateUrl(url, null);
    }
}
