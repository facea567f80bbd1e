package com.mike.recipeimporter.service.discovery;

/** Discovery strategies in the order they are tried. */
public enum StrategyType {
    FEED,
    SITEMAP,
    LISTING_PAGE
}
