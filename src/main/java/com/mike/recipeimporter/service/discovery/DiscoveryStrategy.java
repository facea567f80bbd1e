package com.mike.recipeimporter.service.discovery;

import com.mike.recipeimporter.dto.RecipeSource;

import java.util.List;

public interface DiscoveryStrategy {

    StrategyType type();

    /**
     * @param remaining how many more urls the engine still wants; implementations return at most that many
     */
    List<CandidateUrl> discover(RecipeSource source, int remaining);
}
