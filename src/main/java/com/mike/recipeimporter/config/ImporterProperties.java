package com.mike.recipeimporter.config;

import com.mike.recipeimporter.dto.RunMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "recipeimporter")
public class ImporterProperties {

    private Limits limits = new Limits();

    /**
     * Discovery asks for perSite * multiplier candidates, so filtering and dedup
     * still leave enough to fill the per-site quota.
     */
    private int discoveryMultiplier = 2;

    private Crawling crawling = new Crawling();

    /** Drop candidates without schema.org Recipe markup before ingestion. */
    private boolean requireRecipeSchema = false;

    /** One JSON object per finished run is appended here. Blank disables it. */
    private String summaryLog = "./data/import.log";

    private Runner runner = new Runner();

    /** Empty = admin endpoints are open (only bind them to a private network then). */
    private String adminToken = "";

    public ModeLimits limitsFor(RunMode mode) {
        return mode == RunMode.BACKFILL ? limits.getBackfill() : limits.getDelta();
    }

    @Data
    public static class Limits {
        private ModeLimits backfill = new ModeLimits(75, 1500);
        private ModeLimits delta = new ModeLimits(40, 800);
    }

    @Data
    public static class ModeLimits {
        private int perSite;
        private int totalCap;

        public ModeLimits() {
        }

        public ModeLimits(int perSite, int totalCap) {
            this.perSite = perSite;
            this.totalCap = totalCap;
        }
    }

    @Data
    public static class Crawling {
        private String userAgent = "RecipeImporter/1.0 (+local homelab)";
        /** Product token matched against robots.txt groups; derived from the user agent when blank. */
        private String robotsAgentName = "";
        private double throttleSeconds = 1.0;
        private int requestTimeoutMs = 30_000;
        private int probeTimeoutMs = 5_000;
        private int robotsTimeoutMs = 10_000;

        public String effectiveRobotsAgentName() {
            if (robotsAgentName != null && !robotsAgentName.isBlank()) {
                return robotsAgentName.trim().toLowerCase();
            }
            String token = userAgent == null ? "" : userAgent.trim();
            int cut = token.indexOf('/');
            if (cut > 0) token = token.substring(0, cut);
            cut = token.indexOf(' ');
            if (cut > 0) token = token.substring(0, cut);
            return token.isBlank() ? "*" : token.toLowerCase();
        }
    }

    @Data
    public static class Runner {
        private boolean enabled = true;
        /** How long a shutdown waits for the active run to reach a checkpoint. */
        private int shutdownGraceSeconds = 60;
    }
}
