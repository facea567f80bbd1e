package com.mike.recipeimporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "recipeimporter.allowlist")
public class AllowlistProperties {

    private Common common = new Common();
    private List<SiteRules> sites = new ArrayList<>();

    @Data
    public static class Common {
        private List<String> denyRegex = new ArrayList<>();
        private List<String> denyQueryRegex = new ArrayList<>();
    }

    @Data
    public static class SiteRules {
        private String key;
        private List<String> allowRegex = new ArrayList<>();
        private List<String> denyRegex = new ArrayList<>();
    }
}
