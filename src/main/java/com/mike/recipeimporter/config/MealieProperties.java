package com.mike.recipeimporter.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "mealie")
public record MealieProperties(
        @NotBlank String baseUrl,
        @NotBlank String apiToken,
        @DefaultValue("30000") int timeoutMs,
        @DefaultValue("en-US") String acceptLanguage
) {
}
