package com.mike.recipeimporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@ConfigurationPropertiesScan
public class RecipeImporterApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(RecipeImporterApplication.class, args);

        // one-shot mode: exit with the status of the import run
        boolean oneShot = context.getEnvironment()
                .getProperty("recipeimporter.runner.enabled", Boolean.class, true);
        if (oneShot) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
