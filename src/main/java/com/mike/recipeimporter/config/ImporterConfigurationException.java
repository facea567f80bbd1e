package com.mike.recipeimporter.config;

/**
 * Invalid or missing configuration. Thrown while the context starts, so the process
 * never begins a run with a half-usable catalog or filter set.
 */
public class ImporterConfigurationException extends RuntimeException {

    public ImporterConfigurationException(String message) {
        super(message);
    }

    public ImporterConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
