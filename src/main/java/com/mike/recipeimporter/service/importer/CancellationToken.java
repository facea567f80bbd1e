package com.mike.recipeimporter.service.importer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request. The orchestrator checks it between sources and between urls.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
