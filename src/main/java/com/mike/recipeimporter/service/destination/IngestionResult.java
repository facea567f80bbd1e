package com.mike.recipeimporter.service.destination;

/**
 * Outcome of one creation attempt on the destination.
 *
 * @param destinationId recipe slug, only for CREATED
 * @param reason        only for REJECTED
 */
public record IngestionResult(Outcome outcome, String destinationId, String name, String reason) {

    public enum Outcome {
        CREATED,
        ALREADY_EXISTS,
        QUEUED,
        REJECTED
    }

    public static IngestionResult created(String destinationId, String name) {
        return new IngestionResult(Outcome.CREATED, destinationId, name, null);
    }

    public static IngestionResult alreadyExists() {
        return new IngestionResult(Outcome.ALREADY_EXISTS, null, null, null);
    }

    public static IngestionResult queued() {
        return new IngestionResult(Outcome.QUEUED, null, null, null);
    }

    public static IngestionResult rejected(String reason) {
        return new IngestionResult(Outcome.REJECTED, null, null, reason);
    }

    /** Created or already present: the recipe is on the destination either way. */
    public boolean isStored() {
        return outcome == Outcome.CREATED || outcome == Outcome.ALREADY_EXISTS;
    }
}
