package simrun.coordinator.error;

import simrun.coordinator.model.StorageLocation;

/**
 * Artifact was stored but the metadata commit failed. The location is the
 * orphaned object; an orphan record has been written for it when possible.
 */
public class PublishMetadataException extends CoordinatorException {

    private final StorageLocation orphanedLocation;

    public PublishMetadataException(String message, StorageLocation orphanedLocation, Throwable cause) {
        super(message + " (orphaned artifact: " + orphanedLocation + ")", cause);
        this.orphanedLocation = orphanedLocation;
    }

    public StorageLocation orphanedLocation() {
        return orphanedLocation;
    }
}
