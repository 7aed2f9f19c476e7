package simrun.coordinator.storage;

import simrun.coordinator.model.StorageLocation;

import java.time.Duration;

/**
 * Object store seen through the two operations the coordinator needs.
 * One adapter per storage system.
 */
public interface ObjectStorageProvider {

    /**
     * Returns the name of this provider, for logs.
     */
    String name();

    /**
     * Store {@code content} under {@code key}, replacing any previous object.
     *
     * @return the provider's location string for the object (any encoding accepted by {@link StorageLocations})
     * @throws ObjectStorageException on any provider-side failure
     */
    String put(String key, byte[] content, String contentType) throws ObjectStorageException;

    /**
     * Time-limited URL from which the object can be downloaded without credentials.
     *
     * @throws ObjectStorageException if the object is missing or the URL cannot be produced
     */
    String presign(StorageLocation location, Duration ttl) throws ObjectStorageException;
}
