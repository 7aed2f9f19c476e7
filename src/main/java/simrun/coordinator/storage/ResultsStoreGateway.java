package simrun.coordinator.storage;

import simrun.coordinator.error.StorageException;
import simrun.coordinator.error.UnrecognizedLocationFormatException;
import simrun.coordinator.error.ValidationException;
import simrun.coordinator.model.StorageLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Uploads result archives and hands out download URLs.
 * <p>
 * Every provider call runs with a timeout. Any failure, whether reported by the
 * provider or unexpected, is converted to a {@link StorageException} whose message
 * has passed through {@link CredentialSanitizer}; the raw exception is neither
 * logged nor attached as cause. Failed uploads are not retried here.
 */
public class ResultsStoreGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultsStoreGateway.class);

    private static final String CONTENT_TYPE = "application/zip";
    private static final Duration MAX_URL_TTL = Duration.ofDays(7);

    private final ObjectStorageProvider provider;
    private final Duration callTimeout;
    private final ExecutorService executor;

    public ResultsStoreGateway(ObjectStorageProvider provider, Duration callTimeout) {
        this.provider = provider;
        this.callTimeout = callTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "simrun-storage-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Store an archive under {@code key}. The same key always addresses the same object.
     *
     * @return canonical location of the stored object
     * @throws StorageException with a sanitized message on any failure or timeout
     */
    public StorageLocation upload(String key, byte[] content) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("Object key is required");
        }
        String providerLocation = call("upload of " + key, () -> provider.put(key, content, CONTENT_TYPE));

        StorageLocation location;
        try {
            location = StorageLocations.parse(providerLocation);
        } catch (UnrecognizedLocationFormatException e) {
            throw fail("upload of " + key, "provider returned an unusable location: " + e.getMessage());
        }
        if (!location.key().equals(key)) {
            log.warn("Provider {} stored {} under a different key: {}", provider.name(), key, location.key());
        }
        log.info("Uploaded {} bytes to {}", content.length, location);
        return location;
    }

    /**
     * Download URL for a stored object, valid for {@code ttl}.
     */
    public String retrievableUrl(StorageLocation location, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative() || ttl.compareTo(MAX_URL_TTL) > 0) {
            throw new ValidationException("URL lifetime must be between 1s and " + MAX_URL_TTL + ": " + ttl);
        }
        String url = call("presign of " + location, () -> provider.presign(location, ttl));
        log.debug("Generated download URL for {}, expires in {}s", location, ttl.toSeconds());
        return url;
    }

    /**
     * Download URL for a location in any accepted historical encoding.
     * Signatures or other query parameters in {@code rawLocation} are discarded.
     *
     * @throws UnrecognizedLocationFormatException if the encoding is not recognized
     */
    public String retrievableUrl(String rawLocation, Duration ttl) {
        return retrievableUrl(StorageLocations.parse(rawLocation), ttl);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // --- Helpers ---

    private <T> T call(String operation, Callable<T> action) {
        Future<T> future = executor.submit(action);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw fail(operation, "timed out after " + callTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw fail(operation, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String kind = cause instanceof ObjectStorageException ? "provider error" : "unexpected error";
            throw fail(operation, kind + ": " + cause.getMessage());
        }
    }

    private StorageException fail(String operation, String rawDetail) {
        String sanitized = CredentialSanitizer.sanitize(rawDetail);
        log.error("Object storage {} failed on {}: {}", operation, provider.name(), sanitized);
        return new StorageException("Object storage " + operation + " failed: " + sanitized);
    }
}
