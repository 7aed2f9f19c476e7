package simrun.coordinator.model;

/**
 * Status of a job as reported by the batch-compute service, in its own vocabulary.
 *
 * @param phase  raw status, e.g. {@code RUNNABLE} or {@code SUCCEEDED}
 * @param detail free-text reason, may be null
 */
public record ExternalStatus(String phase, String detail) {
}
