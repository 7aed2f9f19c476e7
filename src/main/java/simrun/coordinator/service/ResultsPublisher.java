package simrun.coordinator.service;

import simrun.coordinator.error.InvalidTransitionException;
import simrun.coordinator.error.PublishMetadataException;
import simrun.coordinator.error.RunNotFoundException;
import simrun.coordinator.error.StaleRunException;
import simrun.coordinator.error.ValidationException;
import simrun.coordinator.events.RunEventBus;
import simrun.coordinator.events.RunTransitionEvent;
import simrun.coordinator.model.Job;
import simrun.coordinator.model.OrphanRecord;
import simrun.coordinator.model.PackagedArtifact;
import simrun.coordinator.model.Run;
import simrun.coordinator.model.RunStatus;
import simrun.coordinator.model.RunTransitions;
import simrun.coordinator.model.StorageLocation;
import simrun.coordinator.packaging.ResultsPackager;
import simrun.coordinator.repository.JobRepository;
import simrun.coordinator.repository.OrphanRepository;
import simrun.coordinator.repository.RunRepository;
import simrun.coordinator.storage.CredentialSanitizer;
import simrun.coordinator.storage.ResultsKeys;
import simrun.coordinator.storage.ResultsStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Publishes the results of a run in two phases.
 * <ol>
 * <li>prepare: load the run, check ownership and that it may become DONE</li>
 * <li>execute: package the results directory and upload the archive</li>
 * <li>commit: mark the run DONE with location and timestamp in one write</li>
 * </ol>
 * When the commit fails after a successful upload, an {@link OrphanRecord} is written
 * for the stored archive and {@link PublishMetadataException} carries its location.
 * The run keeps its pre-publish status. Publishing is never retried here.
 * <p>
 * Publishing a run that already has results returns the stored location without
 * uploading again.
 */
public class ResultsPublisher {

    private static final Logger log = LoggerFactory.getLogger(ResultsPublisher.class);

    static final String EVENT_SOURCE = "publish";

    private final RunRepository runRepository;
    private final JobRepository jobRepository;
    private final OrphanRepository orphanRepository;
    private final ResultsPackager packager;
    private final ResultsStoreGateway storeGateway;
    private final RunEventBus events;
    private final Duration defaultUrlTtl;
    private final Clock clock;

    public ResultsPublisher(RunRepository runRepository, JobRepository jobRepository,
            OrphanRepository orphanRepository, ResultsPackager packager, ResultsStoreGateway storeGateway,
            RunEventBus events, Duration defaultUrlTtl) {
        this(runRepository, jobRepository, orphanRepository, packager, storeGateway, events, defaultUrlTtl,
                Clock.systemUTC());
    }

    public ResultsPublisher(RunRepository runRepository, JobRepository jobRepository,
            OrphanRepository orphanRepository, ResultsPackager packager, ResultsStoreGateway storeGateway,
            RunEventBus events, Duration defaultUrlTtl, Clock clock) {
        this.runRepository = runRepository;
        this.jobRepository = jobRepository;
        this.orphanRepository = orphanRepository;
        this.packager = packager;
        this.storeGateway = storeGateway;
        this.events = events;
        this.defaultUrlTtl = defaultUrlTtl;
        this.clock = clock;
    }

    /**
     * Package, store and record the results of a run.
     *
     * @return location of the stored archive
     * @throws RunNotFoundException                                   if the run does not exist
     * @throws simrun.coordinator.error.RunOwnershipMismatchException if the run belongs to another job
     * @throws InvalidTransitionException                             if the run cannot become DONE
     * @throws simrun.coordinator.error.InvalidResultsDirectoryException if the directory is unusable
     * @throws simrun.coordinator.error.PackagingException            if reading the results fails
     * @throws simrun.coordinator.error.StorageException              if the upload fails
     * @throws PublishMetadataException                               if the archive was stored but the run was not updated
     */
    public StorageLocation publishResults(long jobId, long runId, Path resultsDirectory) {
        // Prepare
        Run run = RunLoader.load(runRepository, jobId, runId);
        if (run.isPublished()) {
            log.info("Run {} already published at {}, not uploading again", runId, run.resultsLocation());
            return run.resultsLocation();
        }
        if (!RunTransitions.canPublish(run)) {
            throw new InvalidTransitionException(runId, run.status(), RunStatus.DONE);
        }
        if (resultsDirectory == null) {
            throw new ValidationException("Results directory is required");
        }
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> new RunNotFoundException(jobId, runId));

        // Execute
        PackagedArtifact artifact = packager.packageResults(resultsDirectory);
        String key = ResultsKeys.runResultsKey(job, runId);
        StorageLocation location = storeGateway.upload(key, artifact.payload());
        log.info("Run {}: stored {} ({} files, checksum {})", runId, location, artifact.fileCount(),
                artifact.checksum());

        // Commit
        try {
            return commit(run, location);
        } catch (RuntimeException e) {
            throw orphaned(jobId, runId, location, e);
        }
    }

    /**
     * Download URL for the published results of a run, valid for the configured default lifetime.
     */
    public String resultsDownloadUrl(long jobId, long runId) {
        return resultsDownloadUrl(jobId, runId, defaultUrlTtl);
    }

    /**
     * Download URL for the published results of a run.
     *
     * @throws ValidationException if the run has no published results
     */
    public String resultsDownloadUrl(long jobId, long runId, Duration ttl) {
        Run run = RunLoader.load(runRepository, jobId, runId);
        if (!run.isPublished()) {
            throw new ValidationException("Run " + runId + " has no published results (status " + run.status() + ")");
        }
        return storeGateway.retrievableUrl(run.resultsLocation(), ttl);
    }

    // --- Helpers ---

    private StorageLocation commit(Run run, StorageLocation location) {
        try {
            return save(run, location);
        } catch (StaleRunException e) {
            log.debug("Run {} changed during publish, committing on fresh copy", run.id());
        }
        Run current = runRepository.find(run.jobId(), run.id())
                .orElseThrow(() -> new RunNotFoundException(run.jobId(), run.id()));
        if (current.isPublished() && current.resultsLocation().equals(location)) {
            return location;
        }
        return save(current, location);
    }

    private StorageLocation save(Run run, StorageLocation location) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Run published = RunTransitions.publish(run, location, now);
        Run saved = runRepository.save(published);
        if (run.status() != RunStatus.DONE) {
            events.publish(new RunTransitionEvent(saved.jobId(), saved.id(), run.status(), RunStatus.DONE,
                    EVENT_SOURCE, now));
        }
        log.info("Run {}: results published at {}", saved.id(), location);
        return saved.resultsLocation();
    }

    private PublishMetadataException orphaned(long jobId, long runId, StorageLocation location,
            RuntimeException cause) {
        String reason = CredentialSanitizer.sanitize(cause.getMessage());
        PublishMetadataException failure = new PublishMetadataException(
                "Failed to record results for run " + runId + " of job " + jobId + ": " + reason, location, cause);
        try {
            orphanRepository.record(new OrphanRecord(location, jobId, runId,
                    clock.instant().truncatedTo(ChronoUnit.MICROS), reason));
            log.warn("Run {}: metadata commit failed, orphan recorded for {}", runId, location);
        } catch (RuntimeException orphanFailure) {
            log.error("Run {}: metadata commit failed and orphan record for {} could not be written: {}",
                    runId, location, orphanFailure.getMessage());
            failure.addSuppressed(orphanFailure);
        }
        return failure;
    }
}
