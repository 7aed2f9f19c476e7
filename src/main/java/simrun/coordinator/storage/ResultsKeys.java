package simrun.coordinator.storage;

import simrun.coordinator.model.Job;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Object keys for job artifacts.
 * <p>
 * Every artifact of a job shares one prefix derived from the job's creation
 * time, so uploads made seconds apart never end up in different folders:
 * <pre>
 * jobs/12/2025/10/23/211500/run_4_results.zip
 * </pre>
 */
public final class ResultsKeys {

    private static final DateTimeFormatter PREFIX_TIME =
            DateTimeFormatter.ofPattern("yyyy/MM/dd/HHmmss").withZone(ZoneOffset.UTC);

    private ResultsKeys() {
    }

    /** {@code jobs/{jobId}/{yyyy}/{MM}/{dd}/{HHmmss}} */
    public static String jobPrefix(Job job) {
        return "jobs/" + job.id() + "/" + PREFIX_TIME.format(job.createdAt());
    }

    public static String runResultsKey(Job job, long runId) {
        return jobPrefix(job) + "/run_" + runId + "_results.zip";
    }
}
