package simrun.coordinator.compute.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /v1/terminatejob
 */
public record TerminateJobRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("reason") String reason) {
}
