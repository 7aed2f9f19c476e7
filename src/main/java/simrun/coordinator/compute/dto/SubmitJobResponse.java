package simrun.coordinator.compute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitJobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("jobName") String jobName) {
}
