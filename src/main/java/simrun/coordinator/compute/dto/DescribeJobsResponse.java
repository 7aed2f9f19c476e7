package simrun.coordinator.compute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for POST /v1/describejobs. Jobs unknown to the service are absent from the list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DescribeJobsResponse(@JsonProperty("jobs") List<JobDetail> jobs) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobDetail(
            @JsonProperty("jobId") String jobId,
            @JsonProperty("status") String status,
            @JsonProperty("statusReason") String statusReason) {
    }
}
