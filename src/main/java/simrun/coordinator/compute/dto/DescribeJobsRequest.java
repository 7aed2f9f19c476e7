package simrun.coordinator.compute.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * POST /v1/describejobs
 */
public record DescribeJobsRequest(@JsonProperty("jobs") List<String> jobs) {
}
