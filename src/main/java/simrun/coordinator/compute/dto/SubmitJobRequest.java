package simrun.coordinator.compute.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for submitting a run.
 * POST /v1/submitjob
 */
public record SubmitJobRequest(
        @JsonProperty("jobName") String jobName,
        @JsonProperty("jobQueue") String jobQueue,
        @JsonProperty("jobDefinition") String jobDefinition,
        @JsonProperty("containerOverrides") ContainerOverrides containerOverrides) {

    public record ContainerOverrides(@JsonProperty("environment") List<EnvironmentVariable> environment) {
    }

    public record EnvironmentVariable(@JsonProperty("name") String name, @JsonProperty("value") String value) {
    }

    /** Environment entries sorted by name */
    public static SubmitJobRequest of(String jobName, String jobQueue, String jobDefinition,
            Map<String, String> environment) {
        List<EnvironmentVariable> vars = environment.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> new EnvironmentVariable(e.getKey(), e.getValue()))
                .toList();
        return new SubmitJobRequest(jobName, jobQueue, jobDefinition, new ContainerOverrides(vars));
    }
}
