package simrun.coordinator.compute;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import simrun.coordinator.compute.dto.DescribeJobsRequest;
import simrun.coordinator.compute.dto.DescribeJobsResponse;
import simrun.coordinator.compute.dto.SubmitJobRequest;
import simrun.coordinator.compute.dto.SubmitJobResponse;
import simrun.coordinator.compute.dto.TerminateJobRequest;
import simrun.coordinator.config.CoordinatorConfig;
import simrun.coordinator.error.TerminalExternalException;
import simrun.coordinator.error.TransientExternalException;
import simrun.coordinator.model.ExternalStatus;
import simrun.coordinator.model.RunSubmission;
import simrun.coordinator.storage.CredentialSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * JSON-over-HTTP client for the batch-compute service.
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /v1/submitjob</li>
 * <li>POST /v1/describejobs</li>
 * <li>POST /v1/terminatejob</li>
 * </ul>
 * Throttling (429), server errors (5xx), I/O failures and timeouts are transient;
 * other 4xx responses and unknown jobs are terminal.
 * <p>
 * Text that may echo the response body is sanitized before it is logged or raised,
 * and the exceptions carrying it are not chained as causes.
 */
public class HttpBatchComputeClient implements BatchComputeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpBatchComputeClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final int MAX_ERROR_BODY = 512;

    private final URI endpoint;
    private final String jobQueue;
    private final String jobDefinition;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public HttpBatchComputeClient(CoordinatorConfig config) {
        this(URI.create(config.computeEndpoint()), config.computeJobQueue(), config.computeJobDefinition(),
                config.statusQueryTimeout());
    }

    public HttpBatchComputeClient(URI endpoint, String jobQueue, String jobDefinition, Duration requestTimeout) {
        this.endpoint = endpoint;
        this.jobQueue = jobQueue;
        this.jobDefinition = jobDefinition;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public String submit(RunSubmission submission) {
        SubmitJobRequest request = SubmitJobRequest.of(submission.jobName(), jobQueue, jobDefinition,
                submission.environment());
        SubmitJobResponse response = post("/v1/submitjob", request, SubmitJobResponse.class);
        if (response.jobId() == null || response.jobId().isBlank()) {
            throw new TransientExternalException("Compute service returned no job id for " + submission.jobName());
        }
        log.info("Submitted {} as compute job {}", submission.jobName(), response.jobId());
        return response.jobId();
    }

    @Override
    public ExternalStatus describe(String handle) {
        DescribeJobsResponse response = post("/v1/describejobs", new DescribeJobsRequest(List.of(handle)),
                DescribeJobsResponse.class);
        if (response.jobs() == null) {
            throw new TransientExternalException("Compute service returned no job list for " + handle);
        }
        return response.jobs().stream()
                .filter(job -> handle.equals(job.jobId()))
                .findFirst()
                .map(job -> new ExternalStatus(job.status(), job.statusReason()))
                .orElseThrow(() -> new TerminalExternalException("Compute job not found: " + handle));
    }

    @Override
    public void cancel(String handle, String reason) {
        post("/v1/terminatejob", new TerminateJobRequest(handle, reason), Void.class);
        log.info("Requested termination of compute job {}", handle);
    }

    // --- Helpers ---

    private <T> T post(String path, Object body, Class<T> responseType) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(endpoint.resolve(path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize compute request for " + path, e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientExternalException("Compute call " + path + " timed out after "
                    + requestTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TransientExternalException("Compute call " + path + " failed: "
                    + CredentialSanitizer.sanitize(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExternalException("Compute call " + path + " interrupted", e);
        }

        int code = response.statusCode();
        if (code == 429 || code >= 500) {
            throw new TransientExternalException("Compute call " + path + " returned " + code + ": "
                    + errorBody(response));
        }
        if (code < 200 || code >= 300) {
            throw new TerminalExternalException("Compute call " + path + " rejected with " + code + ": "
                    + errorBody(response));
        }

        if (responseType == Void.class) {
            return null;
        }
        try {
            return MAPPER.readValue(response.body(), responseType);
        } catch (JsonProcessingException e) {
            log.warn("Malformed response from {}: {}", path,
                    CredentialSanitizer.sanitize(e.getOriginalMessage()));
            throw new TransientExternalException("Malformed response from compute call " + path);
        }
    }

    private static String errorBody(HttpResponse<String> response) {
        String body = response.body() == null ? "" : response.body();
        if (body.length() > MAX_ERROR_BODY) {
            body = body.substring(0, MAX_ERROR_BODY) + "...";
        }
        return CredentialSanitizer.sanitize(body);
    }
}
