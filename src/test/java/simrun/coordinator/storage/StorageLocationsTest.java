package simrun.coordinator.storage;

import simrun.coordinator.error.UnrecognizedLocationFormatException;
import simrun.coordinator.model.StorageLocation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageLocationsTest {

    private static final StorageLocation EXPECTED =
            new StorageLocation("sim-results", "jobs/123/2025/10/23/211500/run_4_results.zip");

    @Test
    void acceptsEveryHistoricalEncoding() {
        List<String> encodings = List.of(
                "s3://sim-results/jobs/123/2025/10/23/211500/run_4_results.zip",
                "https://sim-results.s3.amazonaws.com/jobs/123/2025/10/23/211500/run_4_results.zip",
                "https://sim-results.s3.us-east-1.amazonaws.com/jobs/123/2025/10/23/211500/run_4_results.zip",
                "https://sim-results.s3-us-west-2.amazonaws.com/jobs/123/2025/10/23/211500/run_4_results.zip",
                "https://sim-results.s3.cn-north-1.amazonaws.com.cn/jobs/123/2025/10/23/211500/run_4_results.zip",
                "https://s3.amazonaws.com/sim-results/jobs/123/2025/10/23/211500/run_4_results.zip",
                "https://s3.eu-central-1.amazonaws.com/sim-results/jobs/123/2025/10/23/211500/run_4_results.zip");

        for (String encoding : encodings) {
            assertEquals(EXPECTED, StorageLocations.parse(encoding), encoding);
        }
    }

    @Test
    void stripsSignatureQuery() {
        String presigned = "https://sim-results.s3.amazonaws.com/jobs/123/2025/10/23/211500/run_4_results.zip"
                + "?X-Amz-Algorithm=AWS4-HMAC-SHA256&X-Amz-Signature=abcdef#frag";

        assertEquals(EXPECTED, StorageLocations.parse(presigned));
    }

    @Test
    void rejectsUnknownFormats() {
        for (String bad : List.of("", "ftp://host/file.zip", "s3://bucket-only", "s3://bucket/",
                "https://example.com/results.zip", "/local/path/results.zip")) {
            assertThrows(UnrecognizedLocationFormatException.class, () -> StorageLocations.parse(bad), bad);
        }
        assertThrows(UnrecognizedLocationFormatException.class, () -> StorageLocations.parse(null));
    }

    @Test
    void rejectionMessageCarriesNoSignature() {
        UnrecognizedLocationFormatException e = assertThrows(UnrecognizedLocationFormatException.class,
                () -> StorageLocations.parse("https://example.com/r.zip?X-Amz-Signature=deadbeef"));

        assertTrue(e.getMessage().contains("https://example.com/r.zip"));
        assertFalse(e.getMessage().contains("deadbeef"));
    }
}
