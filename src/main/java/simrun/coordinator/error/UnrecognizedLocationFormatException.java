package simrun.coordinator.error;

/**
 * Stored results location matches none of the accepted encodings.
 */
public class UnrecognizedLocationFormatException extends ValidationException {

    public UnrecognizedLocationFormatException(String location) {
        super("Unrecognized storage location format (expected s3://bucket/key, "
                + "https://bucket.s3[.region].amazonaws.com/key or "
                + "https://s3[.region].amazonaws.com/bucket/key): " + location);
    }
}
