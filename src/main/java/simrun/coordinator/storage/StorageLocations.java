package simrun.coordinator.storage;

import simrun.coordinator.error.UnrecognizedLocationFormatException;
import simrun.coordinator.model.StorageLocation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses every location encoding that has been stored for results over time
 * into one canonical {@link StorageLocation}.
 * <p>
 * Accepted:
 * <ul>
 * <li>{@code s3://bucket/key}</li>
 * <li>virtual-hosted: {@code https://bucket.s3.amazonaws.com/key},
 * {@code https://bucket.s3.us-east-1.amazonaws.com/key},
 * {@code https://bucket.s3-accelerate.amazonaws.com/key}, {@code .amazonaws.com.cn}</li>
 * <li>path-style: {@code https://s3.amazonaws.com/bucket/key},
 * {@code https://s3.us-east-1.amazonaws.com/bucket/key}</li>
 * </ul>
 * Query strings (presign signatures) and fragments are dropped.
 */
public final class StorageLocations {

    private static final Pattern VIRTUAL_HOSTED = Pattern.compile(
            "^https?://([^./]+)\\.s3(?:[.-][a-z0-9-]+)*\\.amazonaws\\.com(?:\\.cn)?/(.+)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PATH_STYLE = Pattern.compile(
            "^https?://s3(?:[.-][a-z0-9-]+)*\\.amazonaws\\.com(?:\\.cn)?/([^/]+)/(.+)$",
            Pattern.CASE_INSENSITIVE);

    private StorageLocations() {
    }

    /**
     * @throws UnrecognizedLocationFormatException if no accepted encoding matches
     */
    public static StorageLocation parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnrecognizedLocationFormatException(String.valueOf(raw));
        }
        String location = stripQuery(raw.trim());

        if (location.regionMatches(true, 0, "s3://", 0, 5)) {
            String rest = location.substring(5);
            int slash = rest.indexOf('/');
            if (slash > 0 && slash < rest.length() - 1) {
                return new StorageLocation(rest.substring(0, slash), rest.substring(slash + 1));
            }
            throw new UnrecognizedLocationFormatException(safeForMessage(raw));
        }

        Matcher m = VIRTUAL_HOSTED.matcher(location);
        if (m.matches()) {
            return new StorageLocation(m.group(1), m.group(2));
        }

        m = PATH_STYLE.matcher(location);
        if (m.matches()) {
            return new StorageLocation(m.group(1), m.group(2));
        }

        throw new UnrecognizedLocationFormatException(safeForMessage(raw));
    }

    private static String stripQuery(String location) {
        int cut = location.length();
        int q = location.indexOf('?');
        if (q >= 0) {
            cut = q;
        }
        int hash = location.indexOf('#');
        if (hash >= 0 && hash < cut) {
            cut = hash;
        }
        return location.substring(0, cut);
    }

    // Rejected input may still carry a signature in its query string.
    private static String safeForMessage(String raw) {
        return CredentialSanitizer.sanitize(stripQuery(raw));
    }
}
