package simrun.coordinator.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes credential material from object store error text before it is
 * logged or raised.
 * <p>
 * Redacted:
 * <ul>
 * <li>access key IDs ({@code AKIA}, {@code ASIA}, {@code AGPA}, {@code AIDA},
 * {@code AROA}, {@code ANPA} followed by 16 characters)</li>
 * <li>secret-like strings of 40 or more base64 characters</li>
 * <li>{@code X-Amz-*} presign query parameters</li>
 * <li>credential elements in XML bodies (with or without attributes) and credential
 * fields in JSON bodies, matched in any letter case and in snake_case spelling</li>
 * </ul>
 */
public final class CredentialSanitizer {

    public static final String REDACTED_KEY = "[REDACTED_KEY]";
    public static final String REDACTED = "[REDACTED]";

    private static final Pattern ACCESS_KEY_ID =
            Pattern.compile("(?:AKIA|ASIA|AGPA|AIDA|AROA|ANPA)[A-Z0-9]{16}");

    private static final Pattern LONG_SECRET = Pattern.compile("[A-Za-z0-9+/=]{40,}");

    private static final Pattern PRESIGN_PARAM = Pattern.compile(
            "(X-Amz-(?:Credential|Signature|Security-Token|SignedHeaders|Algorithm|Expires|Date))=[^&\\s\"'<]+",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> KEY_ID_FIELDS =
            List.of("AWSAccessKeyId", "AccessKeyId", "aws_access_key_id", "access_key_id");

    private static final List<String> SECRET_FIELDS = List.of(
            "SecretAccessKey", "aws_secret_access_key", "secret_access_key",
            "SessionToken", "aws_session_token", "session_token",
            "SecurityToken", "security_token",
            "Signature", "StringToSign");

    private static final List<Pattern> KEY_ID_PATTERNS = fieldPatterns(KEY_ID_FIELDS);
    private static final List<Pattern> SECRET_PATTERNS = fieldPatterns(SECRET_FIELDS);

    private CredentialSanitizer() {
    }

    /**
     * @return the message with every credential-shaped substring replaced; {@code ""} for null
     */
    public static String sanitize(String message) {
        if (message == null) {
            return "";
        }
        String result = message;

        // Structured fields first, so the whole value is replaced rather than a fragment of it.
        result = redactFields(result, KEY_ID_PATTERNS, REDACTED_KEY);
        result = redactFields(result, SECRET_PATTERNS, REDACTED);

        result = PRESIGN_PARAM.matcher(result).replaceAll("$1=" + Matcher.quoteReplacement(REDACTED));
        result = ACCESS_KEY_ID.matcher(result).replaceAll(Matcher.quoteReplacement(REDACTED_KEY));
        result = LONG_SECRET.matcher(result).replaceAll(Matcher.quoteReplacement(REDACTED));
        return result;
    }

    // Per field: an XML element (attributes allowed) and a JSON string member, any letter case.
    private static List<Pattern> fieldPatterns(List<String> fields) {
        List<Pattern> patterns = new ArrayList<>();
        for (String field : fields) {
            String name = Pattern.quote(field);
            patterns.add(Pattern.compile("(<" + name + "(?:\\s[^>]*)?>)[^<]*(</" + name + "\\s*>)",
                    Pattern.CASE_INSENSITIVE));
            patterns.add(Pattern.compile("(\"" + name + "\"\\s*:\\s*\")(?:[^\"\\\\]|\\\\.)*(\")",
                    Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    private static String redactFields(String message, List<Pattern> patterns, String marker) {
        String result = message;
        for (Pattern p : patterns) {
            result = p.matcher(result).replaceAll("$1" + Matcher.quoteReplacement(marker) + "$2");
        }
        return result;
    }
}
