package de.bsommerfeld.panelvault.core.profile;

/**
 * Thrown when a profile file cannot be imported.
 */
public class ProfileValidationException extends Exception {

    public enum Reason {
        /** The document is not JSON or its root is not an object. */
        INVALID_FORMAT,
        /** A required key is absent. */
        MISSING_KEY
    }

    private final Reason reason;
    private final String key;

    private ProfileValidationException(Reason reason, String key, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.key = key;
    }

    public static ProfileValidationException invalidFormat(String detail, Throwable cause) {
        return new ProfileValidationException(Reason.INVALID_FORMAT, null, "Invalid profile format: " + detail,
                cause);
    }

    public static ProfileValidationException missingKey(String key) {
        return new ProfileValidationException(Reason.MISSING_KEY, key, "Profile is missing required key '" + key + "'",
                null);
    }

    public Reason getReason() {
        return reason;
    }

    /** The missing key for {@link Reason#MISSING_KEY}, otherwise null. */
    public String getKey() {
        return key;
    }
}
