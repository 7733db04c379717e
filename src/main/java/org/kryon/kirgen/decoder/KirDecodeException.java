package org.kryon.kirgen.decoder;

/**
 * Raised when KIR input cannot be turned into a {@link org.kryon.kirgen.model.KirDocument}.
 * Fatal for the affected module only.
 */
public class KirDecodeException extends Exception {

    public enum Reason {
        /** Invalid JSON, or a known section with the wrong shape. */
        MALFORMED,
        /** The top-level value is not a JSON object, so nothing in it can be interpreted. */
        MISSING_ROOT
    }

    private final Reason reason;

    public KirDecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public KirDecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
