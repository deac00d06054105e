package tdsc.blog.engagement.exception;

/**
 * Access token could not be verified.
 * Never mapped to a response directly: callers either fall back to anonymous
 * access or raise {@link UnauthenticatedException}.
 */
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        /**
         * Signature valid but the expiry has passed
         */
        EXPIRED,
        /**
         * Signature mismatch, unsupported token or other verification failure
         */
        INVALID,
        /**
         * Not a parseable token, or the subject claim is missing or not a user id
         */
        MALFORMED
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public TokenVerificationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public Reason getReason() {
        return reason;
    }
}
