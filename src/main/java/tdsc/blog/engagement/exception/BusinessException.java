package tdsc.blog.engagement.exception;

/**
 * Base class for expected, client-caused failures
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
