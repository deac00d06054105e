package tdsc.blog.engagement.exception;

/**
 * No valid bearer token on a route that requires one
 */
public class UnauthenticatedException extends BusinessException {
    public UnauthenticatedException(String message) {
        super(message);
    }
}
