package tdsc.blog.engagement.exception;

/**
 * Caller tried to act on a resource owned by another user
 */
public class ForbiddenOperationException extends BusinessException {
    public ForbiddenOperationException(String message) {
        super(message);
    }
}
