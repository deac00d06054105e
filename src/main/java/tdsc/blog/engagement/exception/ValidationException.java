package tdsc.blog.engagement.exception;

/**
 * Field value failed a length or format rule
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message);
    }
}
