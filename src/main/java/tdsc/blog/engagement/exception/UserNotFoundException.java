package tdsc.blog.engagement.exception;

/**
 * User not found exception
 */
public class UserNotFoundException extends BusinessException {
    public UserNotFoundException(String message) {
        super(message);
    }
}
