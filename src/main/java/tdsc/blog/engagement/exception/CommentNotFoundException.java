package tdsc.blog.engagement.exception;

/**
 * Comment not found exception
 */
public class CommentNotFoundException extends BusinessException {
    public CommentNotFoundException(String message) {
        super(message);
    }
}
