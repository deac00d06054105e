package tdsc.blog.engagement.exception;

/**
 * Sign-in failed. Unknown email and wrong password are deliberately indistinguishable.
 */
public class InvalidCredentialsException extends BusinessException {
    public InvalidCredentialsException() {
        super("Invalid email or password");
    }
}
