package tdsc.blog.engagement.exception;

import tdsc.blog.engagement.enums.DuplicateField;

/**
 * Username or email is already registered
 */
public class DuplicateFieldException extends BusinessException {

    private final DuplicateField field;

    public DuplicateFieldException(DuplicateField field, String message) {
        super(message);
        this.field = field;
    }

    public DuplicateField getField() {
        return field;
    }
}
