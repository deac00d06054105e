package tdsc.blog.engagement.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import tdsc.blog.engagement.exception.ValidationException;

/**
 * Kind of vote a user can cast on a post
 */
public enum VoteType {
    UP("up"),
    DOWN("down");

    private final String value;

    VoteType(String value) {
        this.value = value;
    }

    /**
     * Wire and storage representation ("up" / "down")
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse the wire representation.
     *
     * @throws ValidationException if the value is neither "up" nor "down"
     */
    public static VoteType fromValue(String value) {
        for (VoteType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new ValidationException("Vote type must be 'up' or 'down'");
    }
}
