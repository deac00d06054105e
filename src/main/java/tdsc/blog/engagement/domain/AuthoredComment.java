package tdsc.blog.engagement.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Comment row joined with its author's username.
 * {@code username} is null when the author row no longer exists.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AuthoredComment extends Comment {
    private String username;
}
