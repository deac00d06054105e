package tdsc.blog.engagement.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * User account. Immutable once registered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    /**
     * Unique user identifier
     */
    private Long userId;

    /**
     * Username (unique, 2-50 characters)
     */
    private String username;

    /**
     * Email address (unique)
     */
    private String email;

    /**
     * Hashed password (BCrypt)
     */
    private String passwordHash;

    /**
     * Timestamp when user was created
     */
    private LocalDateTime createdAt;
}
