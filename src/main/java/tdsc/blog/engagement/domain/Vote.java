package tdsc.blog.engagement.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tdsc.blog.engagement.enums.VoteType;

import java.time.LocalDateTime;

/**
 * A user's vote on a post. At most one row exists per (userId, postSlug).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vote {
    private Long voteId;

    /**
     * Voting user (non-owning reference)
     */
    private Long userId;

    /**
     * Opaque post key
     */
    private String postSlug;

    private VoteType voteType;

    private LocalDateTime createdAt;

    /**
     * Refreshed whenever the vote flips between up and down
     */
    private LocalDateTime updatedAt;
}
