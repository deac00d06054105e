package tdsc.blog.engagement.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Comment on a post. Only its author may delete it; it is never edited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Comment {
    private Long commentId;

    /**
     * Author (non-owning reference)
     */
    private Long userId;

    private String postSlug;

    /**
     * Comment body, 1-2000 characters
     */
    private String text;

    private LocalDateTime createdAt;
}
