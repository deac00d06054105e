package tdsc.blog.engagement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tdsc.blog.engagement.domain.Comment;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Comment as shown to a reader")
public class CommentResponse {
    public static final String UNKNOWN_AUTHOR = "Unknown";

    @Schema(description = "Comment ID", example = "7")
    private String id;

    @Schema(description = "Author's username", example = "alice")
    private String username;

    private String text;

    private LocalDateTime createdAt;

    /**
     * Whether the caller wrote this comment
     */
    @JsonProperty("is_own")
    @Schema(description = "Whether the caller authored this comment")
    private boolean own;

    public static CommentResponse fromComment(Comment comment, String username, boolean own) {
        return CommentResponse.builder()
                .id(String.valueOf(comment.getCommentId()))
                .username(username != null ? username : UNKNOWN_AUTHOR)
                .text(comment.getText())
                .createdAt(comment.getCreatedAt())
                .own(own)
                .build();
    }
}
