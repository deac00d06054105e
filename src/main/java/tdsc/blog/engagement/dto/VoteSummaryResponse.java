package tdsc.blog.engagement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tdsc.blog.engagement.enums.VoteType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Vote counts for a post")
public class VoteSummaryResponse {
    @Schema(description = "Number of up votes across all users", example = "2")
    private long upvotes;

    @Schema(description = "Number of down votes across all users", example = "1")
    private long downvotes;

    /**
     * Caller's own vote; null when anonymous or not voted
     */
    @Schema(description = "Caller's own vote", nullable = true, example = "up")
    private VoteType userVote;
}
