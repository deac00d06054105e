package tdsc.blog.engagement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Vote submission")
public class VoteRequest {
    /**
     * Raw value; parsed with {@link tdsc.blog.engagement.enums.VoteType#fromValue(String)}
     */
    @Schema(description = "Vote kind", allowableValues = {"up", "down"}, example = "up")
    private String voteType;
}
