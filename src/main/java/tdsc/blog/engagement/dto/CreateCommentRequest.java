package tdsc.blog.engagement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import tdsc.blog.engagement.validation.CodePointLength;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "New comment")
public class CreateCommentRequest {
    @NotNull(message = "Text is required")
    @CodePointLength(min = 1, max = 2000, message = "Text must be between 1 and 2000 characters")
    @Schema(description = "Comment text", example = "Great post!")
    private String text;
}
