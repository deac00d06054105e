package tdsc.blog.engagement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Issued access token plus the authenticated user
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Access token response")
public class TokenResponse {
    public static final String BEARER = "bearer";

    @Schema(description = "Signed JWT access token")
    private String accessToken;

    @Builder.Default
    @Schema(description = "Token type", example = BEARER)
    private String tokenType = BEARER;

    private UserResponse user;
}
