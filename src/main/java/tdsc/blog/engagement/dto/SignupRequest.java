package tdsc.blog.engagement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tdsc.blog.engagement.validation.CodePointLength;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Sign-up request")
public class SignupRequest {
    @NotNull(message = "Username is required")
    @CodePointLength(min = 2, max = 50, message = "Username must be between 2 and 50 characters")
    @Schema(description = "Username", example = "alice")
    private String username;

    @NotBlank(message = "Email cannot be blank")
    @Email(message = "Invalid email format")
    @Schema(description = "Email address", example = "alice@example.com")
    private String email;

    @NotNull(message = "Password is required")
    @CodePointLength(min = 6, message = "Password must be at least 6 characters")
    @Schema(description = "Password", example = "secret1")
    private String password;
}
