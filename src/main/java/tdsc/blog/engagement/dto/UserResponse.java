package tdsc.blog.engagement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tdsc.blog.engagement.domain.User;

import java.time.LocalDateTime;

/**
 * Public view of a user; never carries the password hash
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "User details")
public class UserResponse {
    @Schema(description = "User ID", example = "42")
    private String id;

    @Schema(description = "Username", example = "alice")
    private String username;

    @Schema(description = "Email address", example = "alice@example.com")
    private String email;

    private LocalDateTime createdAt;

    public static UserResponse fromUser(User user) {
        return UserResponse.builder()
                .id(String.valueOf(user.getUserId()))
                .username(user.getUsername())
                .email(user.getEmail())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
