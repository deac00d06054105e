package tdsc.blog.engagement.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tdsc.blog.engagement.config.OpenApiConfig;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.dto.SigninRequest;
import tdsc.blog.engagement.dto.SignupRequest;
import tdsc.blog.engagement.dto.TokenResponse;
import tdsc.blog.engagement.dto.UserResponse;
import tdsc.blog.engagement.security.CurrentUser;
import tdsc.blog.engagement.security.JwtTokenProvider;
import tdsc.blog.engagement.service.UserService;

/**
 * REST Controller for authentication
 * Handles sign-up, sign-in and current-user lookup
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@Validated
@Tag(name = "Authentication", description = "Sign-up, sign-in and session identity")
public class AuthController {

    @Autowired
    private UserService userService;

    @Autowired
    private JwtTokenProvider tokenProvider;

    /**
     * Register a new user and sign them in
     *
     * @param request the sign-up request
     * @return access token and user details
     */
    @PostMapping("/signup")
    @Operation(summary = "Register a new user", description = "Creates the account and returns an access token")
    public TokenResponse signup(@Valid @RequestBody SignupRequest request) {
        log.info("User signup attempt: username={}, email={}", request.getUsername(), request.getEmail());
        User user = userService.register(request.getUsername(), request.getEmail(), request.getPassword());
        return issueFor(user);
    }

    /**
     * Sign in with email and password
     *
     * @param request the sign-in request
     * @return access token and user details
     */
    @PostMapping("/signin")
    @Operation(summary = "Sign in", description = "Exchanges email and password for an access token")
    public TokenResponse signin(@Valid @RequestBody SigninRequest request) {
        log.info("User signin attempt: email={}", request.getEmail());
        User user = userService.authenticate(request.getEmail(), request.getPassword());
        return issueFor(user);
    }

    /**
     * Get the authenticated caller
     */
    @GetMapping("/me")
    @Operation(summary = "Current user", description = "Returns the user identified by the bearer token",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public UserResponse me(@Parameter(hidden = true) @CurrentUser User caller) {
        return UserResponse.fromUser(caller);
    }

    private TokenResponse issueFor(User user) {
        return TokenResponse.builder()
                .accessToken(tokenProvider.issueToken(user.getUserId()))
                .user(UserResponse.fromUser(user))
                .build();
    }
}
