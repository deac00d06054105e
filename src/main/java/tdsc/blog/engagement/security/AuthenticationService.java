package tdsc.blog.engagement.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.exception.TokenVerificationException;
import tdsc.blog.engagement.mapper.UserMapper;

import java.util.Optional;

/**
 * Resolves the caller behind an Authorization header.
 * Every failure (missing header, bad token, deleted user) resolves to empty.
 */
@Slf4j
@Service
public class AuthenticationService {

    static final String BEARER_PREFIX = "Bearer ";

    @Autowired
    private JwtTokenProvider tokenProvider;

    @Autowired
    private UserMapper userMapper;

    /**
     * @param authorizationHeader raw Authorization header value, may be null
     * @return the caller, or empty when the request is anonymous or the token does not verify
     */
    public Optional<User> resolveCaller(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            return Optional.empty();
        }

        Long userId;
        try {
            userId = tokenProvider.verifyToken(token);
        } catch (TokenVerificationException e) {
            log.debug("Bearer token rejected: reason={}, message={}", e.getReason(), e.getMessage());
            return Optional.empty();
        }

        User user = userMapper.findById(userId);
        if (user == null) {
            log.debug("Bearer token subject no longer exists: userId={}", userId);
        }
        return Optional.ofNullable(user);
    }
}
