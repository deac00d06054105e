package tdsc.blog.engagement.security;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.exception.TokenVerificationException;
import tdsc.blog.engagement.exception.TokenVerificationException.Reason;
import tdsc.blog.engagement.mapper.UserMapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthenticationServiceTest {

    @Mock
    private JwtTokenProvider tokenProvider;

    @Mock
    private UserMapper userMapper;

    @InjectMocks
    private AuthenticationService authenticationService;

    @Test
    void resolvesUserFromValidBearerToken() {
        User alice = User.builder().userId(7L).username("alice").build();
        when(tokenProvider.verifyToken("good-token")).thenReturn(7L);
        when(userMapper.findById(7L)).thenReturn(alice);

        assertThat(authenticationService.resolveCaller("Bearer good-token")).contains(alice);
    }

    @Test
    void schemeIsCaseInsensitive() {
        User alice = User.builder().userId(7L).username("alice").build();
        when(tokenProvider.verifyToken("good-token")).thenReturn(7L);
        when(userMapper.findById(7L)).thenReturn(alice);

        assertThat(authenticationService.resolveCaller("bearer good-token")).contains(alice);
    }

    @Test
    void missingOrForeignSchemeIsAnonymous() {
        assertThat(authenticationService.resolveCaller(null)).isEmpty();
        assertThat(authenticationService.resolveCaller("")).isEmpty();
        assertThat(authenticationService.resolveCaller("Basic YWxpY2U6c2VjcmV0")).isEmpty();
        assertThat(authenticationService.resolveCaller("Bearer   ")).isEmpty();

        verifyNoInteractions(tokenProvider, userMapper);
    }

    @Test
    void rejectedTokenIsAnonymous() {
        when(tokenProvider.verifyToken(any()))
                .thenThrow(new TokenVerificationException(Reason.EXPIRED, "Token expired"));

        assertThat(authenticationService.resolveCaller("Bearer stale-token")).isEmpty();
        verifyNoInteractions(userMapper);
    }

    @Test
    void tokenForDeletedUserIsAnonymous() {
        when(tokenProvider.verifyToken("orphan-token")).thenReturn(99L);
        when(userMapper.findById(99L)).thenReturn(null);

        assertThat(authenticationService.resolveCaller("Bearer orphan-token")).isEmpty();
    }
}
