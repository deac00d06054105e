package tdsc.blog.engagement.security;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.exception.UnauthenticatedException;

import java.util.Optional;

/**
 * Supplies {@link CurrentUser}-annotated parameters.
 * Optional routes receive null for anonymous callers; required routes turn absence
 * into {@link UnauthenticatedException}.
 */
@Component
public class CurrentUserArgumentResolver implements HandlerMethodArgumentResolver {

    @Autowired
    private AuthenticationService authenticationService;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
                && User.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String header = request != null ? request.getHeader(HttpHeaders.AUTHORIZATION) : null;

        Optional<User> caller = authenticationService.resolveCaller(header);
        caller.ifPresent(user -> MDC.put("userId", String.valueOf(user.getUserId())));

        CurrentUser annotation = parameter.getParameterAnnotation(CurrentUser.class);
        if (annotation != null && annotation.required() && caller.isEmpty()) {
            throw new UnauthenticatedException("Not authenticated");
        }
        return caller.orElse(null);
    }
}
