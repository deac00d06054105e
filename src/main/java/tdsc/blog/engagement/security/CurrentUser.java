package tdsc.blog.engagement.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds the authenticated caller to a {@link tdsc.blog.engagement.domain.User} handler parameter.
 *
 * <p>With {@code required = true} (default) a request without a valid bearer token is
 * rejected with 401. With {@code required = false} the parameter is null for anonymous
 * callers.</p>
 */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface CurrentUser {
    boolean required() default true;
}
