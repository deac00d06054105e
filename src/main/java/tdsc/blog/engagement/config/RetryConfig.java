package tdsc.blog.engagement.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry behaviour for the vote read-modify-write
 */
@Configuration
public class RetryConfig {

    /**
     * One immediate re-run when a concurrent submit for the same (user, post)
     * wins the insert (unique constraint) or removes the row we were about to
     * flip or delete (zero rows affected).
     */
    @Bean
    public RetryTemplate voteRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(2)
                .retryOn(DuplicateKeyException.class)
                .retryOn(OptimisticLockingFailureException.class)
                .noBackoff()
                .build();
    }
}
