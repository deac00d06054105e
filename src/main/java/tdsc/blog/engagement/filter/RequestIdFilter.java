package tdsc.blog.engagement.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Assigns every request a correlation id and traces it.
 *
 * <p>The id comes from the {@code X-Request-ID} header, or a fresh UUID when the header is
 * absent or blank. It is put into the SLF4J MDC as {@code requestId} (with {@code method}
 * and {@code uri}) and echoed on the response before the handler runs, so error
 * responses carry it as well.</p>
 *
 * <p>The MDC is always cleared afterwards to avoid leakage across pooled threads.</p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_REQUEST_ID = "requestId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = headerOrGenerate(request);
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put("method", request.getMethod());
        MDC.put("uri", request.getRequestURI());
        response.setHeader(REQUEST_ID_HEADER, requestId);

        log.info("Incoming {} {}", request.getMethod(), request.getRequestURI());
        long start = System.nanoTime();
        try {
            chain.doFilter(request, response);
            log.info("Completed {} {} with status {} (duration: {}s)",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), elapsedSeconds(start));
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("Error in {} {}: {} (duration: {}s)",
                    request.getMethod(), request.getRequestURI(), e.getMessage(), elapsedSeconds(start), e);
            throw e;
        } finally {
            MDC.clear();
        }
    }

    private static String headerOrGenerate(HttpServletRequest request) {
        String value = request.getHeader(REQUEST_ID_HEADER);
        return (value == null || value.isBlank()) ? UUID.randomUUID().toString() : value;
    }

    private static String elapsedSeconds(long startNanos) {
        return String.format("%.2f", (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }
}
