package tdsc.blog.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Uniform error body returned for every 4xx/5xx response
 * @param <T> type of the optional detail payload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse<T> {
    /**
     * HTTP status code (400, 401, 403, 404, 500)
     */
    private Integer code;

    /**
     * Human readable message
     */
    private String message;

    /**
     * Optional detail, e.g. per-field validation messages
     */
    private T data;

    /**
     * Correlation id of the failed request
     */
    private String requestId;

    /**
     * Timestamp
     */
    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    /**
     * Error response with status code, message and correlation id
     */
    public static <T> ErrorResponse<T> of(Integer code, String message, String requestId) {
        return ErrorResponse.<T>builder()
                .code(code)
                .message(message)
                .requestId(requestId)
                .build();
    }
}
