package tdsc.blog.engagement.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import tdsc.blog.engagement.dto.ErrorResponse;
import tdsc.blog.engagement.filter.RequestIdFilter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle duplicate username / email
     */
    @ExceptionHandler(DuplicateFieldException.class)
    public ResponseEntity<ErrorResponse<Void>> handleDuplicateField(DuplicateFieldException e) {
        log.warn("Duplicate field: field={}, message={}", e.getField(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Handle failed sign-in
     */
    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse<Void>> handleInvalidCredentials(InvalidCredentialsException e) {
        log.warn("Invalid credentials");
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    /**
     * Handle missing or invalid bearer token on a protected route
     */
    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse<Void>> handleUnauthenticated(UnauthenticatedException e) {
        log.warn("Unauthenticated request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(ErrorResponse.of(HttpStatus.UNAUTHORIZED.value(), e.getMessage(), currentRequestId()));
    }

    /**
     * Handle acting on another user's resource
     */
    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse<Void>> handleForbidden(ForbiddenOperationException e) {
        log.warn("Forbidden: {}", e.getMessage());
        return error(HttpStatus.FORBIDDEN, e.getMessage());
    }

    /**
     * Handle comment not found exception
     */
    @ExceptionHandler(CommentNotFoundException.class)
    public ResponseEntity<ErrorResponse<Void>> handleCommentNotFound(CommentNotFoundException e) {
        log.warn("Comment not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * Handle user not found exception
     */
    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse<Void>> handleUserNotFound(UserNotFoundException e) {
        log.warn("User not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * Handle field rule violations detected by services
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse<Void>> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Handle request validation exception
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse<Map<String, String>>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        log.warn("Request validation failed: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.<Map<String, String>>builder()
                        .code(400)
                        .message("Request validation failed")
                        .data(errors)
                        .requestId(currentRequestId())
                        .build());
    }

    /**
     * Handle missing or unparseable JSON body
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    /**
     * Handle general business exception
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse<Void>> handleBusinessException(BusinessException e) {
        log.error("Business exception: {}", e.getMessage(), e);
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, e.getMessage());
    }

    /**
     * Handle static resource not found (e.g., favicon.ico)
     * Do not log as error since this is expected behavior
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return error(HttpStatus.NOT_FOUND, "Resource not found");
    }

    /**
     * Handle all uncaught exceptions, including an unreachable database
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse<Void>> handleGenericException(Exception e) {
        log.error("Internal server error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error, please try again later");
    }

    private static ResponseEntity<ErrorResponse<Void>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), message, currentRequestId()));
    }

    private static String currentRequestId() {
        return MDC.get(RequestIdFilter.MDC_REQUEST_ID);
    }
}
