package code.analysis.api;

import code.analysis.llm.ProviderErrorKind;
import code.analysis.llm.ProviderException;
import code.analysis.orchestrator.GenerationFailedException;
import code.analysis.prompt.InvalidTaskRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTaskRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(InvalidTaskRequestException ex) {
        log.warn("Validation error: {}", ex.errors());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Validation error", ex.errors());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Validation error", List.of("request body is not valid JSON"));
    }

    @ExceptionHandler(GenerationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleGenerationFailed(GenerationFailedException ex) {
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage(), null);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> handleProvider(ProviderException ex) {
        HttpStatus status = ex.kind() == ProviderErrorKind.NOT_INITIALIZED
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_GATEWAY;
        return error(status, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        if (details != null) {
            body.put("details", details);
        }
        return ResponseEntity.status(status).body(body);
    }
}
