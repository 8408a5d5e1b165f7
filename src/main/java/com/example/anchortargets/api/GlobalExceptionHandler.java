package com.example.anchortargets.api;

import com.example.anchortargets.service.I18nService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.servlet.http.HttpServletRequest;
import java.util.NoSuchElementException;

/**
 * Maps pipeline exceptions to consistent API responses
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Autowired
    private I18nService i18nService;

    private String getLanguageFromRequest(HttpServletRequest request) {
        return i18nService.resolveLanguage(request.getHeader("Accept-Language"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String message = i18nService.getMessage("bad.request", getLanguageFromRequest(request));
        ApiResponse<Void> response = ApiResponse.fail(message, "Malformed request body: " + ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(NoSuchElementException ex, HttpServletRequest request) {
        String message = i18nService.getMessage("image.not_found", getLanguageFromRequest(request));
        ApiResponse<Void> response = ApiResponse.fail(message, ex.getMessage() != null ? ex.getMessage() : "");
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ApiResponse<Void>> handleContractViolation(RuntimeException ex, HttpServletRequest request) {
        log.warn("Rejected request {}: {}", request.getRequestURI(), ex.getMessage());
        String message = i18nService.getMessage("bad.request", getLanguageFromRequest(request));
        ApiResponse<Void> response = ApiResponse.fail(message, ex.getMessage() != null ? ex.getMessage() : "");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        String message = i18nService.getMessage("server.error", getLanguageFromRequest(request));
        ApiResponse<Void> response = ApiResponse.fail(message, ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
