package com.myscrollr.delivery.webhook;

import com.myscrollr.delivery.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class WebhookExceptionHandler {

    @ExceptionHandler(MalformedEnvelopeException.class)
    public ResponseEntity<ErrorResponse> handleMalformed(MalformedEnvelopeException e) {
        log.warn("[CDC-ROUTER] Rejected webhook body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("error", e.getMessage()));
    }

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(WebhookAuthenticationException e) {
        log.warn("[CDC-ROUTER] Unauthorized webhook call: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse("error", "Unauthorized"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("error", e.getMessage()));
    }
}
