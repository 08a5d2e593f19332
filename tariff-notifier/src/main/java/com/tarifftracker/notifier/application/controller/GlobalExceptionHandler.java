package com.tarifftracker.notifier.application.controller;

import com.tarifftracker.notifier.application.controller.telegram.InvalidWebhookSecretException;
import com.tarifftracker.notifier.infrastructure.telegram.MalformedUpdateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidWebhookSecretException.class)
    public ProblemDetail handleInvalidSecret(InvalidWebhookSecretException ex) {
        log.warn("webhook.rejected: reason={}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, "Invalid webhook secret");
        problem.setTitle("Unauthorized");
        problem.setProperty("code", ErrorCodes.INVALID_WEBHOOK_SECRET);
        return problem;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MalformedUpdateException.class})
    public ProblemDetail handleUnreadable(RuntimeException ex) {
        log.warn("webhook.malformed: error={}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed update");
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.MALFORMED_UPDATE);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        problem.setTitle("Internal Server Error");
        problem.setProperty("code", ErrorCodes.INTERNAL_ERROR);
        return problem;
    }
}
