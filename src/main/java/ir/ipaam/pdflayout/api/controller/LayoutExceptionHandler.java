package ir.ipaam.pdflayout.api.controller;

import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.exception.RenderBackendException;
import lombok.extern.slf4j.Slf4j;
import org.axonframework.commandhandling.CommandExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps rendering failures to problem details. Checked exceptions thrown by command
 * handlers reach the controller wrapped in a {@link CommandExecutionException}.
 */
@Slf4j
@RestControllerAdvice
public class LayoutExceptionHandler {

    @ExceptionHandler(CommandExecutionException.class)
    public ProblemDetail handleCommandFailure(CommandExecutionException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof DocumentException documentException) {
                return handleDocumentException(documentException);
            }
        }
        log.error("Command execution failed", e);
        return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(DocumentException.class)
    public ProblemDetail handleDocumentException(DocumentException e) {
        HttpStatus status;
        if (e instanceof LayoutException) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
            log.warn("Document cannot be laid out: {}", e.getMessage());
        } else if (e instanceof RenderBackendException) {
            status = HttpStatus.BAD_GATEWAY;
            log.error("PDF backend failed", e);
        } else if (e instanceof ConfigurationException) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("Invalid layout configuration", e);
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("Rendering failed", e);
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, e.getMessage());
        problem.setTitle(e.getClass().getSimpleName());
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    }
}
