package com.studentregistry.backend.api;

import com.studentregistry.backend.config.ApiLoggingFilter;
import com.studentregistry.backend.validation.StudentValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException e, HttpServletRequest req) {
        return error(req, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(StudentValidationException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleValidation(StudentValidationException e, HttpServletRequest req) {
        log.debug("Rejected payload: {}", e.getViolations());
        Map<String, Object> body = error(req, "VALIDATION_FAILED", e.getMessage());
        body.put("violations", e.getViolations());
        return body;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleMalformed(HttpMessageNotReadableException e, HttpServletRequest req) {
        return error(req, "MALFORMED_BODY", "request body is not valid JSON");
    }

    private static Map<String, Object> error(HttpServletRequest req, String kind, String message) {
        req.setAttribute(ApiLoggingFilter.ERROR_KIND, kind);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", kind);
        body.put("message", message);
        return body;
    }
}
