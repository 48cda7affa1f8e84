package io.github.drompincen.jobengine.gateway.controller;

import io.github.drompincen.jobengine.protocol.api.ErrorResponse;
import io.github.drompincen.jobengine.runtime.error.IllegalJobTransitionException;
import io.github.drompincen.jobengine.runtime.error.JobEngineException;
import io.github.drompincen.jobengine.runtime.error.JobNotFoundException;
import io.github.drompincen.jobengine.runtime.error.TaskNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps engine errors onto HTTP statuses. Ownership failures surface as 404, never 403.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(JobEngineException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        log.warn("HTTP_ERROR path={}, method={}, status={}, errorCode={}, errorMessage={}",
                path(request), method(request), status.value(), ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = truncate(ex.getMessage(), 300);
        log.warn("HTTP_ERROR path={}, method={}, status=400, errorType={}, errorMessage={}",
                path(request), method(request), ex.getClass().getSimpleName(), message);
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, status=500, errorType={}, errorMessage={}",
                path(request), method(request), ex.getClass().getSimpleName(), truncate(ex.getMessage(), 300), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal error"));
    }

    static HttpStatus statusFor(JobEngineException ex) {
        if (ex instanceof JobNotFoundException || ex instanceof TaskNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof IllegalJobTransitionException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static String path(HttpServletRequest request) {
        return request == null || request.getRequestURI() == null ? "-" : request.getRequestURI();
    }

    private static String method(HttpServletRequest request) {
        return request == null || request.getMethod() == null ? "-" : request.getMethod();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        return text.substring(0, maxLength);
    }
}
