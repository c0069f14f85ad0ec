package com.vidnyan.lintnorm.adapter.in.web;

import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.format.UnknownFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * Maps parsing failures to RFC 7807 problem details:
 * <pre>
 * {
 *   "type": "https://vidnyan.com/lintnorm/errors/unparseable-output",
 *   "title": "Unparseable Linter Output",
 *   "status": 422,
 *   "detail": "Missing required field 'line' at $[0]",
 *   "location": "$[0]"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE_URI = "https://vidnyan.com/lintnorm/errors/";

    /**
     * Unknown format key → 400 Bad Request.
     */
    @ExceptionHandler(UnknownFormatException.class)
    public ProblemDetail handleUnknownFormat(UnknownFormatException ex) {
        log.warn("Unknown format requested: {}", ex.getFormatKey());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "unknown-format"));
        problem.setTitle("Unknown Format");
        return problem;
    }

    /**
     * Output that does not follow its format → 422 Unprocessable Entity.
     */
    @ExceptionHandler(LintOutputFormatException.class)
    public ProblemDetail handleUnparseableOutput(LintOutputFormatException ex) {
        log.warn("Unparseable output: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "unparseable-output"));
        problem.setTitle("Unparseable Linter Output");
        problem.setProperty("location", ex.getLocation());
        return problem;
    }

    /**
     * Anything else → 500 Internal Server Error, without internal details.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
        problem.setType(URI.create(ERROR_BASE_URI + "internal-error"));
        problem.setTitle("Internal Error");
        return problem;
    }
}
