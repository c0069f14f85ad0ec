package com.vidnyan.lintnorm.adapter.in.web;

import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.format.UnknownFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownFormat_ShouldMapToBadRequest() {
        var problem = handler.handleUnknownFormat(new UnknownFormatException("jshint", List.of("unix", "eslint")));

        assertEquals(HttpStatus.BAD_REQUEST.value(), problem.getStatus());
        assertEquals("Unknown Format", problem.getTitle());
        assertTrue(problem.getDetail().contains("jshint"));
        assertTrue(problem.getType().toString().endsWith("/unknown-format"));
    }

    @Test
    void unparseableOutput_ShouldMapToUnprocessableEntity() {
        var problem = handler.handleUnparseableOutput(
                new LintOutputFormatException("Missing required field 'line'", "$[2]"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY.value(), problem.getStatus());
        assertTrue(problem.getDetail().contains("Missing required field 'line' at $[2]"));
        assertEquals("$[2]", problem.getProperties().get("location"));
    }

    @Test
    void unexpectedError_ShouldNotLeakDetails() {
        var problem = handler.handleGenericException(new IllegalStateException("secret internals"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR.value(), problem.getStatus());
        assertFalse(problem.getDetail().contains("secret internals"));
    }
}
