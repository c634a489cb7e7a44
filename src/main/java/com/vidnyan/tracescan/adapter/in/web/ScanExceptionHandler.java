package com.vidnyan.tracescan.adapter.in.web;

import com.vidnyan.tracescan.exception.ConfigurationException;
import com.vidnyan.tracescan.exception.DirectoryNotFoundException;
import com.vidnyan.tracescan.exception.TraceScanException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps scanner exceptions to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ScanExceptionHandler {

    @ExceptionHandler({ConfigurationException.class, DirectoryNotFoundException.class})
    public ResponseEntity<ErrorResponse> badRequest(TraceScanException e) {
        log.warn("Rejected scan request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(e.getClass().getSimpleName(), e.getMessage()));
    }

    @ExceptionHandler(TraceScanException.class)
    public ResponseEntity<ErrorResponse> scanFailed(TraceScanException e) {
        log.error("Scan failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(e.getClass().getSimpleName(), e.getMessage()));
    }

    public record ErrorResponse(String error, String message) {}
}
