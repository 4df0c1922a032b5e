package com.example.Attrition.exception;

import com.example.Attrition.ingestion.FileError;
import com.example.Attrition.service.AttendanceUploadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EmployeeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEmployeeNotFound(EmployeeNotFoundException ex) {
        return build(ex.getStatus(), ex.getMessage(), Map.of("employeeId", ex.getEmployeeId()));
    }

    @ExceptionHandler(AttendanceUploadService.FileRejectedException.class)
    public ResponseEntity<ErrorResponse> handleFileRejected(AttendanceUploadService.FileRejectedException ex) {
        FileError fileError = ex.getFileError();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", fileError.getCode());
        if (!fileError.getMissingColumns().isEmpty()) {
            details.put("missingColumns", fileError.getMissingColumns());
        }
        return build(ex.getStatus(), ex.getMessage(), details);
    }

    @ExceptionHandler(CustomException.class)
    public ResponseEntity<ErrorResponse> handleCustom(CustomException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Request failed", ex);
        }
        return build(ex.getStatus(), ex.getMessage(), null);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "File exceeds the upload size limit", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, Map<String, Object> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(message)
                .details(details)
                .build());
    }
}
