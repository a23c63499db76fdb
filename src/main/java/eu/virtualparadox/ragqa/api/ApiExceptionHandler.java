package eu.virtualparadox.ragqa.api;

import eu.virtualparadox.ragqa.api.dto.ErrorResponse;
import eu.virtualparadox.ragqa.error.EErrorKind;
import eu.virtualparadox.ragqa.error.RagException;
import eu.virtualparadox.ragqa.error.UnsupportedSourceException;
import eu.virtualparadox.ragqa.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;

/**
 * Maps pipeline failures to HTTP: validation 400, unsupported source 415, anything else 500
 * with a generic message. The failure kind is always part of the body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String GENERIC_ERROR = "Request failed";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(final ValidationException ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ex.getMessage(), ex.getKind(), ex.getField()));
    }

    @ExceptionHandler(UnsupportedSourceException.class)
    public ResponseEntity<ErrorResponse> handleUnsupported(final UnsupportedSourceException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ErrorResponse.of(ex.getMessage(), ex.getKind()));
    }

    @ExceptionHandler(RagException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(final RagException ex) {
        // already logged with its stack trace by the orchestrator
        log.warn("Returning 500 for {} failure: {}", ex.getKind(), ex.getMessage());
        return ResponseEntity.internalServerError()
                .body(ErrorResponse.of(GENERIC_ERROR, ex.getKind()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIo(final IOException ex) {
        log.error("I/O failure while handling request", ex);
        return ResponseEntity.internalServerError()
                .body(ErrorResponse.of(GENERIC_ERROR, null));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(final Exception ex) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Malformed request: " + ex.getMessage(), EErrorKind.VALIDATION));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(final MaxUploadSizeExceededException ex) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ErrorResponse("Uploaded file is too large", EErrorKind.VALIDATION, "file"));
    }
}
