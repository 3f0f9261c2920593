package com.example.pageedit.interfaces.api.error;

import com.example.pageedit.application.exception.ApplicationException;
import com.example.pageedit.application.exception.DocumentBusyException;
import com.example.pageedit.application.exception.UseCaseValidationException;
import com.example.pageedit.domain.exception.ArchivedPageEditException;
import com.example.pageedit.domain.exception.DocumentNotFoundException;
import com.example.pageedit.domain.exception.DomainException;
import com.example.pageedit.domain.exception.FolderNotFoundException;
import com.example.pageedit.domain.exception.PageCountInvariantException;
import com.example.pageedit.domain.exception.PageNotFoundException;
import com.example.pageedit.infrastructure.exception.InfrastructureException;
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
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps missing pages, documents and folders to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler({PageNotFoundException.class, DocumentNotFoundException.class, FolderNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "NOT_FOUND");
    }

    /**
     * Maps edits of superseded versions to a 409 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ArchivedPageEditException.class)
    public ResponseEntity<ErrorResponse> handleArchivedEdit(ArchivedPageEditException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.CONFLICT, "ARCHIVED_EDIT_CONFLICT");
    }

    /**
     * Maps edits that would leave a document without pages to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(PageCountInvariantException.class)
    public ResponseEntity<ErrorResponse> handleInvariant(PageCountInvariantException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "INVARIANT_VIOLATION");
    }

    /**
     * Maps the remaining domain validation exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "INVALID_REQUEST");
    }

    /**
     * Maps use-case validation exceptions to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "INVALID_REQUEST");
    }

    /**
     * Maps malformed bodies, parameters and missing parts to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "INVALID_REQUEST");
    }

    /**
     * Maps a document whose lease could not be obtained to a 409 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DocumentBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(DocumentBusyException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.CONFLICT, "DOCUMENT_BUSY");
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    /**
     * Maps storage and PDF codec failures to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("I/O failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "IO_FAILURE");
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
