package info.acme.ordering.exception;

import java.net.URI;
import java.time.Instant;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the REST controllers.
 * Maps the ordering exceptions to HTTP status codes and formats responses
 * using the Problem Details for HTTP APIs standard (RFC 7807).
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {
    /**
     * Capture {@link InvalidInputException} and returns HTTP 400 Bad Request.
     *
     * @param ex      The caught {@link InvalidInputException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(InvalidInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleInvalidInputException(InvalidInputException ex, WebRequest request) {
        log.warn("Handling InvalidInputException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Invalid Input", ex.getMessage(), request);
    }

    @ExceptionHandler(ProductNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleProductNotFoundException(ProductNotFoundException ex, WebRequest request) {
        log.warn("Handling ProductNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Product Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(AccountNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleAccountNotFoundException(AccountNotFoundException ex, WebRequest request) {
        log.warn("Handling AccountNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Account Not Found", ex.getMessage(), request);
    }

    /**
     * Capture {@link InvalidOrderException} and returns HTTP 404 Not Found.
     * A missing order and an order owned by another account produce the same
     * response.
     *
     * @param ex      The caught {@link InvalidOrderException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(InvalidOrderException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleInvalidOrderException(InvalidOrderException ex, WebRequest request) {
        log.warn("Handling InvalidOrderException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Invalid Order", ex.getMessage(), request);
    }

    /**
     * Capture {@link UnknownProductException} and returns HTTP 422 Unprocessable
     * Entity. The ids that were not found are listed in the
     * {@code missingProductIds} property.
     *
     * @param ex      The caught {@link UnknownProductException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(UnknownProductException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ProblemDetail handleUnknownProductException(UnknownProductException ex, WebRequest request) {
        log.warn("Handling UnknownProductException: {}", ex.getMessage());

        ProblemDetail problemDetail = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Unknown Product", ex.getMessage(),
                request);
        problemDetail.setProperty("missingProductIds", ex.getMissingProductIds());

        return problemDetail;
    }

    @ExceptionHandler(DuplicateAccountException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ProblemDetail handleDuplicateAccountException(DuplicateAccountException ex, WebRequest request) {
        log.warn("Handling DuplicateAccountException: {}", ex.getMessage());

        return problem(HttpStatus.CONFLICT, "Duplicate Account", ex.getMessage(), request);
    }

    @ExceptionHandler(OrderFinalizedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ProblemDetail handleOrderFinalizedException(OrderFinalizedException ex, WebRequest request) {
        log.warn("Handling OrderFinalizedException: {}", ex.getMessage());

        return problem(HttpStatus.CONFLICT, "Order Finalized", ex.getMessage(), request);
    }

    @ExceptionHandler(AccountNotRegisteredException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public ProblemDetail handleAccountNotRegisteredException(AccountNotRegisteredException ex, WebRequest request) {
        log.warn("Handling AccountNotRegisteredException: {}", ex.getMessage());

        return problem(HttpStatus.FORBIDDEN, "Account Not Registered", ex.getMessage(), request);
    }

    /**
     * Capture {@link MethodArgumentTypeMismatchException} and returns HTTP 400 Bad
     * Request. This occurs when a path variable expected to be a numeric id
     * cannot be parsed.
     *
     * @param ex      The caught {@link MethodArgumentTypeMismatchException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException ex,
            WebRequest request) {
        log.warn("Handling MethodArgumentTypeMismatchException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Invalid Identifier",
                "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'.", request);
    }

    /**
     * Capture bean validation failures on request bodies and returns HTTP 400 Bad
     * Request, listing each rejected field.
     *
     * @param ex      The caught {@link MethodArgumentNotValidException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentNotValidException(MethodArgumentNotValidException ex,
            WebRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Handling MethodArgumentNotValidException: {}", detail);

        return problem(HttpStatus.BAD_REQUEST, "Invalid Request", detail, request);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MissingServletRequestParameterException.class })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleUnreadableRequest(Exception ex, WebRequest request) {
        log.warn("Handling unreadable request: {}", ex.getMessage());

        String detail = ex instanceof MissingServletRequestParameterException missing
                ? "Required parameter '" + missing.getParameterName() + "' is missing."
                : "Request body is missing or malformed.";

        return problem(HttpStatus.BAD_REQUEST, "Invalid Request", detail, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleNoResourceFoundException(NoResourceFoundException ex, WebRequest request) {
        log.debug("Handling NoResourceFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    public ProblemDetail handleMethodNotSupported(HttpRequestMethodNotSupportedException ex, WebRequest request) {
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", ex.getMessage());

        return problem(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    public ProblemDetail handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex, WebRequest request) {
        log.warn("Handling HttpMediaTypeNotSupportedException: {}", ex.getMessage());

        return problem(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", ex.getMessage(), request);
    }

    /**
     * Catches any other unhandled exceptions that may occur during request
     * processing. Returns HTTP 500 Internal Server Error with a generic message
     * to avoid exposing internal details.
     *
     * @param ex      The caught {@link Exception}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception: {}", ex.getMessage(), ex);

        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected internal error occurred.", request);
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setProperty("timestamp", Instant.now());
        problemDetail.setInstance(URI.create(request.getDescription(false)));

        return problemDetail;
    }
}
