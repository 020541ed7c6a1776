package uk.gegc.planconfigurator.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.planconfigurator.features.backend.domain.exception.AuthenticationRequiredException;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendCallException;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendErrorException;
import uk.gegc.planconfigurator.features.backend.domain.exception.MissingParameterException;
import uk.gegc.planconfigurator.features.backend.domain.exception.NetworkException;
import uk.gegc.planconfigurator.features.backend.domain.exception.ShapeMismatchException;
import uk.gegc.planconfigurator.features.backend.domain.exception.SupersededRequestException;
import uk.gegc.planconfigurator.features.backend.domain.exception.UnknownOperationException;
import uk.gegc.planconfigurator.features.backend.domain.exception.UnparsedBackendException;
import uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownFieldException;
import uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownStepException;
import uk.gegc.planconfigurator.features.workflow.domain.exception.WorkflowSessionNotFoundException;
import uk.gegc.planconfigurator.features.workflow.domain.exception.WorkflowStateConflictException;
import uk.gegc.planconfigurator.shared.api.problem.ErrorTypes;
import uk.gegc.planconfigurator.shared.api.problem.ProblemDetailBuilder;

import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WorkflowSessionNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleSessionNotFound(WorkflowSessionNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.WORKFLOW_SESSION_NOT_FOUND,
                "Workflow Session Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(UnknownStepException.class)
    public ResponseEntity<ProblemDetail> handleUnknownStep(UnknownStepException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNKNOWN_STEP,
                "Unknown Step",
                ex.getMessage(),
                request
        );
        problem.setProperty("stepId", ex.getStepId());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(UnknownFieldException.class)
    public ResponseEntity<ProblemDetail> handleUnknownField(UnknownFieldException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNKNOWN_FIELD,
                "Unknown Field",
                ex.getMessage(),
                request
        );
        problem.setProperty("stepId", ex.getStepId());
        problem.setProperty("fieldId", ex.getFieldId());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(WorkflowStateConflictException.class)
    public ResponseEntity<ProblemDetail> handleStateConflict(WorkflowStateConflictException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.WORKFLOW_STATE_CONFLICT,
                "Workflow State Conflict",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(NetworkException.class)
    public ResponseEntity<ProblemDetail> handleNetwork(NetworkException ex, HttpServletRequest request) {
        HttpStatus status = ex.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.SERVICE_UNAVAILABLE;
        logger.warn("Backend operation '{}' unreachable after {} attempt(s): {}",
                ex.getOperation(), ex.getAttempts(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                status,
                ex.isTimeout() ? ErrorTypes.BACKEND_TIMEOUT : ErrorTypes.BACKEND_UNAVAILABLE,
                ex.isTimeout() ? "Backend Timeout" : "Backend Unavailable",
                "The billing service is currently unavailable. Please try again later.",
                request
        );
        problem.setProperty("operation", ex.getOperation());
        problem.setProperty("attempts", ex.getAttempts());
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(BackendErrorException.class)
    public ResponseEntity<ProblemDetail> handleBackendError(BackendErrorException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.BACKEND_ERROR,
                "Backend Error",
                ex.getMessage(),
                request
        );
        problem.setProperty("operation", ex.getOperation());
        problem.setProperty("backendStatus", ex.getStatus());
        if (ex.getError().backendDetail() != null) {
            problem.setProperty("backendDetail", ex.getError().backendDetail());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(UnparsedBackendException.class)
    public ResponseEntity<ProblemDetail> handleUnparsedBackendError(UnparsedBackendException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.UNPARSED_BACKEND_ERROR,
                "Unrecognised Backend Error",
                ex.getMessage(),
                request
        );
        problem.setProperty("operation", ex.getOperation());
        problem.setProperty("backendStatus", ex.getError().status());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(ShapeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleShapeMismatch(ShapeMismatchException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.SHAPE_MISMATCH,
                "Backend Shape Mismatch",
                ex.getMessage(),
                request
        );
        problem.setProperty("operation", ex.getOperation());
        problem.setProperty("fieldPath", ex.getFieldPath());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(SupersededRequestException.class)
    public ResponseEntity<ProblemDetail> handleSuperseded(SupersededRequestException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.REQUEST_SUPERSEDED,
                "Request Superseded",
                ex.getMessage(),
                request
        );
        problem.setProperty("operation", ex.getOperation());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ResponseEntity<ProblemDetail> handleAuthenticationRequired(AuthenticationRequiredException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNAUTHORIZED,
                ErrorTypes.UNAUTHORIZED,
                "Unauthorized",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(problem);
    }

    @ExceptionHandler(BackendCallException.class)
    public ResponseEntity<ProblemDetail> handleBackendCall(BackendCallException ex, HttpServletRequest request) {
        logger.warn("Backend operation '{}' failed ({}): {}", ex.getOperation(), ex.getError().kind(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.BACKEND_ERROR,
                "Backend Error",
                ex.getMessage(),
                request
        );
        problem.setProperty("operation", ex.getOperation());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler({UnknownOperationException.class, MissingParameterException.class})
    public ResponseEntity<ProblemDetail> handleConfigurationError(RuntimeException ex, HttpServletRequest request) {
        logger.error("Backend call misconfigured: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.CONFIGURATION_ERROR,
                "Configuration Error",
                "The request could not be mapped to a backend operation",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        List<ViolationDetail> violations = ex.getConstraintViolations().stream()
                .map(GlobalExceptionHandler::toViolationDetail)
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more parameters",
                request
        );
        problem.setProperty("violations", violations);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".",
                request
        );
        problem.setProperty("parameter", param);
        problem.setProperty("expectedType", requiredType);
        return ResponseEntity.badRequest().body(problem);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        String msg = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                "Malformed JSON",
                "Request body is malformed or cannot be read",
                request
        );
        problem.setProperty("parseError", msg);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private static ViolationDetail toViolationDetail(ConstraintViolation<?> violation) {
        return new ViolationDetail(violation.getPropertyPath().toString(), violation.getMessage(), violation.getInvalidValue());
    }

    private record ViolationDetail(String field, String message, Object invalidValue) {
    }

    private record FieldValidationError(String field, String message, Object rejectedValue) {
    }
}
