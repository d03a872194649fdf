package com.cryptofolio.backend.exception;

import com.cryptofolio.backend.config.RequestCorrelationFilter;
import com.cryptofolio.backend.dto.ApiError;
import com.cryptofolio.backend.dto.ApiErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed", details, request, ex);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request", List.of(), request, ex);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NoResourceFoundException ex, HttpServletRequest request) {
        return buildError(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", List.of(), request, ex);
    }

    @ExceptionHandler(InvalidWeightsException.class)
    public ResponseEntity<ApiError> handleInvalidWeights(InvalidWeightsException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = new ArrayList<>();
        details.add(ApiErrorDetail.builder()
                .field("weights")
                .issue(String.format(Locale.ROOT, "actualSum=%.6f", ex.getActualSum()))
                .build());
        int count = ex.getWeights().length;
        if (count > 0) {
            double[] suggestion = new double[count];
            Arrays.fill(suggestion, 1.0 / count);
            details.add(ApiErrorDetail.builder()
                    .field("weights")
                    .issue("equal-weight suggestion " + Arrays.toString(suggestion))
                    .build());
        }
        return buildError(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(PortfolioAnalyticsException.class)
    public ResponseEntity<ApiError> handleAnalytics(PortfolioAnalyticsException ex, HttpServletRequest request) {
        return buildError(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(MarketDataUnavailableException.class)
    public ResponseEntity<ApiError> handleUnavailable(MarketDataUnavailableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, "MARKET_DATA_UNAVAILABLE",
                "Market data temporarily unavailable", List.of(), request, ex);
    }

    @ExceptionHandler(MarketDataException.class)
    public ResponseEntity<ApiError> handleMarketData(MarketDataException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_GATEWAY, "MARKET_DATA_ERROR", ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", List.of(), request, ex);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String errorCode, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request,
                                                Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .requestId(MDC.get(RequestCorrelationFilter.REQUEST_ID_MDC_KEY))
                .correlationId(MDC.get(RequestCorrelationFilter.CORRELATION_ID_MDC_KEY))
                .details(details)
                .build();
        if (status.is5xxServerError()) {
            log.error("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message, ex);
        } else {
            log.warn("{} {} -> {} {} {}", request.getMethod(), request.getRequestURI(), status.value(), errorCode, message);
        }
        return ResponseEntity.status(status).body(error);
    }
}
