package com.wxplot.plotapi.config;

import com.wxplot.plotapi.series.controller.InvalidParameterException;
import com.wxplot.plotapi.series.repository.ObservationStoreException;
import com.wxplot.plotapi.series.service.PreconditionException;
import com.wxplot.plotapi.series.service.UnitInconsistencyException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String PROBLEM_TYPE_BASE = "https://docs.wxplot.dev/problems/";

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class, HandlerMethodValidationException.class,
      IllegalArgumentException.class, PreconditionException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, "invalid-parameter", ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("parameter", ex.parameter());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, "not-found", ex, request);
  }

  @ExceptionHandler(UnitInconsistencyException.class)
  public ResponseEntity<ProblemDetail> handleUnitInconsistency(UnitInconsistencyException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response =
        buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "unit-inconsistency", ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("expectedUnitSystem", ex.expected());
      detail.setProperty("foundUnitSystem", ex.found());
    }
    return response;
  }

  @ExceptionHandler(ObservationStoreException.class)
  public ResponseEntity<ProblemDetail> handleStoreFailure(ObservationStoreException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, "store-unavailable", ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, status.is4xxClientError() ? "invalid-request" : "internal-error",
        ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String slug, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_TYPE_BASE + slug));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    String method = request.getMethod();
    String uriWithQuery = RequestDescriptions.uriWithQuery(request);
    String clientIp = RequestDescriptions.clientIp(request);

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          method, uriWithQuery, clientIp, status.value(), errorMessage, ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          method, uriWithQuery, clientIp, status.value(), errorMessage);
    }
  }
}
