package org.jstats.tipster_api.core.config;

import org.jstats.tipster_api.core.upstream.TransportException;
import org.jstats.tipster_api.modules.entitlement.service.ModelNotEntitledException;
import org.jstats.tipster_api.modules.prediction.registry.UnknownModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.concurrent.CancellationException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    private static final String PROBLEM_BASE = "https://api.jstats.org/problems/";

    // Anything thrown as ResponseStatusException becomes a Problem
    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handle(ResponseStatusException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        pd.setType(URI.create(PROBLEM_BASE + ex.getStatusCode().value()));
        var status = HttpStatus.resolve(ex.getStatusCode().value());
        pd.setTitle(status == null ? "Request Failed" : switch (status) {
            case NOT_FOUND -> "Resource Not Found";
            case BAD_REQUEST -> "Bad Request";
            case UNAUTHORIZED -> "Unauthorized";
            default -> "Request Failed";
        });
        return pd; // Spring sets Content-Type: application/problem+json
    }

    @ExceptionHandler(UnknownModelException.class)
    public ProblemDetail unknownModel(UnknownModelException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "unknown-model"));
        pd.setTitle("Unknown Model");
        pd.setProperty("alias", ex.alias());
        return pd;
    }

    @ExceptionHandler(ModelNotEntitledException.class)
    public ProblemDetail notEntitled(ModelNotEntitledException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.FORBIDDEN, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "premium-required"));
        pd.setTitle("Premium Model");
        pd.setProperty("alias", ex.alias());
        return pd;
    }

    @ExceptionHandler(TransportException.class)
    public ProblemDetail upstream(TransportException ex) {
        var status = ex.timedOut() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        var pd = ProblemDetail.forStatus(status);
        pd.setType(URI.create(PROBLEM_BASE + "upstream"));
        pd.setTitle("Upstream Failure");
        pd.setDetail(ex.getMessage());
        pd.setProperty("service", ex.service());
        pd.setProperty("upstreamStatus", ex.status());
        if (ex.detail() != null) {
            pd.setProperty("upstreamDetail", ex.detail());
        }
        return pd;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail invalidBody(MethodArgumentNotValidException ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, "Request validation failed");
        pd.setType(URI.create(PROBLEM_BASE + "validation"));
        pd.setTitle("Bad Request");
        var errors = new LinkedHashMap<String, String>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors()
                .forEach(ge -> errors.putIfAbsent(ge.getObjectName(), ge.getDefaultMessage()));
        pd.setProperty("errors", errors);
        return pd;
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ProblemDetail invalidParameters(HandlerMethodValidationException ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, "Request validation failed");
        pd.setType(URI.create(PROBLEM_BASE + "validation"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail unreadable(Exception ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, "Malformed request");
        pd.setType(URI.create(PROBLEM_BASE + "400"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail badArgument(IllegalArgumentException ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "400"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(CancellationException.class)
    public ProblemDetail cancelled(CancellationException ex) {
        log.info("Request cancelled: {}", ex.getMessage());
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, "The request was cancelled.");
        pd.setTitle("Cancelled");
        return pd;
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create(PROBLEM_BASE + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }
}
