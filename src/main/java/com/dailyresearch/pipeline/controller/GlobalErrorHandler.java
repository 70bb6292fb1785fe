package com.dailyresearch.pipeline.controller;

import com.dailyresearch.pipeline.exception.ConfigValidationException;
import com.dailyresearch.pipeline.exception.CorpusUnavailableException;
import com.dailyresearch.pipeline.exception.FetchFailureException;
import com.dailyresearch.pipeline.exception.PipelineException;
import com.dailyresearch.pipeline.exception.RunInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps pipeline failures to HTTP responses. Run endpoints have already recorded
 * the failed report by the time an exception reaches here.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(ConfigValidationException.class)
    public ResponseEntity<Map<String, Object>> handleConfig(ConfigValidationException ex) {
        log.warn("Configuration rejected: {}", ex.getProblems());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "invalid_config");
        body.put("problems", ex.getProblems());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({CorpusUnavailableException.class, FetchFailureException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(PipelineException ex) {
        log.warn("Run aborted at {}: {}", ex.getStage().getKey(), ex.getMessage());
        return ResponseEntity.status(503).body(pipelineBody("unavailable", ex));
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipeline(PipelineException ex) {
        log.error("Run failed at {}: {}", ex.getStage().getKey(), ex.toString());
        return ResponseEntity.status(500).body(pipelineBody("run_failed", ex));
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(RunInProgressException ex) {
        log.warn("Rejected: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "conflict");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(409).body(body);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<Map<String, Object>> errors = ex.getAllErrors().stream().map(err -> {
            Map<String, Object> e = new HashMap<>();
            e.put("object", err.getObjectName());
            e.put("code", err.getCode());
            e.put("message", err.getDefaultMessage());
            return e;
        }).collect(Collectors.toList());
        log.warn("Request binding failed: {}", errors);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("Unhandled error: {}", ex.toString());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "server_error");
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(500).body(body);
    }

    private static Map<String, Object> pipelineBody(String error, PipelineException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("stage", ex.getStage().getKey());
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return body;
    }
}
