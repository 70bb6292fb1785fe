package com.dailyresearch.pipeline.controller;

import com.dailyresearch.pipeline.exception.CorpusUnavailableException;
import com.dailyresearch.pipeline.exception.RunInProgressException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalErrorHandlerTest {
    private final GlobalErrorHandler handler = new GlobalErrorHandler();

    @Test
    public void runInProgressIsAConflict() {
        ResponseEntity<Map<String, Object>> resp = handler.handleConflict(new RunInProgressException("A run is already in progress"));
        assertEquals(409, resp.getStatusCode().value());
        assertEquals("conflict", resp.getBody().get("error"));
    }

    @Test
    public void unrelatedIllegalStateIsAServerError() {
        ResponseEntity<Map<String, Object>> resp = handler.handleOther(new IllegalStateException("codec closed"));
        assertEquals(500, resp.getStatusCode().value());
        assertEquals("IllegalStateException", resp.getBody().get("exception"));
    }

    @Test
    public void corpusFailureReportsItsStage() {
        ResponseEntity<Map<String, Object>> resp = handler.handleUnavailable(new CorpusUnavailableException("vault gone"));
        assertEquals(503, resp.getStatusCode().value());
        assertEquals("history_index", resp.getBody().get("stage"));
    }
}
