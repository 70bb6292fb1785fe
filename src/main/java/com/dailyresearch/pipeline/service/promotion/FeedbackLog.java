package com.dailyresearch.pipeline.service.promotion;

import com.dailyresearch.pipeline.model.FeedbackRecord;

import java.util.List;

/** Append-only store of resolved {@code #good} / {@code #bad} tags. */
public interface FeedbackLog {

    /**
     * Appends one record. Existing entries are never rewritten.
     *
     * @throws com.dailyresearch.pipeline.exception.PipelineException when the log cannot be written
     */
    void append(FeedbackRecord record);

    List<FeedbackRecord> all();
}
