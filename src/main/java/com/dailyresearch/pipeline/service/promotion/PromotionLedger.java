package com.dailyresearch.pipeline.service.promotion;

import com.dailyresearch.pipeline.model.PromotionRecord;

import java.util.List;

/** Every promotion ever finalized, keyed by fingerprint. */
public interface PromotionLedger {

    boolean contains(String fingerprintKey);

    /**
     * @throws com.dailyresearch.pipeline.exception.PipelineException when the ledger cannot be written
     */
    void append(PromotionRecord record);

    List<PromotionRecord> all();
}
