package com.trackflow.service;

import com.trackflow.dto.BatchSummary;
import com.trackflow.event.PromotionOutcome;

/**
 * Outbound notifications about promotions. Delivery is best effort and never
 * changes the outcome being reported.
 */
public interface PromotionNotifier {

    void publish(PromotionOutcome outcome);

    void publishBatch(BatchSummary summary);
}
