package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.AbstractPostgresIntegrationTest;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.FulfillmentStepRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.StepOutcome;
import java.time.Duration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * A claim without a terminal step is reported once, after the alert delay.
 */
class FulfillmentGapDetectorTest extends AbstractPostgresIntegrationTest {

    @Autowired
    FulfillmentGuard guard;

    @Autowired
    FulfillmentStepRecorder stepRecorder;

    @Autowired
    FulfillmentGapDetector detector;

    @Autowired
    FulfillmentStepRepository stepRepository;

    @Autowired
    OutboxEventRepository outboxRepository;

    @Test
    void staleClaimIsAlertedOnce() {
        guard.claim("crashed");
        guard.claim("finished");
        stepRecorder.record("finished", StepOutcome.applied(StepType.COMPLETED, null));

        clock.advance(Duration.ofMinutes(5));
        Assertions.assertEquals(0, detector.detect());

        clock.advance(Duration.ofMinutes(15));
        Assertions.assertEquals(1, detector.detect());
        Assertions.assertEquals(0, detector.detect());

        Assertions.assertEquals(StepType.ALERTED, stepRepository.findByPaymentIdOrderById("crashed").get(0).getStep());
        Assertions.assertEquals(1, outboxRepository.findByEventKeyOrderByCreatedAt("operators").size());
    }
}
