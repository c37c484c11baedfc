package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.FulfillmentStepRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.StepOutcome;
import java.time.Clock;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists step outcomes, each in its own transaction so a later failure cannot erase them.
 */
@Service
public class FulfillmentStepRecorder {

    private final FulfillmentStepRepository repository;
    private final Clock clock;

    public FulfillmentStepRecorder(FulfillmentStepRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(String paymentId, StepOutcome outcome) {
        repository.save(FulfillmentStep.of(paymentId, outcome.step(), outcome.outcome(), outcome.detail(), clock.instant()));
    }
}
