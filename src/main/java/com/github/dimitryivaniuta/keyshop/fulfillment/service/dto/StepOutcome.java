package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.Outcome;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;

/**
 * Result of one fulfillment side effect.
 *
 * @param step    side effect
 * @param outcome applied, skipped or failed
 * @param detail  short explanation
 */
public record StepOutcome(StepType step, Outcome outcome, String detail) {

    public static StepOutcome applied(StepType step, String detail) {
        return new StepOutcome(step, Outcome.APPLIED, detail);
    }

    public static StepOutcome skipped(StepType step, String detail) {
        return new StepOutcome(step, Outcome.SKIPPED, detail);
    }

    public static StepOutcome failed(StepType step, String detail) {
        return new StepOutcome(step, Outcome.FAILED, detail);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
