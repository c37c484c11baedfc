package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.LedgerCompletion;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Completion followed by fulfillment: the path shared by provider webhooks and manual payment checks.
 */
@Service
public class PaymentCompletionService {

    private final CompletionCoordinator coordinator;
    private final FulfillmentOrchestrator orchestrator;

    public PaymentCompletionService(CompletionCoordinator coordinator, FulfillmentOrchestrator orchestrator) {
        this.coordinator = coordinator;
        this.orchestrator = orchestrator;
    }

    /**
     * Completes the intent and, for the single winning caller, fulfills it.
     *
     * @param paymentId     payment id
     * @param paymentMethod method to record when the stored metadata has none, may be {@code null}
     * @return report for the winner; empty when the intent was unknown or already paid
     */
    public Optional<FulfillmentReport> completeAndFulfill(String paymentId, String paymentMethod) {
        return coordinator.completeIfPending(paymentId).map(md -> fulfill(md, paymentMethod));
    }

    /**
     * Completes the intent only when the provider-confirmed amount matches it, then fulfills it.
     *
     * @param paymentId     payment id
     * @param paymentMethod method to record when the stored metadata has none, may be {@code null}
     * @param paidAmount    amount confirmed by the provider
     * @param paidCurrency  currency confirmed by the provider
     * @return ledger outcome, with the fulfillment report when this caller completed the intent
     */
    public VerifiedCompletion completeVerifiedAndFulfill(String paymentId, String paymentMethod,
                                                         BigDecimal paidAmount, String paidCurrency) {
        LedgerCompletion completion = coordinator.completeIfMatching(paymentId, paidAmount, paidCurrency);
        FulfillmentReport report = completion.isCompleted() ? fulfill(completion.metadata(), paymentMethod) : null;
        return new VerifiedCompletion(completion, report);
    }

    private FulfillmentReport fulfill(OrderMetadata completed, String paymentMethod) {
        OrderMetadata md = completed;
        if (md.paymentMethod() == null && paymentMethod != null) {
            md = md.withPaymentMethod(paymentMethod);
        }
        return orchestrator.runFulfillment(md);
    }

    /**
     * @param ledger ledger outcome
     * @param report fulfillment report, {@code null} unless {@code ledger} is {@code COMPLETED}
     */
    public record VerifiedCompletion(LedgerCompletion ledger, FulfillmentReport report) {
    }
}
