package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PartnerCommissionRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentSettings;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.StepOutcome;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Accrues the commission owed to the operator of a managed sub-instance.
 *
 * <p>Only card-like payments earn commission; money that is already inside the system (the stored balance)
 * never does. Accrual is keyed by {@code (instance_id, payment_id)}, so a repeat is a no-op.</p>
 */
@Service
public class PartnerCommissionService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final PartnerCommissionRepository repository;
    private final Clock clock;

    public PartnerCommissionService(PartnerCommissionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional
    public StepOutcome accrueCommission(Long instanceId, String paymentId, long ownerId, BigDecimal amount,
                                        String paymentMethod, FulfillmentSettings settings) {
        if (instanceId == null) {
            return StepOutcome.skipped(StepType.COMMISSION, "no instance");
        }
        if (!settings.isCardPayment(paymentMethod)) {
            return StepOutcome.skipped(StepType.COMMISSION, "method " + paymentMethod + " not eligible");
        }
        if (amount == null || amount.signum() <= 0) {
            return StepOutcome.skipped(StepType.COMMISSION, "no amount");
        }
        BigDecimal percent = settings.franchisePercent();
        BigDecimal commission = amount.multiply(percent).divide(HUNDRED, 2, RoundingMode.HALF_UP);

        int inserted = repository.insertIfAbsent(instanceId, paymentId, ownerId, amount, percent, commission,
                paymentMethod, clock.instant());
        if (inserted == 0) {
            return StepOutcome.skipped(StepType.COMMISSION, "already accrued");
        }
        return StepOutcome.applied(StepType.COMMISSION,
                "instance=" + instanceId + " commission=" + commission.toPlainString());
    }
}
