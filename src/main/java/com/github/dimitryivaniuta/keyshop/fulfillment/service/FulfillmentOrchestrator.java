package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.CredentialOrigin;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OriginSource;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PaymentLogEntry;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Plan;
import com.github.dimitryivaniuta.keyshop.fulfillment.notification.NotificationSink;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningErrorCode;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningException;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PlanRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentAction;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentSettings;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.PromoOutcome;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.StepOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Turns a paid order into its side effects: credential, balance, referral reward, promo redemption, partner
 * commission and notifications.
 *
 * <p>Runs at most once per payment id ({@link FulfillmentGuard}). The claim is taken before any side effect
 * and is never released, so a crash mid-run leaves a claim without a terminal step; those are reported by
 * {@code FulfillmentGapDetector}, not retried.</p>
 *
 * <p>Only provisioning is mandatory. Every other step is attempted independently; its failure is logged,
 * stored in {@code fulfillment_steps} and reported, but never undoes the sale.</p>
 */
@Service
public class FulfillmentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FulfillmentOrchestrator.class);

    private final FulfillmentGuard guard;
    private final FulfillmentSettingsProvider settingsProvider;
    private final PlanRepository planRepository;
    private final CredentialService credentialService;
    private final BalanceService balanceService;
    private final ReferralRewardService referralRewardService;
    private final PromoRedemptionService promoRedemptionService;
    private final PartnerCommissionService partnerCommissionService;
    private final GiftService giftService;
    private final ProvisioningErrorClassifier errorClassifier;
    private final FulfillmentStepRecorder stepRecorder;
    private final NotificationSink notificationSink;

    private final Counter fulfilledCounter;
    private final Counter failedCounter;
    private final Counter duplicateCounter;
    private final Counter stepFailedCounter;

    public FulfillmentOrchestrator(
            FulfillmentGuard guard,
            FulfillmentSettingsProvider settingsProvider,
            PlanRepository planRepository,
            CredentialService credentialService,
            BalanceService balanceService,
            ReferralRewardService referralRewardService,
            PromoRedemptionService promoRedemptionService,
            PartnerCommissionService partnerCommissionService,
            GiftService giftService,
            ProvisioningErrorClassifier errorClassifier,
            FulfillmentStepRecorder stepRecorder,
            NotificationSink notificationSink,
            MeterRegistry meterRegistry
    ) {
        this.guard = guard;
        this.settingsProvider = settingsProvider;
        this.planRepository = planRepository;
        this.credentialService = credentialService;
        this.balanceService = balanceService;
        this.referralRewardService = referralRewardService;
        this.promoRedemptionService = promoRedemptionService;
        this.partnerCommissionService = partnerCommissionService;
        this.giftService = giftService;
        this.errorClassifier = errorClassifier;
        this.stepRecorder = stepRecorder;
        this.notificationSink = notificationSink;

        this.fulfilledCounter = Counter.builder("keyshop.fulfillment.fulfilled").register(meterRegistry);
        this.failedCounter = Counter.builder("keyshop.fulfillment.failed").register(meterRegistry);
        this.duplicateCounter = Counter.builder("keyshop.fulfillment.duplicate").register(meterRegistry);
        this.stepFailedCounter = Counter.builder("keyshop.fulfillment.step.failed").register(meterRegistry);
    }

    /**
     * Fulfills a paid order.
     *
     * @param metadata order of a payment that was just completed
     * @return report; {@code DUPLICATE} when the payment was already claimed
     */
    public FulfillmentReport runFulfillment(OrderMetadata metadata) {
        OrderMetadata md = metadata.validate();
        String paymentId = md.paymentId();

        if (!guard.claim(paymentId)) {
            duplicateCounter.increment();
            log.info("Fulfillment skipped, already claimed paymentId={}", paymentId);
            return FulfillmentReport.duplicate(paymentId);
        }

        FulfillmentSettings settings = settingsProvider.snapshot();
        Run run = new Run(md, settings);
        log.info("Fulfillment started paymentId={} owner={} action={} method={}",
                paymentId, md.ownerId(), md.action(), md.paymentMethod());

        try {
            FulfillmentReport report = switch (md.action()) {
                case TOP_UP -> topUp(run);
                case NEW, EXTEND -> provision(run);
                case GIFT -> gift(run);
            };
            if (report.status() == FulfillmentReport.Status.FAILED) {
                failedCounter.increment();
            } else {
                fulfilledCounter.increment();
            }
            return report;
        } catch (RuntimeException e) {
            failedCounter.increment();
            log.error("Fulfillment aborted paymentId={} error={}", paymentId, e.getMessage(), e);
            run.record(StepOutcome.failed(StepType.ABORTED, e.getClass().getSimpleName() + ": " + e.getMessage()));
            notificationSink.notifyOperators("Fulfillment aborted payment=" + paymentId + " owner=" + md.ownerId()
                    + " action=" + md.action() + " error=" + e.getMessage());
            return run.report(FulfillmentReport.Status.FAILED, null, "INTERNAL_ERROR");
        }
    }

    private FulfillmentReport topUp(Run run) {
        OrderMetadata md = run.md;
        run.step(StepType.BALANCE_CREDIT, () -> {
            balanceService.credit(md.ownerId(), md.paymentId(), md.amount(), run.currency(), md.paymentMethod(),
                    PaymentLogEntry.Kind.TOP_UP);
            return StepOutcome.applied(StepType.BALANCE_CREDIT, "credited " + md.amount().toPlainString());
        });
        run.step(StepType.REFERRAL, () -> referralRewardService.reward(md, run.settings));
        finish(run, "Your balance was topped up by " + md.amount().toPlainString() + " " + run.currency() + ".");
        return run.report(FulfillmentReport.Status.FULFILLED, null, null);
    }

    private FulfillmentReport provision(Run run) {
        OrderMetadata md = run.md;
        Plan plan = findPlan(md);
        int days = resolveDays(md, plan);
        String planName = plan != null ? plan.getName() : null;
        boolean extend = md.action() == FulfillmentAction.EXTEND;

        Credential credential;
        try {
            if (days <= 0) {
                throw ProvisioningException.invalidOrder("No duration for plan " + md.planId());
            }
            credential = extend
                    ? credentialService.extend(md.ownerId(), md.credentialId(), days,
                            CredentialOrigin.of(OriginSource.EXTEND, md.planId(), planName, days))
                    : credentialService.issue(md.ownerId(), md.hostName(), null, days, plan,
                            CredentialOrigin.of(OriginSource.PURCHASE, md.planId(), planName, days));
        } catch (ProvisioningException e) {
            return provisioningFailed(run, e);
        }
        run.record(StepOutcome.applied(StepType.PROVISION,
                (extend ? "extended" : "issued") + " credential=" + credential.getId() + " until " + credential.getExpiresAt()));

        recordPurchase(run);
        run.step(StepType.REFERRAL, () -> referralRewardService.reward(md, run.settings));
        finish(run, (extend ? "Your key was extended by " : "Your key is ready: ") + days + " days, valid until "
                + credential.getExpiresAt() + "."
                + (credential.getConnectionInfo() != null ? "\n" + credential.getConnectionInfo() : ""));
        return run.report(FulfillmentReport.Status.FULFILLED, credential.getId(), null);
    }

    private FulfillmentReport gift(Run run) {
        OrderMetadata md = run.md;
        Plan plan = findPlan(md);
        int days = resolveDays(md, plan);
        if (days <= 0) {
            return provisioningFailed(run, ProvisioningException.invalidOrder("No duration for gift plan " + md.planId()));
        }
        String planName = plan != null ? plan.getName() : null;
        StepOutcome hold = run.step(StepType.GIFT_HOLD, () -> giftService.hold(md, days, planName)
                ? StepOutcome.applied(StepType.GIFT_HOLD, "awaiting recipient, " + days + " days")
                : StepOutcome.skipped(StepType.GIFT_HOLD, "already held"));
        if (hold.isFailed()) {
            return provisioningFailed(run, new ProvisioningException("Gift not stored: " + hold.detail(), null, false, null));
        }

        recordPurchase(run);
        run.step(StepType.REFERRAL, () -> referralRewardService.reward(md, run.settings));
        finish(run, "Gift paid. Send the recipient's handle to deliver a " + days + "-day key.");
        return run.report(FulfillmentReport.Status.AWAITING_RECIPIENT, null, null);
    }

    /**
     * Provisioning failed: refund what was paid to the stored balance, tell payer and operators, stop.
     */
    private FulfillmentReport provisioningFailed(Run run, ProvisioningException e) {
        OrderMetadata md = run.md;
        ProvisioningErrorCode code = errorClassifier.classify(e);
        log.warn("Provisioning failed paymentId={} owner={} code={} detail={}", md.paymentId(), md.ownerId(), code, e.getMessage());
        run.record(StepOutcome.failed(StepType.PROVISION, code + ": " + e.getMessage()));

        boolean refunded = false;
        if (md.amount() != null && md.amount().signum() > 0) {
            StepOutcome refund = run.step(StepType.REFUND, () -> {
                balanceService.credit(md.ownerId(), md.paymentId(), md.amount(), run.currency(), md.paymentMethod(),
                        PaymentLogEntry.Kind.REFUND);
                return StepOutcome.applied(StepType.REFUND, "refunded " + md.amount().toPlainString() + " to balance");
            });
            refunded = !refund.isFailed();
        }

        notificationSink.notifyPayer(md.ownerId(), "We could not issue your key (" + code + ")."
                + (refunded ? " " + md.amount().toPlainString() + " " + run.currency() + " was returned to your balance."
                : " Support has been notified and will refund you."));
        notificationSink.notifyOperators("Provisioning failed payment=" + md.paymentId() + " owner=" + md.ownerId()
                + " action=" + md.action() + " host=" + md.hostName() + " code=" + code
                + " refunded=" + refunded + " detail=" + e.getMessage());
        run.record(StepOutcome.applied(StepType.NOTIFY, "payer and operators told " + code));
        run.record(StepOutcome.applied(StepType.ABORTED, code.name()));
        return run.report(FulfillmentReport.Status.FAILED, null, code.name());
    }

    private void recordPurchase(Run run) {
        OrderMetadata md = run.md;
        if (md.amount() == null || md.amount().signum() <= 0) {
            return;
        }
        try {
            balanceService.recordPurchase(md.ownerId(), md.paymentId(), md.amount(), run.currency(), md.paymentMethod());
        } catch (DataAccessException e) {
            log.warn("Purchase not logged paymentId={} error={}", md.paymentId(), e.getMessage());
        }
    }

    /**
     * Optional side effects common to all successful runs, then the terminal step.
     */
    private void finish(Run run, String payerMessage) {
        OrderMetadata md = run.md;

        if (md.promoCode() != null && !md.promoCode().isBlank()) {
            run.step(StepType.PROMO, () -> {
                PromoOutcome outcome = promoRedemptionService.redeem(md.promoCode(), md.ownerId(), md.promoDiscount(), md.paymentId());
                notificationSink.notifyOperators("Promo " + md.promoCode() + " used by " + md.ownerId()
                        + " payment=" + md.paymentId() + " outcome=" + outcome);
                return outcome == PromoOutcome.UNKNOWN
                        ? StepOutcome.failed(StepType.PROMO, "unknown code " + md.promoCode())
                        : StepOutcome.applied(StepType.PROMO, outcome.name());
            });
        }

        run.step(StepType.COMMISSION, () -> partnerCommissionService.accrueCommission(md.instanceId(), md.paymentId(),
                md.ownerId(), md.amount(), md.paymentMethod(), run.settings));

        notificationSink.notifyPayer(md.ownerId(), payerMessage);
        notificationSink.notifyOperators("Payment fulfilled payment=" + md.paymentId() + " owner=" + md.ownerId()
                + " action=" + md.action() + " amount=" + amountText(md.amount()) + " " + run.currency()
                + " method=" + md.paymentMethod());
        if (md.promptMessageId() != null) {
            notificationSink.retractMessage(md.ownerId(), md.promptMessageId());
        }
        run.record(StepOutcome.applied(StepType.NOTIFY, "payer and operators"));
        run.record(StepOutcome.applied(StepType.COMPLETED, run.failedSteps() == 0 ? null : run.failedSteps() + " step(s) failed"));
    }

    private Plan findPlan(OrderMetadata md) {
        return md.planId() == null ? null : planRepository.findById(md.planId()).orElse(null);
    }

    /**
     * Days granted by an order: plan {@code duration_days}, then plan {@code months * 30}, then the order's own
     * {@code days}, then the order's {@code months * 30}.
     *
     * @param md   order
     * @param plan plan, may be {@code null}
     * @return days, 0 when nothing defines a duration
     */
    static int resolveDays(OrderMetadata md, Plan plan) {
        if (plan != null && plan.grantedDays() > 0) {
            return plan.grantedDays();
        }
        if (md.days() != null && md.days() > 0) {
            return md.days();
        }
        if (md.months() != null && md.months() > 0) {
            return md.months() * 30;
        }
        return 0;
    }

    private static String amountText(BigDecimal amount) {
        return amount == null ? "-" : amount.toPlainString();
    }

    /**
     * State of one run: the order, its settings snapshot, and the outcomes so far.
     */
    private final class Run {

        private final OrderMetadata md;
        private final FulfillmentSettings settings;
        private final List<StepOutcome> steps = new ArrayList<>();

        private Run(OrderMetadata md, FulfillmentSettings settings) {
            this.md = md;
            this.settings = settings;
        }

        String currency() {
            return md.currency() != null ? md.currency() : settings.defaultCurrency();
        }

        /**
         * Runs an optional side effect; an exception becomes a FAILED outcome.
         */
        StepOutcome step(StepType type, Supplier<StepOutcome> action) {
            StepOutcome outcome;
            try {
                outcome = action.get();
            } catch (RuntimeException e) {
                log.warn("Step {} failed paymentId={} error={}", type, md.paymentId(), e.getMessage(), e);
                outcome = StepOutcome.failed(type, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            record(outcome);
            return outcome;
        }

        void record(StepOutcome outcome) {
            steps.add(outcome);
            if (outcome.isFailed()) {
                stepFailedCounter.increment();
            }
            log.info("Step paymentId={} step={} outcome={} detail={}",
                    md.paymentId(), outcome.step(), outcome.outcome(), outcome.detail());
            try {
                stepRecorder.record(md.paymentId(), outcome);
            } catch (DataAccessException e) {
                log.error("Step not persisted paymentId={} step={} error={}", md.paymentId(), outcome.step(), e.getMessage());
            }
        }

        long failedSteps() {
            return steps.stream().filter(StepOutcome::isFailed).count();
        }

        FulfillmentReport report(FulfillmentReport.Status status, Long credentialId, String errorCode) {
            return new FulfillmentReport(md.paymentId(), status, credentialId, errorCode, List.copyOf(steps));
        }
    }
}
