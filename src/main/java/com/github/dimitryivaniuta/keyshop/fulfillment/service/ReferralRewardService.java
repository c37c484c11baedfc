package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Account;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PaymentLogEntry;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.AccountRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PaymentLogRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentSettings;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.StepOutcome;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Pays the referrer of a paying owner according to the configured scheme.
 */
@Service
public class ReferralRewardService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final AccountRepository accountRepository;
    private final PaymentLogRepository paymentLogRepository;
    private final Clock clock;

    public ReferralRewardService(AccountRepository accountRepository, PaymentLogRepository paymentLogRepository,
                                 Clock clock) {
        this.accountRepository = accountRepository;
        this.paymentLogRepository = paymentLogRepository;
        this.clock = clock;
    }

    /**
     * Credits the referrer's reward for one paid order.
     *
     * @param md       order
     * @param settings settings snapshot of the run
     * @return APPLIED with the referrer and amount, or SKIPPED with the reason
     */
    @Transactional
    public StepOutcome reward(OrderMetadata md, FulfillmentSettings settings) {
        if (!settings.referralsEnabled()) {
            return StepOutcome.skipped(StepType.REFERRAL, "referrals disabled");
        }
        if (md.isPaidFromBalance(settings.balancePaymentMethod())) {
            return StepOutcome.skipped(StepType.REFERRAL, "paid from balance");
        }
        Optional<Long> referrer = accountRepository.findById(md.ownerId()).map(Account::getReferrerId);
        if (referrer.isEmpty()) {
            return StepOutcome.skipped(StepType.REFERRAL, "no referrer");
        }

        BigDecimal reward = rewardFor(md.amount(), settings);
        if (reward == null || reward.signum() <= 0) {
            return StepOutcome.skipped(StepType.REFERRAL, "no reward under " + settings.referralScheme());
        }

        Instant now = clock.instant();
        if (accountRepository.creditReferral(referrer.get(), reward, now) != 1) {
            return StepOutcome.failed(StepType.REFERRAL, "referrer account " + referrer.get() + " missing");
        }
        String currency = md.currency() != null ? md.currency() : settings.defaultCurrency();
        paymentLogRepository.save(PaymentLogEntry.of(md.paymentId(), referrer.get(), PaymentLogEntry.Kind.REFERRAL_REWARD,
                reward, currency, md.paymentMethod(), now));
        return StepOutcome.applied(StepType.REFERRAL, "referrer=" + referrer.get() + " reward=" + reward.toPlainString());
    }

    /**
     * Reward for a purchase; {@code null} when the scheme pays nothing per purchase.
     */
    static BigDecimal rewardFor(BigDecimal price, FulfillmentSettings settings) {
        switch (settings.referralScheme()) {
            case PERCENT_OF_PRICE:
                if (price == null) {
                    return null;
                }
                return price.multiply(settings.referralPercent()).divide(HUNDRED, 2, RoundingMode.HALF_UP);
            case FIXED_PER_PURCHASE:
                return settings.referralFixedAmount();
            case FIXED_AT_START:
            default:
                return null;
        }
    }
}
