package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PromoCode;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PromoCodeRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.PromoOutcome;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records a promo code usage once per order and switches the code off with its last allowed usage.
 *
 * <p>The sale is already paid when this runs: an exhausted or expired code is reported, never undone.</p>
 */
@Slf4j
@Service
public class PromoRedemptionService {

    private final PromoCodeRepository repository;
    private final Clock clock;

    public PromoRedemptionService(PromoCodeRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Redeems a code for an order.
     *
     * @param code          code as typed by the payer (case-insensitive)
     * @param ownerId       payer
     * @param appliedAmount discount granted at checkout
     * @param orderId       payment id; a second redemption for the same order changes nothing
     * @return outcome
     */
    @Transactional
    public PromoOutcome redeem(String code, long ownerId, BigDecimal appliedAmount, String orderId) {
        Optional<PromoCode> found = repository.findForUpdate(code.trim());
        if (found.isEmpty()) {
            log.warn("Promo code not found code={} order={}", code, orderId);
            return PromoOutcome.UNKNOWN;
        }
        PromoCode promo = found.get();
        Instant now = clock.instant();

        boolean exhaustedBefore = promo.isTotalLimitReached();
        int inserted = repository.insertUsage(promo.getCode(), ownerId,
                appliedAmount != null ? appliedAmount : BigDecimal.ZERO, orderId, now);
        if (inserted == 0) {
            log.info("Promo usage already recorded code={} order={}", promo.getCode(), orderId);
            return PromoOutcome.REDEEMED;
        }
        promo.setUsedTotal(promo.getUsedTotal() + 1);

        PromoOutcome outcome;
        if (promo.isExpired(now)) {
            promo.setActive(false);
            outcome = PromoOutcome.EXPIRED;
        } else if (exhaustedBefore) {
            promo.setActive(false);
            outcome = PromoOutcome.EXHAUSTED;
        } else {
            if (promo.isTotalLimitReached()) {
                // this was the last allowed usage
                promo.setActive(false);
            }
            outcome = PromoOutcome.REDEEMED;
        }
        repository.save(promo);
        log.info("Promo redeemed code={} order={} outcome={} used={}", promo.getCode(), orderId, outcome, promo.getUsedTotal());
        return outcome;
    }
}
