package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties.ReferralScheme;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentSettings;
import java.math.BigDecimal;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ReferralRewardServiceTest {

    @Test
    void percentSchemeRoundsHalfUpToCents() {
        Assertions.assertEquals(new BigDecimal("33.34"),
                ReferralRewardService.rewardFor(new BigDecimal("333.35"), settings(ReferralScheme.PERCENT_OF_PRICE)));
    }

    @Test
    void fixedPerPurchasePaysTheFixedAmount() {
        Assertions.assertEquals(new BigDecimal("50"),
                ReferralRewardService.rewardFor(new BigDecimal("999"), settings(ReferralScheme.FIXED_PER_PURCHASE)));
    }

    @Test
    void fixedAtStartPaysNothingPerPurchase() {
        Assertions.assertNull(ReferralRewardService.rewardFor(new BigDecimal("300"), settings(ReferralScheme.FIXED_AT_START)));
    }

    private static FulfillmentSettings settings(ReferralScheme scheme) {
        return new FulfillmentSettings(true, scheme, new BigDecimal("10"), new BigDecimal("50"), new BigDecimal("35"),
                Set.of("yookassa"), "balance", "RUB");
    }
}
