package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.AbstractPostgresIntegrationTest;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.PromoOutcome;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PromoRedemptionServiceTest extends AbstractPostgresIntegrationTest {

    @Autowired
    PromoRedemptionService promoRedemptionService;

    @Test
    void secondUsageForSameOrderIsNotCounted() {
        jdbc.update("insert into promo_codes (code, discount_percent, usage_limit_total) values ('SPRING', 10, 5)");

        Assertions.assertEquals(PromoOutcome.REDEEMED,
                promoRedemptionService.redeem("spring", 42L, new BigDecimal("30.00"), "order-1"));
        Assertions.assertEquals(PromoOutcome.REDEEMED,
                promoRedemptionService.redeem("SPRING", 42L, new BigDecimal("30.00"), "order-1"));

        Assertions.assertEquals(1, jdbc.queryForObject("select used_total from promo_codes where code = 'SPRING'", Integer.class));
        Assertions.assertEquals(1, jdbc.queryForObject("select count(*) from promo_code_usages", Integer.class));
    }

    @Test
    void lastAllowedUsageSwitchesCodeOff() {
        jdbc.update("insert into promo_codes (code, discount_amount, usage_limit_total) values ('ONCE', 50, 1)");

        Assertions.assertEquals(PromoOutcome.REDEEMED,
                promoRedemptionService.redeem("ONCE", 7L, new BigDecimal("50.00"), "order-2"));

        Assertions.assertFalse(jdbc.queryForObject("select active from promo_codes where code = 'ONCE'", Boolean.class));
    }

    @Test
    void usagePastTheLimitIsReportedExhausted() {
        jdbc.update("insert into promo_codes (code, discount_amount, usage_limit_total) values ('TWICE', 50, 2)");

        Assertions.assertEquals(PromoOutcome.REDEEMED,
                promoRedemptionService.redeem("TWICE", 7L, new BigDecimal("50.00"), "order-5"));
        Assertions.assertTrue(jdbc.queryForObject("select active from promo_codes where code = 'TWICE'", Boolean.class));
        Assertions.assertEquals(PromoOutcome.REDEEMED,
                promoRedemptionService.redeem("TWICE", 8L, new BigDecimal("50.00"), "order-6"));
        Assertions.assertFalse(jdbc.queryForObject("select active from promo_codes where code = 'TWICE'", Boolean.class));

        // checkout raced the last usage and applied the discount anyway
        Assertions.assertEquals(PromoOutcome.EXHAUSTED,
                promoRedemptionService.redeem("TWICE", 9L, new BigDecimal("50.00"), "order-7"));
        Assertions.assertEquals(PromoOutcome.REDEEMED,
                promoRedemptionService.redeem("TWICE", 8L, new BigDecimal("50.00"), "order-6"));
        Assertions.assertEquals(3, jdbc.queryForObject("select used_total from promo_codes where code = 'TWICE'", Integer.class));
    }

    @Test
    void expiredCodeIsReportedAndDeactivated() {
        jdbc.update("insert into promo_codes (code, discount_percent, valid_until) values ('OLD', 5, ?)",
                Timestamp.from(T0.minus(Duration.ofDays(1))));

        Assertions.assertEquals(PromoOutcome.EXPIRED,
                promoRedemptionService.redeem("OLD", 7L, BigDecimal.ONE, "order-3"));

        Assertions.assertFalse(jdbc.queryForObject("select active from promo_codes where code = 'OLD'", Boolean.class));
    }

    @Test
    void unknownCode() {
        Assertions.assertEquals(PromoOutcome.UNKNOWN,
                promoRedemptionService.redeem("NOPE", 7L, BigDecimal.ONE, "order-4"));
    }
}
