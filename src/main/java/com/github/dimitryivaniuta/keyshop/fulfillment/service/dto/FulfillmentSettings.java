package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties.ReferralScheme;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable settings snapshot taken once at the start of a fulfillment run.
 *
 * @param referralsEnabled     whether referral rewards are paid at all
 * @param referralScheme       reward formula
 * @param referralPercent      percent for {@link ReferralScheme#PERCENT_OF_PRICE}
 * @param referralFixedAmount  amount for {@link ReferralScheme#FIXED_PER_PURCHASE}
 * @param franchisePercent     partner commission percent
 * @param cardPaymentMethods   lower-cased card-like methods eligible for commission
 * @param balancePaymentMethod name of the stored-balance payment method
 * @param defaultCurrency      currency used when an order carries none
 */
public record FulfillmentSettings(
        boolean referralsEnabled,
        ReferralScheme referralScheme,
        BigDecimal referralPercent,
        BigDecimal referralFixedAmount,
        BigDecimal franchisePercent,
        Set<String> cardPaymentMethods,
        String balancePaymentMethod,
        String defaultCurrency
) {

    public FulfillmentSettings {
        cardPaymentMethods = Set.copyOf(cardPaymentMethods);
    }

    /**
     * Card-like methods earn partner commission; the stored balance never does.
     *
     * @param method payment method
     * @return whether the method is card-like
     */
    public boolean isCardPayment(String method) {
        if (method == null || method.isBlank()) {
            return false;
        }
        String m = method.trim().toLowerCase(Locale.ROOT);
        if (m.equals(balancePaymentMethod.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return cardPaymentMethods.contains(m);
    }
}
