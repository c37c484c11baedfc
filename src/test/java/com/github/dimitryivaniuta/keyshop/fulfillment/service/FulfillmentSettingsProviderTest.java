package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties.ReferralScheme;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.AppSetting;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.AppSettingRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentSettings;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

class FulfillmentSettingsProviderTest {

    private final AppSettingRepository repository = Mockito.mock(AppSettingRepository.class);
    private final FulfillmentSettingsProvider provider = new FulfillmentSettingsProvider(repository, new AppProperties());

    @Test
    void operatorOverridesWinOverDefaults() {
        List<AppSetting> rows = List.of(
                setting(FulfillmentSettingsProvider.REFERRAL_SCHEME, "fixed_per_purchase"),
                setting(FulfillmentSettingsProvider.REFERRAL_FIXED_AMOUNT, "75"),
                setting(FulfillmentSettingsProvider.CARD_PAYMENT_METHODS, " Platega , heleket,,"),
                setting(FulfillmentSettingsProvider.REFERRALS_ENABLED, "false"));
        Mockito.when(repository.findAll()).thenReturn(rows);

        FulfillmentSettings s = provider.snapshot();

        Assertions.assertEquals(ReferralScheme.FIXED_PER_PURCHASE, s.referralScheme());
        Assertions.assertEquals(0, new BigDecimal("75").compareTo(s.referralFixedAmount()));
        Assertions.assertFalse(s.referralsEnabled());
        Assertions.assertTrue(s.isCardPayment("PLATEGA"));
        Assertions.assertFalse(s.isCardPayment("yookassa"));
        Assertions.assertEquals(0, new BigDecimal("35").compareTo(s.franchisePercent()));
    }

    @Test
    void malformedValuesFallBackToDefaults() {
        List<AppSetting> rows = List.of(
                setting(FulfillmentSettingsProvider.REFERRAL_PERCENT, "ten"),
                setting(FulfillmentSettingsProvider.REFERRAL_SCHEME, "BOGUS"));
        Mockito.when(repository.findAll()).thenReturn(rows);

        FulfillmentSettings s = provider.snapshot();

        Assertions.assertEquals(0, new BigDecimal("10").compareTo(s.referralPercent()));
        Assertions.assertEquals(ReferralScheme.PERCENT_OF_PRICE, s.referralScheme());
    }

    @Test
    void unreadableSettingsTableMeansDefaults() {
        Mockito.when(repository.findAll()).thenThrow(new DataAccessResourceFailureException("db down"));

        FulfillmentSettings s = provider.snapshot();

        Assertions.assertTrue(s.referralsEnabled());
        Assertions.assertTrue(s.isCardPayment("yookassa"));
        Assertions.assertFalse(s.isCardPayment("balance"));
        Assertions.assertEquals("RUB", s.defaultCurrency());
    }

    private static AppSetting setting(String key, String value) {
        AppSetting s = Mockito.mock(AppSetting.class);
        Mockito.when(s.getKey()).thenReturn(key);
        Mockito.when(s.getValue()).thenReturn(value);
        return s;
    }
}
