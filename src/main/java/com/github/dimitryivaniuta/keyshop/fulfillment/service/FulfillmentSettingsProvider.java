package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties.ReferralScheme;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.AppSetting;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.AppSettingRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentSettings;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Builds the settings snapshot for one fulfillment run.
 *
 * <p>Defaults come from {@code app.fulfillment.*}; operators override them in {@code app_settings}. A value
 * that does not parse is logged and the default is kept.</p>
 */
@Slf4j
@Service
public class FulfillmentSettingsProvider {

    static final String REFERRALS_ENABLED = "referrals_enabled";
    static final String REFERRAL_SCHEME = "referral_scheme";
    static final String REFERRAL_PERCENT = "referral_percent";
    static final String REFERRAL_FIXED_AMOUNT = "referral_fixed_amount";
    static final String FRANCHISE_PERCENT = "franchise_percent";
    static final String CARD_PAYMENT_METHODS = "card_payment_methods";
    static final String DEFAULT_CURRENCY = "default_currency";

    private final AppSettingRepository repository;
    private final AppProperties properties;

    public FulfillmentSettingsProvider(AppSettingRepository repository, AppProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public FulfillmentSettings snapshot() {
        AppProperties.Fulfillment d = properties.getFulfillment();
        Map<String, String> o = overrides();

        return new FulfillmentSettings(
                parse(o, REFERRALS_ENABLED, Boolean::parseBoolean, d.isReferralsEnabled()),
                parse(o, REFERRAL_SCHEME, v -> ReferralScheme.valueOf(v.trim().toUpperCase(Locale.ROOT)), d.getReferralScheme()),
                parse(o, REFERRAL_PERCENT, v -> new BigDecimal(v.trim()), d.getReferralPercent()),
                parse(o, REFERRAL_FIXED_AMOUNT, v -> new BigDecimal(v.trim()), d.getReferralFixedAmount()),
                parse(o, FRANCHISE_PERCENT, v -> new BigDecimal(v.trim()), d.getFranchisePercent()),
                parse(o, CARD_PAYMENT_METHODS, FulfillmentSettingsProvider::methods,
                        d.getCardPaymentMethods().stream().map(m -> m.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toSet())),
                d.getBalancePaymentMethod(),
                parse(o, DEFAULT_CURRENCY, v -> v.trim().toUpperCase(Locale.ROOT), d.getDefaultCurrency())
        );
    }

    private Map<String, String> overrides() {
        Map<String, String> values = new HashMap<>();
        try {
            for (AppSetting s : repository.findAll()) {
                if (s.getValue() != null && !s.getValue().isBlank()) {
                    values.put(s.getKey(), s.getValue());
                }
            }
        } catch (DataAccessException e) {
            log.warn("Settings overrides unavailable, using defaults: {}", e.getMessage());
        }
        return values;
    }

    private static <T> T parse(Map<String, String> overrides, String key, Function<String, T> parser, T fallback) {
        String raw = overrides.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed setting {}='{}': {}", key, raw, e.getMessage());
            return fallback;
        }
    }

    private static Set<String> methods(String raw) {
        return Arrays.stream(raw.split(","))
                .map(m -> m.trim().toLowerCase(Locale.ROOT))
                .filter(m -> !m.isEmpty())
                .collect(Collectors.toSet());
    }
}
