package com.github.dimitryivaniuta.keyshop.fulfillment.verification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Looks up the verifier for a provider name.
 *
 * <p>Dedicated {@link PaymentVerifier} beans win; every other provider under {@code app.providers} gets a
 * {@link HmacPaymentVerifier}.</p>
 */
@Slf4j
@Component
public class PaymentVerifierRegistry {

    private final Map<String, PaymentVerifier> verifiers = new HashMap<>();

    public PaymentVerifierRegistry(ObjectProvider<PaymentVerifier> beans, AppProperties properties, ObjectMapper objectMapper) {
        properties.getProviders().forEach((name, cfg) -> verifiers.put(name.toLowerCase(Locale.ROOT),
                new HmacPaymentVerifier(name, cfg.getSecret(), cfg.getSignatureHeader(), objectMapper)));
        beans.orderedStream().forEach(v -> verifiers.put(v.provider().toLowerCase(Locale.ROOT), v));
        log.info("Payment verifiers registered: {}", verifiers.keySet());
    }

    public Optional<PaymentVerifier> find(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(verifiers.get(provider.trim().toLowerCase(Locale.ROOT)));
    }
}
