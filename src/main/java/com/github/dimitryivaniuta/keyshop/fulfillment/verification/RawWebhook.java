package com.github.dimitryivaniuta.keyshop.fulfillment.verification;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Provider notification exactly as received.
 *
 * @param provider provider name from the URL
 * @param headers  request headers, case-insensitive
 * @param body     raw body, needed byte-exact for signature checks
 */
public record RawWebhook(String provider, Map<String, String> headers, String body) {

    public RawWebhook {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = copy;
        provider = provider == null ? null : provider.trim().toLowerCase(Locale.ROOT);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
